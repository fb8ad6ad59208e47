package com.edge.dia.core.align;

import com.edge.dia.core.model.FeaturePoint;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.support.SigmaClippedStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 星点检测器
 * <p>
 * 1. sigma-clipped 统计得到背景与噪声
 * 2. 5x5 邻域局部极大值且高于 median + k*sigma 作为峰值
 * 3. 亮度降序做 3 像素非极大值抑制
 * 4. 7x7 窗口内扣除背景后加权求质心
 * <p>
 * 描述子为 {峰值, 窗口内积分亮度}，匹配器据此挑选最亮的星点组三角形。
 */
public class StarFeatureDetector implements FeatureDetector {

    private static final Logger logger = LoggerFactory.getLogger(StarFeatureDetector.class);

    private static final int PEAK_RADIUS = 2;
    private static final int CENTROID_RADIUS = 3;
    private static final double SUPPRESSION_RADIUS = 3.0;

    private final int maxStars;
    private final double detectionSigma;

    public StarFeatureDetector(int maxStars, double detectionSigma) {
        this.maxStars = maxStars;
        this.detectionSigma = detectionSigma;
    }

    @Override
    public String name() {
        return "asterism";
    }

    @Override
    public List<FeaturePoint> detectAndDescribe(Image image) {
        int w = image.getWidth();
        int h = image.getHeight();
        float[][] p = image.toArray();
        SigmaClippedStats stats = SigmaClippedStats.ofPixels(p, null, false);
        if (stats.getStd() <= 0) {
            logger.debug("Image has no background variation, no stars detected");
            return new ArrayList<>();
        }
        double background = stats.getMedian();
        double threshold = background + detectionSigma * stats.getStd();

        List<int[]> peaks = new ArrayList<>();
        for (int y = PEAK_RADIUS; y < h - PEAK_RADIUS; y++) {
            for (int x = PEAK_RADIUS; x < w - PEAK_RADIUS; x++) {
                float v = p[y][x];
                if (v > threshold && isLocalMaximum(p, x, y)) {
                    peaks.add(new int[]{x, y});
                }
            }
        }
        peaks.sort(Comparator.comparingDouble((int[] pk) -> -p[pk[1]][pk[0]]));

        List<FeaturePoint> stars = new ArrayList<>();
        for (int[] pk : peaks) {
            if (stars.size() >= maxStars) {
                break;
            }
            FeaturePoint star = centroid(p, pk[0], pk[1], background);
            boolean suppressed = false;
            for (FeaturePoint s : stars) {
                if (s.distanceTo(star) < SUPPRESSION_RADIUS) {
                    suppressed = true;
                    break;
                }
            }
            if (!suppressed) {
                stars.add(star);
            }
        }
        logger.debug("Detected {} stars (threshold={}, peaks={})", stars.size(), threshold, peaks.size());
        return stars;
    }

    /**
     * 光栅顺序之前的邻居要求严格大于，之后的允许相等，平台只产生一个峰
     */
    private static boolean isLocalMaximum(float[][] p, int x, int y) {
        float v = p[y][x];
        for (int dy = -PEAK_RADIUS; dy <= PEAK_RADIUS; dy++) {
            for (int dx = -PEAK_RADIUS; dx <= PEAK_RADIUS; dx++) {
                if (dx == 0 && dy == 0) continue;
                float n = p[y + dy][x + dx];
                boolean before = dy < 0 || (dy == 0 && dx < 0);
                if (before ? n >= v : n > v) {
                    return false;
                }
            }
        }
        return true;
    }

    private static FeaturePoint centroid(float[][] p, int px, int py, double background) {
        int h = p.length;
        int w = p[0].length;
        double sum = 0;
        double sx = 0;
        double sy = 0;
        for (int y = Math.max(0, py - CENTROID_RADIUS); y <= Math.min(h - 1, py + CENTROID_RADIUS); y++) {
            for (int x = Math.max(0, px - CENTROID_RADIUS); x <= Math.min(w - 1, px + CENTROID_RADIUS); x++) {
                double v = p[y][x] - background;
                if (v > 0) {
                    sum += v;
                    sx += v * x;
                    sy += v * y;
                }
            }
        }
        float peak = p[py][px];
        if (sum <= 0) {
            return new FeaturePoint(px, py, peak, new float[]{peak, 0f});
        }
        return new FeaturePoint(sx / sum, sy / sum, peak, new float[]{peak, (float) sum});
    }
}
