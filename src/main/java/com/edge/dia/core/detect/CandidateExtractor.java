package com.edge.dia.core.detect;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.DifferenceStatistics;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.support.ConnectedComponents;
import com.edge.dia.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 候选提取器
 * <p>
 * 对差异图的非零像素做 4/8 连通标记，丢弃面积小于下限的连通域，
 * 对每个连通域汇总面积、峰值、均值、总信号、加权质心、二阶矩形状参数和带符号净通量。
 * 候选 id 按标记扫描顺序分配；开启排序时按中心距离与亮度的加权分降序输出。
 */
public class CandidateExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CandidateExtractor.class);

    /** 像素自身的方差 1/12，避免单行/单列连通域的长短轴比发散 */
    private static final double PIXEL_VARIANCE = 1.0 / 12.0;

    private final ExtractionOptions options;
    private final double centerWeight;
    private final double brightnessWeight;

    public CandidateExtractor(ExtractionOptions options) {
        options.validate();
        this.options = options;
        double[] weights = options.normalizedWeights();
        this.centerWeight = weights[0];
        this.brightnessWeight = weights[1];
    }

    public List<Candidate> extract(DifferenceMap map) {
        if (map == null) {
            throw new InputException("Difference map is required for candidate extraction");
        }
        int w = map.getWidth();
        int h = map.getHeight();
        List<Candidate> candidates = new ArrayList<>();
        if (map.countNonZero() == 0) {
            logger.info("Difference map is empty, no candidates");
            return candidates;
        }

        float[][] pixels = map.getPixels().toArray();
        ConnectedComponents components = ConnectedComponents.label(pixels, options.getConnectivity());
        int n = components.getCount();
        ComponentAccumulator[] acc = new ComponentAccumulator[n + 1];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int label = components.labelAt(x, y);
                if (label == 0) {
                    continue;
                }
                if (acc[label] == null) {
                    acc[label] = new ComponentAccumulator();
                }
                boolean edge = isEdgePixel(components, x, y, label);
                acc[label].add(x, y, pixels[y][x], map.getResidual(x, y), edge);
            }
        }

        DifferenceStatistics stats = map.getStatistics();
        double sigma = stats.effectiveSigma();
        double cx0 = (w - 1) / 2.0;
        double cy0 = (h - 1) / 2.0;
        int discarded = 0;
        for (int label = 1; label <= n; label++) {
            ComponentAccumulator a = acc[label];
            if (a == null || a.area < options.getMinCandidateArea()) {
                discarded++;
                continue;
            }
            Candidate.Builder b = a.toBuilder(label, sigma, w, h, cx0, cy0);
            b.referenceSignificance(referenceSignificance(map, a.centroidX(), a.centroidY()));
            candidates.add(b.build());
        }

        candidates = rank(candidates, w, h);
        logger.info("Extracted {} candidates ({} components below min area {})",
            candidates.size(), discarded, options.getMinCandidateArea());
        return candidates;
    }

    /**
     * 只保留达到最小面积的连通域像素，得到的图像再次提取结果不变
     */
    public Image retainComponents(DifferenceMap map) {
        float[][] pixels = map.getPixels().toArray();
        if (map.countNonZero() == 0) {
            return map.getPixels();
        }
        ConnectedComponents components = ConnectedComponents.label(pixels, options.getConnectivity());
        return map.getPixels().derive(components.removeSmall(pixels, options.getMinCandidateArea()));
    }

    private List<Candidate> rank(List<Candidate> candidates, int w, int h) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        double maxDistance = Math.hypot((w - 1) / 2.0, (h - 1) / 2.0);
        double maxTotal = 0;
        for (Candidate c : candidates) {
            maxTotal = Math.max(maxTotal, Math.abs(c.getTotal()));
        }
        List<Candidate> ranked = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            double centerScore = maxDistance > 0 ? (maxDistance - c.getCenterDistance()) / maxDistance : 1.0;
            double brightness = maxTotal > 0 ? Math.abs(c.getTotal()) / maxTotal : 0.0;
            ranked.add(c.withRankScore(centerWeight * centerScore + brightnessWeight * brightness));
        }
        if (options.isRankingEnabled()) {
            ranked.sort(Comparator.comparingDouble(Candidate::getRankScore).reversed()
                .thenComparingInt(Candidate::getId));
        }
        return ranked;
    }

    /**
     * 基准帧（被减去的一帧）在质心附近的峰值相对背景的显著性
     */
    private double referenceSignificance(DifferenceMap map, double cx, double cy) {
        Image reference = map.getBaseline();
        double refSigma = map.getStatistics().getBaselineSigma();
        if (reference == null || refSigma <= 0) {
            return 0.0;
        }
        int r = options.getReferenceWindowRadius();
        int px = (int) Math.round(cx);
        int py = (int) Math.round(cy);
        double peak = Double.NEGATIVE_INFINITY;
        for (int y = Math.max(0, py - r); y <= Math.min(reference.getHeight() - 1, py + r); y++) {
            for (int x = Math.max(0, px - r); x <= Math.min(reference.getWidth() - 1, px + r); x++) {
                peak = Math.max(peak, reference.get(x, y));
            }
        }
        return (peak - map.getStatistics().getBaselineBackground()) / refSigma;
    }

    private static boolean isEdgePixel(ConnectedComponents components, int x, int y, int label) {
        int w = components.getWidth();
        int h = components.getHeight();
        return x == 0 || y == 0 || x == w - 1 || y == h - 1
            || components.labelAt(x - 1, y) != label || components.labelAt(x + 1, y) != label
            || components.labelAt(x, y - 1) != label || components.labelAt(x, y + 1) != label;
    }

    public ExtractionOptions getOptions() {
        return options;
    }

    /**
     * 单个连通域的累加量
     */
    private static final class ComponentAccumulator {
        int area;
        int perimeter;
        double total;
        double peak = Double.NEGATIVE_INFINITY;
        double weight;
        double sx, sy, sxx, syy, sxy;
        double ux, uy;
        double netFlux;
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = -1, maxY = -1;

        void add(int x, int y, float value, float residual, boolean edge) {
            area++;
            if (edge) perimeter++;
            total += value;
            peak = Math.max(peak, value);
            double wgt = Math.abs(value);
            weight += wgt;
            sx += wgt * x;
            sy += wgt * y;
            sxx += wgt * x * x;
            syy += wgt * y * y;
            sxy += wgt * x * y;
            ux += x;
            uy += y;
            netFlux += residual;
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }

        double centroidX() {
            return weight > 0 ? sx / weight : ux / area;
        }

        double centroidY() {
            return weight > 0 ? sy / weight : uy / area;
        }

        Candidate.Builder toBuilder(int id, double sigma, int w, int h, double cx0, double cy0) {
            double cx = centroidX();
            double cy = centroidY();
            double mxx, myy, mxy;
            if (weight > 0) {
                mxx = sxx / weight - cx * cx;
                myy = syy / weight - cy * cy;
                mxy = sxy / weight - cx * cy;
            } else {
                mxx = myy = mxy = 0;
            }
            double half = (mxx + myy) / 2.0;
            double root = Math.sqrt(Math.max(0, ((mxx - myy) / 2.0) * ((mxx - myy) / 2.0) + mxy * mxy));
            double l1 = Math.max(0, half + root);
            double l2 = Math.max(0, half - root);
            double elongation = Math.sqrt((l1 + PIXEL_VARIANCE) / (l2 + PIXEL_VARIANCE));
            double compactness = perimeter > 0 ? Math.min(1.0, 4 * Math.PI * area / ((double) perimeter * perimeter)) : 1.0;
            boolean boundary = minX == 0 || minY == 0 || maxX == w - 1 || maxY == h - 1;

            Candidate.Builder b = Candidate.builder()
                .id(id)
                .x(cx)
                .y(cy)
                .area(area)
                .peak(peak)
                .mean(total / area)
                .total(total)
                .snr(total / (sigma * Math.sqrt(area)))
                .elongation(elongation)
                .compactness(compactness)
                .netFlux(netFlux)
                .touchesBoundary(boundary)
                .edgeDistance(Math.min(Math.min(cx, cy), Math.min(w - 1 - cx, h - 1 - cy)))
                .centerDistance(Math.hypot(cx - cx0, cy - cy0))
                .bounds(minX, minY, maxX, maxY);
            if (boundary) {
                b.flag(Candidate.FLAG_BOUNDARY);
            }
            if (netFlux < 0) {
                b.flag(Candidate.FLAG_NEGATIVE);
            }
            return b;
        }
    }
}
