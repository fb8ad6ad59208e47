package com.edge.dia.core.scoring;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.support.OpenCvMats;
import com.edge.dia.core.support.SigmaClippedStats;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 多尺度评分
 * <p>
 * 残差在每个高斯尺度上平滑后重新阈值化，候选外接框内在该尺度仍超过阈值即视为被重检测；
 * 持续度 = 被重检测的尺度数 / 尺度总数，显著性 = 0.5 * 持续度 + 0.5 * SNR 显著性。
 * 候选位置做 DBSCAN 聚类，成簇的候选（常见于亮星残留、卫星轨迹碎片）显著性乘以惩罚系数。
 */
public class MultiScaleScorer extends RuleBasedScorer {

    private static final Logger logger = LoggerFactory.getLogger(MultiScaleScorer.class);

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    public MultiScaleScorer(ScoringOptions options) {
        super(options);
    }

    @Override
    public ScoringStrategy strategy() {
        return ScoringStrategy.MULTI_SCALE;
    }

    @Override
    protected List<Assessment> assess(List<Candidate> candidates, DifferenceMap map) {
        int n = candidates.size();
        int[] detections = new int[n];
        float[][] residual = map.residualCopy();
        boolean[][] coverage = new boolean[map.getHeight()][map.getWidth()];
        for (int y = 0; y < map.getHeight(); y++) {
            for (int x = 0; x < map.getWidth(); x++) {
                coverage[y][x] = map.isCovered(x, y);
            }
        }

        for (double scale : options.getScales()) {
            float[][] smoothed = smooth(residual, scale);
            SigmaClippedStats stats = SigmaClippedStats.ofPixels(smoothed, coverage, false);
            if (stats.getStd() <= 0) {
                continue;
            }
            double threshold = stats.getMedian() + options.getMultiScaleSigma() * stats.getStd();
            for (int i = 0; i < n; i++) {
                if (detectedInBounds(smoothed, candidates.get(i), threshold)) {
                    detections[i]++;
                }
            }
        }

        boolean[] clustered = cluster(candidates);
        List<Assessment> out = new ArrayList<>(n);
        int scales = options.getScales().size();
        for (int i = 0; i < n; i++) {
            double persistence = (double) detections[i] / scales;
            double significance = 0.5 * persistence + 0.5 * snrSignificance(candidates.get(i));
            Set<String> flags = Collections.emptySet();
            if (clustered[i]) {
                significance *= options.getClusterPenalty();
                flags = Collections.singleton(Candidate.FLAG_CLUSTERED);
            }
            out.add(new Assessment(significance, false, flags));
        }
        return out;
    }

    private boolean[] cluster(List<Candidate> candidates) {
        boolean[] clustered = new boolean[candidates.size()];
        if (candidates.size() < options.getClusterMinPoints()) {
            return clustered;
        }
        List<CandidatePoint> points = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            points.add(new CandidatePoint(i, candidates.get(i)));
        }
        DBSCANClusterer<CandidatePoint> clusterer =
            new DBSCANClusterer<>(options.getClusterEps(), options.getClusterMinPoints());
        List<Cluster<CandidatePoint>> clusters = clusterer.cluster(points);
        for (Cluster<CandidatePoint> c : clusters) {
            for (CandidatePoint p : c.getPoints()) {
                clustered[p.getIndex()] = true;
            }
        }
        logger.debug("DBSCAN found {} clusters among {} candidates", clusters.size(), candidates.size());
        return clustered;
    }

    private static boolean detectedInBounds(float[][] smoothed, Candidate c, double threshold) {
        for (int y = c.getMinY(); y <= c.getMaxY(); y++) {
            for (int x = c.getMinX(); x <= c.getMaxX(); x++) {
                if (smoothed[y][x] >= threshold) {
                    return true;
                }
            }
        }
        return false;
    }

    private static float[][] smooth(float[][] residual, double sigma) {
        Mat src = OpenCvMats.toMat(residual);
        Mat dst = new Mat();
        try {
            Imgproc.GaussianBlur(src, dst, new Size(0, 0), sigma);
            return OpenCvMats.toArray(dst);
        } finally {
            OpenCvMats.release(src, dst);
        }
    }
}
