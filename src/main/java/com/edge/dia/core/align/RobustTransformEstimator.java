package com.edge.dia.core.align;

import com.edge.dia.config.NativeLibraryLoader;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.CorrespondencePair;
import com.edge.dia.core.model.TransformClass;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * RANSAC 稳健变换估计
 * <p>
 * 相似变换用 {@code Calib3d.estimateAffinePartial2D}，单应性用 {@code Calib3d.findHomography}，
 * 内点以 OpenCV 返回的掩码为准。刚体变换先用相似模型筛内点，再在内点上做固定尺度的 Procrustes 拟合。
 * OpenCV 的 RANSAC 使用固定的内部随机种子，同样输入得到同样结果。
 */
public class RobustTransformEstimator {

    private static final Logger logger = LoggerFactory.getLogger(RobustTransformEstimator.class);

    private final double threshold;
    private final int maxIterations;
    private final double confidence;
    private final double minInlierRatio;
    private final int refineIterations;

    public RobustTransformEstimator(double threshold, int maxIterations, double confidence,
                                    double minInlierRatio, int refineIterations) {
        this.threshold = threshold;
        this.maxIterations = maxIterations;
        this.confidence = confidence;
        this.minInlierRatio = minInlierRatio;
        this.refineIterations = refineIterations;
    }

    public static RobustTransformEstimator from(AlignmentOptions options) {
        return new RobustTransformEstimator(options.getRansacThreshold(), options.getMaxIterations(),
            options.getConfidence(), options.getMinInlierRatio(), options.getRefineIterations());
    }

    /**
     * 从匹配点对估计科学 -> 参考的变换
     */
    public EstimationResult estimate(List<CorrespondencePair> pairs, TransformClass transformClass) {
        int n = pairs.size();
        int minRequired = transformClass.getMinCorrespondences();
        if (n < minRequired) {
            return EstimationResult.failure(n, String.format(
                "Insufficient correspondences for %s: %d < %d", transformClass, n, minRequired));
        }
        NativeLibraryLoader.loadNativeLibraries();

        double[][] src = new double[n][];
        double[][] dst = new double[n][];
        List<Point> srcPts = new ArrayList<>(n);
        List<Point> dstPts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            CorrespondencePair p = pairs.get(i);
            src[i] = new double[]{p.getScience().getX(), p.getScience().getY()};
            dst[i] = new double[]{p.getReference().getX(), p.getReference().getY()};
            srcPts.add(new Point(src[i][0], src[i][1]));
            dstPts.add(new Point(dst[i][0], dst[i][1]));
        }

        MatOfPoint2f srcMat = new MatOfPoint2f();
        srcMat.fromList(srcPts);
        MatOfPoint2f dstMat = new MatOfPoint2f();
        dstMat.fromList(dstPts);
        Mat inliers = new Mat();
        Mat model = null;
        boolean[] mask;
        AlignmentTransform transform;
        try {
            if (transformClass == TransformClass.HOMOGRAPHY) {
                model = Calib3d.findHomography(srcMat, dstMat, Calib3d.RANSAC, threshold, inliers,
                    maxIterations, confidence);
            } else {
                model = Calib3d.estimateAffinePartial2D(srcMat, dstMat, inliers, Calib3d.RANSAC, threshold,
                    maxIterations, confidence, refineIterations);
            }
            if (model.empty() || inliers.empty()) {
                return EstimationResult.failure(n, "RANSAC found no consensus model for " + transformClass);
            }
            mask = readMask(inliers, n);
            transform = toTransform(model, transformClass, src, dst, mask);
        } finally {
            srcMat.release();
            dstMat.release();
            inliers.release();
            if (model != null) {
                model.release();
            }
        }

        int inlierCount = 0;
        for (boolean b : mask) {
            if (b) inlierCount++;
        }
        if (transform == null) {
            return EstimationResult.failure(n, "Degenerate inlier set for " + transformClass);
        }
        double rms = rmsError(transform, src, dst, mask, inlierCount);
        double ratio = (double) inlierCount / n;
        logger.debug("RANSAC {}: inliers={}/{}, rms={}", transformClass, inlierCount, n, rms);

        if (inlierCount < minRequired) {
            return new EstimationResult(transform, mask, inlierCount, rms, false, String.format(
                "Insufficient inliers for %s: %d < %d", transformClass, inlierCount, minRequired));
        }
        if (ratio < minInlierRatio) {
            return new EstimationResult(transform, mask, inlierCount, rms, false, String.format(
                "Inlier ratio %.3f below floor %.3f", ratio, minInlierRatio));
        }
        // 刚体约束下内点残差超过阈值，说明两幅图之间存在尺度差
        if (!(rms <= threshold)) {
            return new EstimationResult(transform, mask, inlierCount, rms, false, String.format(
                "Inlier rms %.3f px exceeds threshold %.3f for %s", rms, threshold, transformClass));
        }
        return new EstimationResult(transform, mask, inlierCount, rms, true, "ok");
    }

    private static AlignmentTransform toTransform(Mat model, TransformClass transformClass,
                                                  double[][] src, double[][] dst, boolean[] mask) {
        switch (transformClass) {
            case RIGID:
                return TransformFitter.fitRigid(src, dst, mask);
            case SIMILARITY: {
                // 2x3 [a -b tx; b a ty]
                double[][] m = new double[3][3];
                for (int r = 0; r < 2; r++) {
                    for (int c = 0; c < 3; c++) {
                        m[r][c] = model.get(r, c)[0];
                    }
                }
                m[2][2] = 1.0;
                return new AlignmentTransform(m, TransformClass.SIMILARITY);
            }
            case HOMOGRAPHY: {
                double[][] m = new double[3][3];
                for (int r = 0; r < 3; r++) {
                    for (int c = 0; c < 3; c++) {
                        m[r][c] = model.get(r, c)[0];
                    }
                }
                try {
                    return new AlignmentTransform(m, TransformClass.HOMOGRAPHY);
                } catch (IllegalArgumentException e) {
                    logger.debug("Rejected homography: {}", e.getMessage());
                    return null;
                }
            }
            default:
                throw new IllegalArgumentException("Unsupported transform class: " + transformClass);
        }
    }

    private static boolean[] readMask(Mat inliers, int n) {
        boolean[] mask = new boolean[n];
        byte[] buffer = new byte[(int) inliers.total()];
        inliers.get(0, 0, buffer);
        for (int i = 0; i < n && i < buffer.length; i++) {
            mask[i] = buffer[i] != 0;
        }
        return mask;
    }

    private static double rmsError(AlignmentTransform transform, double[][] src, double[][] dst,
                                   boolean[] mask, int inlierCount) {
        if (inlierCount == 0) {
            return Double.NaN;
        }
        double sq = 0;
        for (int i = 0; i < src.length; i++) {
            if (!mask[i]) {
                continue;
            }
            double[] p = transform.apply(src[i][0], src[i][1]);
            double dx = p[0] - dst[i][0];
            double dy = p[1] - dst[i][1];
            sq += dx * dx + dy * dy;
        }
        return Math.sqrt(sq / inlierCount);
    }
}
