package com.edge.dia.core.align;

import com.edge.dia.core.model.TransformClass;
import com.edge.dia.exception.ConfigurationException;
import lombok.Data;

/**
 * 配准参数
 */
@Data
public class AlignmentOptions {

    private TransformClass transformClass = TransformClass.RIGID;

    /** 特征检测器：asterism（星点三角形）或 orb */
    private FeatureDetectorType featureDetector = FeatureDetectorType.ASTERISM;

    // 中心区域优化
    private boolean useCentralRegion = false;
    private int centralRegionSize = 200;
    private int minImageSize = 300;

    // 强度归一化百分位
    private double normalizationLowPercentile = 0.5;
    private double normalizationHighPercentile = 99.95;

    // ORB
    private int maxFeatures = 1000;
    private int matchDistanceCutoff = 64;

    // 星点检测
    private int maxStars = 60;
    private double detectionSigma = 5.0;
    private int maxTriangleStars = 20;
    private double triangleTolerance = 0.02;
    private int minVotes = 2;

    // RANSAC
    private double ransacThreshold = 3.0;
    private int maxIterations = 2000;
    private double confidence = 0.99;
    private double minInlierRatio = 0.25;
    /** OpenCV Levenberg-Marquardt 精化迭代次数 */
    private int refineIterations = 10;

    /** 配准失败时是否退化为恒等变换继续处理 */
    private boolean fallbackToIdentity = false;

    /** 刚体拟合失败时是否改用相似变换重试 */
    private boolean escalateOnFailure = false;

    public void validate() {
        if (transformClass == null) {
            throw new ConfigurationException("alignment.transform-class must be set");
        }
        if (featureDetector == null) {
            throw new ConfigurationException("alignment.feature-detector must be set");
        }
        if (centralRegionSize <= 0) {
            throw new ConfigurationException("alignment.central-region-size must be positive: " + centralRegionSize);
        }
        if (minImageSize <= 0) {
            throw new ConfigurationException("alignment.min-image-size must be positive: " + minImageSize);
        }
        if (normalizationLowPercentile < 0 || normalizationHighPercentile > 100
            || normalizationLowPercentile >= normalizationHighPercentile) {
            throw new ConfigurationException(String.format(
                "alignment normalization percentiles must satisfy 0 <= low < high <= 100: low=%s, high=%s",
                normalizationLowPercentile, normalizationHighPercentile));
        }
        if (maxFeatures <= 0 || maxStars <= 0) {
            throw new ConfigurationException("alignment.max-features and alignment.max-stars must be positive");
        }
        if (maxTriangleStars < 3) {
            throw new ConfigurationException("alignment.max-triangle-stars must be at least 3: " + maxTriangleStars);
        }
        if (triangleTolerance <= 0 || triangleTolerance >= 1) {
            throw new ConfigurationException("alignment.triangle-tolerance must be in (0, 1): " + triangleTolerance);
        }
        if (matchDistanceCutoff <= 0 || minVotes <= 0) {
            throw new ConfigurationException("alignment.match-distance-cutoff and alignment.min-votes must be positive");
        }
        if (ransacThreshold <= 0) {
            throw new ConfigurationException("alignment.ransac-threshold must be positive: " + ransacThreshold);
        }
        if (maxIterations <= 0 || refineIterations < 0) {
            throw new ConfigurationException("alignment.max-iterations must be positive and refine-iterations non-negative");
        }
        if (confidence <= 0 || confidence >= 1) {
            throw new ConfigurationException("alignment.confidence must be in (0, 1): " + confidence);
        }
        if (minInlierRatio < 0 || minInlierRatio > 1) {
            throw new ConfigurationException("alignment.min-inlier-ratio must be in [0, 1]: " + minInlierRatio);
        }
        if (detectionSigma <= 0) {
            throw new ConfigurationException("alignment.detection-sigma must be positive: " + detectionSigma);
        }
    }
}
