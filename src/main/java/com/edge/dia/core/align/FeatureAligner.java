package com.edge.dia.core.align;

import com.edge.dia.core.model.AlignmentResult;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.CorrespondencePair;
import com.edge.dia.core.model.FeaturePoint;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.model.MatchStatistics;
import com.edge.dia.core.model.TransformClass;
import com.edge.dia.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 特征配准器
 * <p>
 * 计算把科学图像映射到参考图像像素网格的变换：
 * 1. 百分位裁剪归一化
 * 2. 检测特征点（可选只在中心窗口内检测，坐标再偏移回整幅图像）
 * 3. 匹配特征点
 * 4. RANSAC 稳健估计
 * <p>
 * 找不到特征或匹配不足只返回 success=false，不抛异常；只有图像本身非法时抛 {@link InputException}。
 * 无状态，可被多个线程共享。
 */
public class FeatureAligner {

    private static final Logger logger = LoggerFactory.getLogger(FeatureAligner.class);

    private final AlignmentOptions options;
    private final FeatureDetector detector;
    private final FeatureMatcher matcher;
    private final IntensityNormalizer normalizer;
    private final RobustTransformEstimator estimator;

    public FeatureAligner(AlignmentOptions options) {
        this(options, createDetector(options), createMatcher(options));
    }

    public FeatureAligner(AlignmentOptions options, FeatureDetector detector, FeatureMatcher matcher) {
        options.validate();
        this.options = options;
        this.detector = detector;
        this.matcher = matcher;
        this.normalizer = new IntensityNormalizer(options.getNormalizationLowPercentile(),
            options.getNormalizationHighPercentile());
        this.estimator = RobustTransformEstimator.from(options);
    }

    public static FeatureDetector createDetector(AlignmentOptions options) {
        switch (options.getFeatureDetector()) {
            case ORB:
                return new OrbFeatureDetector(options.getMaxFeatures());
            case ASTERISM:
            default:
                return new StarFeatureDetector(options.getMaxStars(), options.getDetectionSigma());
        }
    }

    public static FeatureMatcher createMatcher(AlignmentOptions options) {
        switch (options.getFeatureDetector()) {
            case ORB:
                return new HammingFeatureMatcher(options.getMatchDistanceCutoff());
            case ASTERISM:
            default:
                return new AsterismMatcher(options.getMaxTriangleStars(), options.getTriangleTolerance(),
                    options.getMinVotes());
        }
    }

    /**
     * 配准科学图像到参考图像
     *
     * @param reference 参考图像，决定目标坐标系
     * @param science   科学图像
     */
    public AlignmentResult align(Image reference, Image science) {
        if (reference == null || science == null) {
            throw new InputException("Reference and science images are required for alignment");
        }
        TransformClass transformClass = options.getTransformClass();
        long start = System.currentTimeMillis();

        List<FeaturePoint> refPoints = detect(reference);
        List<FeaturePoint> sciPoints = detect(science);
        logger.info("Detected keypoints with {}: reference={}, science={}",
            detector.name(), refPoints.size(), sciPoints.size());

        if (refPoints.isEmpty() || sciPoints.isEmpty()) {
            MatchStatistics stats = new MatchStatistics(refPoints.size(), sciPoints.size(), 0, 0);
            return AlignmentResult.failure(transformClass, stats, "No keypoints detected");
        }

        List<CorrespondencePair> pairs = matcher.match(sciPoints, refPoints);
        logger.info("Found {} correspondences", pairs.size());

        EstimationResult estimation = estimator.estimate(pairs, transformClass);
        if (!estimation.isSuccess() && options.isEscalateOnFailure() && transformClass == TransformClass.RIGID) {
            logger.warn("Rigid fit failed ({}), retrying as similarity", estimation.getMessage());
            transformClass = TransformClass.SIMILARITY;
            estimation = estimator.estimate(pairs, transformClass);
        }

        MatchStatistics stats = new MatchStatistics(refPoints.size(), sciPoints.size(), pairs.size(),
            estimation.getInlierCount());
        if (!estimation.isSuccess()) {
            logger.warn("Alignment failed: {} ({})", estimation.getMessage(), stats);
            return AlignmentResult.failure(transformClass, stats, estimation.getMessage());
        }

        AlignmentTransform transform = estimation.getTransform();
        logger.info("Alignment succeeded in {} ms: {}, rms={} px, {}",
            System.currentTimeMillis() - start, transform.describe(),
            String.format("%.3f", estimation.getRmsError()), stats);
        return AlignmentResult.success(transform, stats);
    }

    /**
     * 从已有匹配点对直接估计变换
     */
    public EstimationResult estimate(List<CorrespondencePair> pairs) {
        return estimator.estimate(pairs, options.getTransformClass());
    }

    private List<FeaturePoint> detect(Image image) {
        Image normalized = normalizer.normalize(image);
        int w = image.getWidth();
        int h = image.getHeight();
        int size = options.getCentralRegionSize();
        boolean useWindow = options.isUseCentralRegion()
            && Math.min(w, h) >= options.getMinImageSize()
            && size < Math.min(w, h);
        if (!useWindow) {
            return detector.detectAndDescribe(normalized);
        }
        int x0 = (w - size) / 2;
        int y0 = (h - size) / 2;
        logger.debug("Using central region ({}, {}) {}x{}", x0, y0, size, size);
        List<FeaturePoint> local = detector.detectAndDescribe(normalized.crop(x0, y0, size, size));
        List<FeaturePoint> shifted = new ArrayList<>(local.size());
        for (FeaturePoint p : local) {
            shifted.add(p.offset(x0, y0));
        }
        return shifted;
    }

    public AlignmentOptions getOptions() {
        return options;
    }
}
