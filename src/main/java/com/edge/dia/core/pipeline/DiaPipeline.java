package com.edge.dia.core.pipeline;

import com.edge.dia.core.align.AlignmentOptions;
import com.edge.dia.core.align.FeatureAligner;
import com.edge.dia.core.annotate.AnnotationOptions;
import com.edge.dia.core.annotate.Annotator;
import com.edge.dia.core.detect.CandidateExtractor;
import com.edge.dia.core.detect.ExtractionOptions;
import com.edge.dia.core.difference.CleaningOptions;
import com.edge.dia.core.difference.DifferenceEngine;
import com.edge.dia.core.model.AlignmentResult;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.Catalog;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.scoring.CandidateScorer;
import com.edge.dia.core.scoring.CandidateScorerFactory;
import com.edge.dia.core.scoring.ScoringOptions;
import com.edge.dia.core.scoring.ScoringResult;
import com.edge.dia.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 差异图像分析流水线
 * <p>
 * 配准 -> 差异与清理 -> 候选提取 -> 评分 -> 标记与星表。
 * 各组件无状态，同一实例可被多个线程同时用于不同的图像对。
 * {@link #run} 从不因数据问题抛异常，失败以 {@link PipelineResult#getFailureReason()} 返回。
 */
public class DiaPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DiaPipeline.class);

    private final FeatureAligner aligner;
    private final DifferenceEngine engine;
    private final CandidateExtractor extractor;
    private final CandidateScorer scorer;
    private final Annotator annotator;
    private final PipelineListener listener;

    public DiaPipeline(FeatureAligner aligner, DifferenceEngine engine, CandidateExtractor extractor,
                       CandidateScorer scorer, Annotator annotator, PipelineListener listener) {
        this.aligner = aligner;
        this.engine = engine;
        this.extractor = extractor;
        this.scorer = scorer;
        this.annotator = annotator;
        this.listener = listener == null ? PipelineListener.NOOP : listener;
    }

    /**
     * 按各组参数构建流水线，参数非法时抛 ConfigurationException
     */
    public static DiaPipeline create(AlignmentOptions alignment, CleaningOptions cleaning,
                                     ExtractionOptions extraction, ScoringOptions scoring,
                                     AnnotationOptions annotation, PipelineListener listener) {
        return new DiaPipeline(
            new FeatureAligner(alignment),
            new DifferenceEngine(cleaning),
            new CandidateExtractor(extraction),
            CandidateScorerFactory.create(scoring),
            new Annotator(annotation),
            listener);
    }

    public PipelineResult run(Image reference, Image science) {
        return run(reference, science, newRunId());
    }

    /**
     * 处理一对图像
     *
     * @param reference 参考图像，结果位于它的像素网格上
     * @param science   科学图像
     * @param runId     运行标识，出现在事件与日志中
     */
    public PipelineResult run(Image reference, Image science, String runId) {
        long start = System.currentTimeMillis();
        PipelineResult.Builder result = PipelineResult.builder(runId);
        try {
            if (reference == null || science == null) {
                throw new InputException("Both reference and science images are required");
            }

            AlignmentResult alignment = aligner.align(reference, science);
            result.alignment(alignment);
            AlignmentTransform transform = alignment.getTransform();
            if (alignment.isSuccess()) {
                emit(runId, PipelineStage.ALIGNMENT, "aligned", metrics(
                    "transform", transform.describe(),
                    "inliers", alignment.getStatistics().getInliers(),
                    "inlierRatio", alignment.getStatistics().getInlierRatio()));
            } else if (aligner.getOptions().isFallbackToIdentity()) {
                String warning = "Alignment failed (" + alignment.getMessage() + "), continuing with identity transform";
                warn(runId, PipelineStage.ALIGNMENT, warning);
                result.warning(warning).identityFallback(true);
                transform = AlignmentTransform.identity(aligner.getOptions().getTransformClass());
            } else {
                warn(runId, PipelineStage.ALIGNMENT, "Alignment failed: " + alignment.getMessage());
                return result.failure(FailureReason.ALIGNMENT_FAILED, alignment.getMessage())
                    .elapsedMillis(System.currentTimeMillis() - start)
                    .build();
            }

            DifferenceMap map = engine.compute(reference, science, transform);
            return finish(runId, map, reference, science, result, start);
        } catch (InputException e) {
            logger.warn("[{}] Input rejected: {}", runId, e.getMessage());
            return result.failure(FailureReason.INPUT_ERROR, e.getMessage())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
        } catch (RuntimeException e) {
            logger.error("[{}] Pipeline failed unexpectedly", runId, e);
            return result.failure(FailureReason.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
        }
    }

    public PipelineResult runOnDifference(Image rawDifference) {
        return runOnDifference(rawDifference, newRunId());
    }

    /**
     * 跳过配准，直接对已有的差异图清理、提取、评分
     */
    public PipelineResult runOnDifference(Image rawDifference, String runId) {
        long start = System.currentTimeMillis();
        PipelineResult.Builder result = PipelineResult.builder(runId);
        try {
            DifferenceMap map = engine.clean(rawDifference);
            return finish(runId, map, null, null, result, start);
        } catch (InputException e) {
            logger.warn("[{}] Input rejected: {}", runId, e.getMessage());
            return result.failure(FailureReason.INPUT_ERROR, e.getMessage())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
        } catch (RuntimeException e) {
            logger.error("[{}] Pipeline failed unexpectedly", runId, e);
            return result.failure(FailureReason.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
        }
    }

    private PipelineResult finish(String runId, DifferenceMap map, Image reference, Image science,
                                  PipelineResult.Builder result, long start) {
        result.differenceMap(map).warnings(map.getReport().getWarnings());
        emit(runId, PipelineStage.DIFFERENCE, "difference cleaned", metrics(
            "nonZeroPixels", map.countNonZero(),
            "noiseSigma", map.getStatistics().getNoiseSigma(),
            "threshold", map.getStatistics().getDetectionThreshold()));

        List<Candidate> candidates = extractor.extract(map);
        emit(runId, PipelineStage.EXTRACTION, "candidates extracted", metrics("count", candidates.size()));

        ScoringResult scoring = scorer.score(candidates, map);
        result.scoring(scoring);
        emit(runId, PipelineStage.SCORING, "candidates scored", metrics(
            "strategy", scoring.getStrategy(),
            "accepted", scoring.getAccepted().size(),
            "rejected", scoring.getRejected().size(),
            "labels", scoring.labelCounts()));

        Image base = selectBase(map, reference, science);
        Image annotated = annotator.annotate(base, scoring.getAccepted());
        Catalog catalog = new Catalog(map.getWidth(), map.getHeight(), catalogParameters(scoring), scoring.getAccepted());
        result.annotatedImage(annotated).catalog(catalog);
        emit(runId, PipelineStage.ANNOTATION, "marked image and catalog built", metrics("rows", catalog.size()));

        long elapsed = System.currentTimeMillis() - start;
        emit(runId, PipelineStage.COMPLETE, "run completed", metrics("elapsedMs", elapsed));
        return result.elapsedMillis(elapsed).build();
    }

    private Image selectBase(DifferenceMap map, Image reference, Image science) {
        switch (annotator.getOptions().getBaseImage()) {
            case REFERENCE:
                return reference != null ? reference : map.getPixels();
            case SCIENCE:
                if (map.getAlignedScience() != null) {
                    return map.getAlignedScience();
                }
                return science != null && science.getWidth() == map.getWidth()
                    && science.getHeight() == map.getHeight() ? science : map.getPixels();
            case DIFFERENCE:
            default:
                return map.getPixels();
        }
    }

    private Map<String, Object> catalogParameters(ScoringResult scoring) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("transform_class", aligner.getOptions().getTransformClass());
        params.put("use_central_region", aligner.getOptions().isUseCentralRegion());
        params.put("central_region_size", aligner.getOptions().getCentralRegionSize());
        params.put("difference_mode", engine.getOptions().getMode());
        params.put("noise_sigma_multiplier", engine.getOptions().getNoiseSigmaMultiplier());
        params.put("intensity_threshold", engine.getOptions().getIntensityThreshold());
        params.put("min_component_size", engine.getOptions().getMinComponentSize());
        params.put("min_candidate_area", extractor.getOptions().getMinCandidateArea());
        params.put("scoring_strategy", scoring.getStrategy());
        params.put("reliability_cutoff", scoring.getCutoff());
        params.put("min_radius", annotator.getOptions().getMinRadius());
        params.put("max_radius", annotator.getOptions().getMaxRadius());
        params.put("marker_metric", annotator.getOptions().getMarkerMetric());
        return params;
    }

    private void emit(String runId, PipelineStage stage, String message, Map<String, Object> metrics) {
        notifyListener(PipelineEvent.info(runId, stage, message, metrics));
    }

    private void warn(String runId, PipelineStage stage, String message) {
        notifyListener(PipelineEvent.warning(runId, stage, message));
    }

    private void notifyListener(PipelineEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Pipeline listener failed on {}: {}", event.getStage(), e.getMessage());
        }
    }

    private static Map<String, Object> metrics(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public FeatureAligner getAligner() { return aligner; }
    public DifferenceEngine getEngine() { return engine; }
    public CandidateExtractor getExtractor() { return extractor; }
    public CandidateScorer getScorer() { return scorer; }
    public Annotator getAnnotator() { return annotator; }
}
