package com.edge.dia.service;

import com.edge.dia.config.DiaProperties;
import com.edge.dia.core.align.AlignmentOptions;
import com.edge.dia.core.align.FeatureDetectorType;
import com.edge.dia.core.annotate.AnnotationOptions;
import com.edge.dia.core.annotate.CatalogWriter;
import com.edge.dia.core.annotate.MarkerMetric;
import com.edge.dia.core.detect.ExtractionOptions;
import com.edge.dia.core.difference.CleaningOptions;
import com.edge.dia.core.difference.CleaningPreset;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.model.TransformClass;
import com.edge.dia.core.pipeline.DiaPipeline;
import com.edge.dia.core.pipeline.FailureReason;
import com.edge.dia.core.pipeline.PipelineListener;
import com.edge.dia.core.pipeline.PipelineResult;
import com.edge.dia.core.scoring.ScoringOptions;
import com.edge.dia.core.scoring.ScoringStrategy;
import com.edge.dia.dto.ConfigUpdateRequest;
import com.edge.dia.dto.ProcessRequest;
import com.edge.dia.exception.ConfigurationException;
import com.edge.dia.exception.InputException;
import com.edge.dia.io.FitsImageIO;
import com.edge.dia.io.RunReport;
import com.edge.dia.io.RunReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单对图像处理服务
 * <p>
 * 读取 FITS，运行流水线，把配准图、差异图、标记图、星表和运行报告写到输出目录：
 * {name}_aligned.fits / {name}_difference.fits / {name}_marked.fits / {name}_catalog.txt / {name}_report.json
 */
@Service
public class DiaService {
    private static final Logger logger = LoggerFactory.getLogger(DiaService.class);

    @Autowired
    private DiaProperties properties;

    @Autowired
    private DiaPipeline diaPipeline;

    @Autowired
    private PipelineListener pipelineListener;

    @Autowired
    private FitsImageIO fitsImageIO;

    @Autowired
    private CatalogWriter catalogWriter;

    @Autowired
    private RunReportWriter runReportWriter;

    @Autowired
    private ObjectMapper objectMapper;

    // 配置更新时整体替换，进行中的运行继续使用旧实例
    private final AtomicReference<DiaPipeline> pipeline = new AtomicReference<>();

    @PostConstruct
    public void init() {
        pipeline.set(diaPipeline);
    }

    /**
     * 处理一个请求
     * <p>
     * 输入不可读或流水线失败时返回 success=false 的报告；只有输出文件写入失败才抛出 IOException。
     */
    public RunReport process(ProcessRequest request) throws IOException {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        String sourcePath = request.sourcePath();
        Path outputDir = Paths.get(request.getOutputDirectory() != null && !request.getOutputDirectory().isBlank()
            ? request.getOutputDirectory()
            : properties.getOutput().getDirectory());
        String name = request.getOutputName() != null && !request.getOutputName().isBlank()
            ? request.getOutputName()
            : stem(sourcePath, runId);

        PipelineResult result;
        try {
            DiaPipeline current = pipeline.get();
            if (request.isDifferenceOnly()) {
                Image difference = fitsImageIO.load(requirePath(request.getDifferencePath(), "differencePath"));
                result = current.runOnDifference(difference, runId);
            } else {
                Image reference = fitsImageIO.load(requirePath(request.getReferencePath(), "referencePath"));
                Image science = fitsImageIO.load(requirePath(request.getSciencePath(), "sciencePath"));
                result = current.run(reference, science, runId);
            }
        } catch (InputException e) {
            logger.warn("[{}] Cannot load input: {}", runId, e.getMessage());
            RunReport report = RunReport.failure(runId, FailureReason.INPUT_ERROR, e.getMessage());
            report.setReferencePath(request.getReferencePath());
            report.setSciencePath(sourcePath);
            return report;
        }

        RunReport report = RunReport.from(result);
        report.setReferencePath(request.getReferencePath());
        report.setSciencePath(sourcePath);
        if (result.isSuccess()) {
            writeOutputs(result, outputDir, name, report);
        }
        Path reportPath = outputDir.resolve(name + "_report.json");
        report.getOutputs().put("report", reportPath.toString());
        runReportWriter.write(report, reportPath);

        logger.info("[{}] {} -> success={}, candidates={}, {} ms", runId, name, report.isSuccess(),
            report.getCandidates().size(), result.getElapsedMillis());
        return report;
    }

    private void writeOutputs(PipelineResult result, Path outputDir, String name, RunReport report) throws IOException {
        DifferenceMap map = result.getDifferenceMap();
        List<String> history = history(result);
        DiaProperties.OutputConfig output = properties.getOutput();

        if (output.isSaveAligned() && map.getAlignedScience() != null) {
            Path path = outputDir.resolve(name + "_aligned.fits");
            fitsImageIO.save(map.getAlignedScience(), path, history);
            report.getOutputs().put("aligned", path.toString());
        }
        if (output.isSaveDifference()) {
            Path path = outputDir.resolve(name + "_difference.fits");
            fitsImageIO.save(map.getPixels(), path, history);
            report.getOutputs().put("difference", path.toString());
        }
        if (output.isSaveMarked() && result.getAnnotatedImage() != null) {
            Path path = outputDir.resolve(name + "_marked.fits");
            fitsImageIO.save(result.getAnnotatedImage(), path, history);
            report.getOutputs().put("marked", path.toString());
        }
        Path catalogPath = outputDir.resolve(name + "_catalog.txt");
        catalogWriter.write(result.getCatalog(), catalogPath);
        report.getOutputs().put("catalog", catalogPath.toString());
    }

    private static List<String> history(PipelineResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("DIA run " + result.getRunId());
        if (result.getAlignment() != null) {
            lines.add("Alignment " + (result.isAlignmentSuccess() ? "ok" : "identity fallback"));
            lines.add(result.getAlignment().getTransform().describe());
        }
        if (result.getScoring() != null) {
            lines.add("Scoring " + result.getScoring().getStrategy() + " cutoff " + result.getScoring().getCutoff());
        }
        lines.add("Accepted candidates: " + result.getCandidateCount());
        return lines;
    }

    /**
     * 当前生效的参数
     */
    public Map<String, Object> currentConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("alignment", properties.getAlignment());
        config.put("difference", properties.getDifference());
        config.put("extraction", properties.getExtraction());
        config.put("scoring", properties.getScoring());
        config.put("annotation", properties.getAnnotation());
        config.put("catalog", properties.getCatalog());
        config.put("batch", properties.getBatch());
        config.put("output", properties.getOutput());
        return config;
    }

    /**
     * 更新参数并重建流水线
     * <p>
     * 在副本上应用并校验，全部合法才替换生效配置；非法时抛 ConfigurationException，原配置不变。
     */
    public synchronized Map<String, Object> updateConfig(ConfigUpdateRequest update) {
        AlignmentOptions alignment = copy(properties.getAlignment(), AlignmentOptions.class);
        CleaningOptions difference = copy(properties.getDifference(), CleaningOptions.class);
        ExtractionOptions extraction = copy(properties.getExtraction(), ExtractionOptions.class);
        ScoringOptions scoring = copy(properties.getScoring(), ScoringOptions.class);
        AnnotationOptions annotation = copy(properties.getAnnotation(), AnnotationOptions.class);

        if (update.getTransformClass() != null) {
            alignment.setTransformClass(TransformClass.fromString(update.getTransformClass()));
        }
        if (update.getFeatureDetector() != null) {
            alignment.setFeatureDetector(parseEnum(FeatureDetectorType.class, update.getFeatureDetector(), "featureDetector"));
        }
        if (update.getUseCentralRegion() != null) {
            alignment.setUseCentralRegion(update.getUseCentralRegion());
        }
        if (update.getCentralRegionSize() != null) {
            alignment.setCentralRegionSize(update.getCentralRegionSize());
        }
        if (update.getPreset() != null) {
            difference.setPreset(parseEnum(CleaningPreset.class, update.getPreset(), "preset"));
        }
        if (update.getNoiseSigmaMultiplier() != null) {
            difference.setNoiseSigmaMultiplier(update.getNoiseSigmaMultiplier());
        }
        if (update.getMinCandidateArea() != null) {
            extraction.setMinCandidateArea(update.getMinCandidateArea());
        }
        if (update.getScoringStrategy() != null) {
            scoring.setStrategy(parseEnum(ScoringStrategy.class, update.getScoringStrategy(), "scoringStrategy"));
        }
        if (update.getReliabilityCutoff() != null) {
            scoring.setReliabilityCutoff(update.getReliabilityCutoff());
        }
        if (update.getMinRadius() != null) {
            annotation.setMinRadius(update.getMinRadius());
        }
        if (update.getMaxRadius() != null) {
            annotation.setMaxRadius(update.getMaxRadius());
        }
        if (update.getMarkerMetric() != null) {
            annotation.setMarkerMetric(parseEnum(MarkerMetric.class, update.getMarkerMetric(), "markerMetric"));
        }

        DiaPipeline rebuilt = DiaPipeline.create(alignment, difference, extraction, scoring, annotation, pipelineListener);
        properties.setAlignment(alignment);
        properties.setDifference(difference);
        properties.setExtraction(extraction);
        properties.setScoring(scoring);
        properties.setAnnotation(annotation);
        pipeline.set(rebuilt);
        logger.info("Pipeline reconfigured: transform={}, preset={}, strategy={}, cutoff={}",
            alignment.getTransformClass(), difference.getPreset(), scoring.getStrategy(), scoring.getReliabilityCutoff());
        return currentConfig();
    }

    private <T> T copy(T source, Class<T> type) {
        return objectMapper.convertValue(source, type);
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String option) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        throw new ConfigurationException("Unknown " + option + ": " + value);
    }

    private static Path requirePath(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InputException(field + " is required");
        }
        return Paths.get(value);
    }

    static String stem(String path, String fallback) {
        if (path == null || path.isBlank()) {
            return fallback;
        }
        String fileName = Paths.get(path).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
