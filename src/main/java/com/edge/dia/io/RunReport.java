package com.edge.dia.io;

import com.edge.dia.core.model.AlignmentResult;
import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.DifferenceStatistics;
import com.edge.dia.core.model.MatchStatistics;
import com.edge.dia.core.pipeline.FailureReason;
import com.edge.dia.core.pipeline.PipelineResult;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行报告，序列化为 JSON 写在输出目录并作为 REST 响应数据
 */
@Data
public class RunReport {

    private String runId;
    private Instant createdAt;
    private boolean success;
    private String failureReason;
    private String message;
    private long elapsedMillis;

    private String referencePath;
    private String sciencePath;

    private Alignment alignment;
    private Difference difference;
    private Scoring scoring;
    private List<CandidateRow> candidates = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();

    /** 输出文件类型 -> 路径 */
    private Map<String, String> outputs = new LinkedHashMap<>();

    @Data
    public static class Alignment {
        private boolean success;
        private boolean identityFallback;
        private String message;
        private String transformClass;
        private double rotationDegrees;
        private double scale;
        private double translationX;
        private double translationY;
        private double[][] matrix;
        private int referenceKeypoints;
        private int scienceKeypoints;
        private int correspondences;
        private int inliers;
        private double inlierRatio;
    }

    @Data
    public static class Difference {
        private double noiseFloor;
        private double noiseSigma;
        private double detectionThreshold;
        private double intensityFloor;
        private int coveredPixels;
        private int nonZeroPixels;
        private boolean emptyResidual;
        private Map<String, Integer> stagePixelCounts;
        private List<String> skippedStages;
    }

    @Data
    public static class Scoring {
        private String strategy;
        private double reliabilityCutoff;
        private int scored;
        private int accepted;
        private int rejected;
        private Map<String, Integer> labelCounts = new LinkedHashMap<>();
    }

    @Data
    public static class CandidateRow {
        private int id;
        private double x;
        private double y;
        private int area;
        private double peak;
        private double flux;
        private double snr;
        private double elongation;
        private double rankScore;
        private String label;
        private double confidence;
        private double reliability;
        private List<String> flags;
    }

    /**
     * 从流水线结果构建报告
     */
    public static RunReport from(PipelineResult result) {
        RunReport report = new RunReport();
        report.setRunId(result.getRunId());
        report.setCreatedAt(Instant.now());
        report.setSuccess(result.isSuccess());
        report.setFailureReason(result.getFailureReason() == null ? null : result.getFailureReason().name());
        report.setMessage(result.getMessage());
        report.setElapsedMillis(result.getElapsedMillis());
        report.getWarnings().addAll(result.getWarnings());

        AlignmentResult ar = result.getAlignment();
        if (ar != null) {
            Alignment a = new Alignment();
            a.setSuccess(ar.isSuccess());
            a.setIdentityFallback(result.isIdentityFallback());
            a.setMessage(ar.getMessage());
            a.setTransformClass(ar.getTransform().getTransformClass().name());
            a.setRotationDegrees(ar.getTransform().getRotationDegrees());
            a.setScale(ar.getTransform().getScale());
            a.setTranslationX(ar.getTransform().getTranslationX());
            a.setTranslationY(ar.getTransform().getTranslationY());
            a.setMatrix(ar.getTransform().getMatrix());
            MatchStatistics ms = ar.getStatistics();
            a.setReferenceKeypoints(ms.getReferenceKeypoints());
            a.setScienceKeypoints(ms.getScienceKeypoints());
            a.setCorrespondences(ms.getCorrespondences());
            a.setInliers(ms.getInliers());
            a.setInlierRatio(ms.getInlierRatio());
            report.setAlignment(a);
        }

        DifferenceMap map = result.getDifferenceMap();
        if (map != null) {
            DifferenceStatistics ds = map.getStatistics();
            Difference d = new Difference();
            d.setNoiseFloor(ds.getNoiseFloor());
            d.setNoiseSigma(ds.getNoiseSigma());
            d.setDetectionThreshold(ds.getDetectionThreshold());
            d.setIntensityFloor(ds.getIntensityFloor());
            d.setCoveredPixels(map.coveredPixelCount());
            d.setNonZeroPixels(map.countNonZero());
            d.setEmptyResidual(map.isEmptyResidual());
            d.setStagePixelCounts(map.getReport().getStagePixelCounts());
            d.setSkippedStages(map.getReport().getSkippedStages());
            report.setDifference(d);
        }

        if (result.getScoring() != null) {
            Scoring s = new Scoring();
            s.setStrategy(result.getScoring().getStrategy().name());
            s.setReliabilityCutoff(result.getScoring().getCutoff());
            s.setScored(result.getScoring().getScored().size());
            s.setAccepted(result.getScoring().getAccepted().size());
            s.setRejected(result.getScoring().getRejected().size());
            result.getScoring().labelCounts().forEach((label, count) -> s.getLabelCounts().put(label.name(), count));
            report.setScoring(s);
        }

        List<Candidate> rows = result.getCatalog() != null
            ? result.getCatalog().getRows()
            : result.getAcceptedCandidates();
        for (Candidate c : rows) {
            report.getCandidates().add(toRow(c));
        }
        return report;
    }

    /**
     * 流水线未能开始（例如输入文件不可读）时的报告
     */
    public static RunReport failure(String runId, FailureReason reason, String message) {
        RunReport report = new RunReport();
        report.setRunId(runId);
        report.setCreatedAt(Instant.now());
        report.setSuccess(false);
        report.setFailureReason(reason.name());
        report.setMessage(message);
        return report;
    }

    private static CandidateRow toRow(Candidate c) {
        CandidateRow row = new CandidateRow();
        row.setId(c.getId());
        row.setX(c.getX());
        row.setY(c.getY());
        row.setArea(c.getArea());
        row.setPeak(c.getPeak());
        row.setFlux(c.getTotal());
        row.setSnr(c.getSnr());
        row.setElongation(c.getElongation());
        row.setRankScore(c.getRankScore());
        row.setLabel(c.getLabel().name());
        row.setConfidence(c.getConfidence());
        row.setReliability(c.getReliability());
        row.setFlags(new ArrayList<>(c.getFlags()));
        return row;
    }
}
