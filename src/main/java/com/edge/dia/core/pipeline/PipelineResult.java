package com.edge.dia.core.pipeline;

import com.edge.dia.core.model.AlignmentResult;
import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.Catalog;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.scoring.ScoringResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次流水线运行的结构化结果
 * <p>
 * 成功时携带各阶段产物；失败时 {@link #getFailureReason()} 给出机器可读原因，
 * 已完成阶段的产物（例如失败的配准结果）仍然保留。
 */
public final class PipelineResult {

    private final String runId;
    private final boolean success;
    private final FailureReason failureReason;
    private final String message;
    private final AlignmentResult alignment;
    private final boolean identityFallback;
    private final DifferenceMap differenceMap;
    private final ScoringResult scoring;
    private final Image annotatedImage;
    private final Catalog catalog;
    private final List<String> warnings;
    private final long elapsedMillis;

    private PipelineResult(Builder b) {
        this.runId = b.runId;
        this.success = b.failureReason == null;
        this.failureReason = b.failureReason;
        this.message = b.message;
        this.alignment = b.alignment;
        this.identityFallback = b.identityFallback;
        this.differenceMap = b.differenceMap;
        this.scoring = b.scoring;
        this.annotatedImage = b.annotatedImage;
        this.catalog = b.catalog;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
        this.elapsedMillis = b.elapsedMillis;
    }

    static Builder builder(String runId) {
        return new Builder(runId);
    }

    public String getRunId() { return runId; }
    public boolean isSuccess() { return success; }
    public FailureReason getFailureReason() { return failureReason; }
    public String getMessage() { return message; }
    public AlignmentResult getAlignment() { return alignment; }
    public DifferenceMap getDifferenceMap() { return differenceMap; }
    public ScoringResult getScoring() { return scoring; }
    public Image getAnnotatedImage() { return annotatedImage; }
    public Catalog getCatalog() { return catalog; }
    public List<String> getWarnings() { return warnings; }
    public long getElapsedMillis() { return elapsedMillis; }

    /** 配准失败后是否以恒等变换继续 */
    public boolean isIdentityFallback() { return identityFallback; }

    public boolean isAlignmentSuccess() {
        return alignment != null && alignment.isSuccess();
    }

    /**
     * 通过可靠性阈值的候选
     */
    public List<Candidate> getAcceptedCandidates() {
        return scoring == null ? Collections.emptyList() : scoring.getAccepted();
    }

    public int getCandidateCount() {
        return getAcceptedCandidates().size();
    }

    @Override
    public String toString() {
        if (!success) {
            return "PipelineResult[" + runId + " failed: " + failureReason + " - " + message + "]";
        }
        return "PipelineResult[" + runId + " ok, candidates=" + getCandidateCount() + ", " + elapsedMillis + " ms]";
    }

    static final class Builder {
        private final String runId;
        private FailureReason failureReason;
        private String message = "completed";
        private AlignmentResult alignment;
        private boolean identityFallback;
        private DifferenceMap differenceMap;
        private ScoringResult scoring;
        private Image annotatedImage;
        private Catalog catalog;
        private final List<String> warnings = new ArrayList<>();
        private long elapsedMillis;

        private Builder(String runId) {
            this.runId = runId;
        }

        Builder failure(FailureReason reason, String message) {
            this.failureReason = reason;
            this.message = message;
            return this;
        }

        Builder alignment(AlignmentResult alignment) { this.alignment = alignment; return this; }
        Builder identityFallback(boolean fallback) { this.identityFallback = fallback; return this; }
        Builder differenceMap(DifferenceMap map) { this.differenceMap = map; return this; }
        Builder scoring(ScoringResult scoring) { this.scoring = scoring; return this; }
        Builder annotatedImage(Image image) { this.annotatedImage = image; return this; }
        Builder catalog(Catalog catalog) { this.catalog = catalog; return this; }
        Builder warning(String warning) { this.warnings.add(warning); return this; }
        Builder warnings(List<String> list) { this.warnings.addAll(list); return this; }
        Builder elapsedMillis(long ms) { this.elapsedMillis = ms; return this; }

        PipelineResult build() {
            return new PipelineResult(this);
        }
    }
}
