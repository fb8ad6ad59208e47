package com.edge.dia.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 流水线进度事件
 */
public final class PipelineEvent {

    private final String runId;
    private final PipelineStage stage;
    private final String message;
    private final Map<String, Object> metrics;
    private final boolean warning;

    public PipelineEvent(String runId, PipelineStage stage, String message, Map<String, Object> metrics, boolean warning) {
        this.runId = runId;
        this.stage = stage;
        this.message = message;
        this.metrics = metrics == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.warning = warning;
    }

    public static PipelineEvent info(String runId, PipelineStage stage, String message, Map<String, Object> metrics) {
        return new PipelineEvent(runId, stage, message, metrics, false);
    }

    public static PipelineEvent warning(String runId, PipelineStage stage, String message) {
        return new PipelineEvent(runId, stage, message, null, true);
    }

    public String getRunId() { return runId; }
    public PipelineStage getStage() { return stage; }
    public String getMessage() { return message; }
    public Map<String, Object> getMetrics() { return metrics; }
    public boolean isWarning() { return warning; }

    @Override
    public String toString() {
        return "[" + runId + "] " + stage + ": " + message + (metrics.isEmpty() ? "" : " " + metrics);
    }
}
