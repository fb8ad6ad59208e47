package com.edge.dia.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 清理过程报告：每个阶段之后的非零像素数，以及被跳过的阶段
 */
public final class CleaningReport {

    private final Map<String, Integer> stagePixelCounts = new LinkedHashMap<>();
    private final List<String> skippedStages = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void recordStage(String stage, int nonZeroPixels) {
        stagePixelCounts.put(stage, nonZeroPixels);
    }

    public void recordSkipped(String stage, String reason) {
        skippedStages.add(stage + ": " + reason);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public Map<String, Integer> getStagePixelCounts() {
        return Collections.unmodifiableMap(stagePixelCounts);
    }

    public List<String> getSkippedStages() {
        return Collections.unmodifiableList(skippedStages);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int finalPixelCount() {
        int last = 0;
        for (int v : stagePixelCounts.values()) {
            last = v;
        }
        return last;
    }

    @Override
    public String toString() {
        return "CleaningReport" + stagePixelCounts + (skippedStages.isEmpty() ? "" : " skipped=" + skippedStages);
    }
}
