package com.edge.dia.config;

import com.edge.dia.core.align.AlignmentOptions;
import com.edge.dia.core.annotate.AnnotationOptions;
import com.edge.dia.core.annotate.CatalogOptions;
import com.edge.dia.core.detect.ExtractionOptions;
import com.edge.dia.core.difference.CleaningOptions;
import com.edge.dia.core.scoring.ScoringOptions;
import com.edge.dia.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-dia")
public class DiaProperties {
    private AlignmentOptions alignment = new AlignmentOptions();
    private CleaningOptions difference = new CleaningOptions();
    private ExtractionOptions extraction = new ExtractionOptions();
    private ScoringOptions scoring = new ScoringOptions();
    private AnnotationOptions annotation = new AnnotationOptions();
    private CatalogOptions catalog = new CatalogOptions();
    private BatchConfig batch = new BatchConfig();
    private OutputConfig output = new OutputConfig();

    @Data
    public static class BatchConfig {
        private int workerThreads = 2;
        // 单个图像对的最长等待时间
        private long pairTimeoutSeconds = 600;
    }

    @Data
    public static class OutputConfig {
        private String directory = "output";
        private boolean saveAligned = true;
        private boolean saveDifference = true;
        private boolean saveMarked = true;
    }

    /**
     * 校验全部参数组，任何一组非法即抛 ConfigurationException
     */
    public void validate() {
        alignment.validate();
        difference.validate();
        extraction.validate();
        scoring.validate();
        annotation.validate();
        catalog.validate();
        if (batch.getWorkerThreads() < 1) {
            throw new ConfigurationException("batch.worker-threads must be at least 1: " + batch.getWorkerThreads());
        }
        if (batch.getPairTimeoutSeconds() < 1) {
            throw new ConfigurationException("batch.pair-timeout-seconds must be positive: " + batch.getPairTimeoutSeconds());
        }
        if (output.getDirectory() == null || output.getDirectory().isBlank()) {
            throw new ConfigurationException("output.directory must be set");
        }
    }
}
