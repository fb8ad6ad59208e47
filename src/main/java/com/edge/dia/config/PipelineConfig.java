package com.edge.dia.config;

import com.edge.dia.core.annotate.CatalogWriter;
import com.edge.dia.core.pipeline.DiaPipeline;
import com.edge.dia.core.pipeline.LoggingPipelineListener;
import com.edge.dia.core.pipeline.PipelineListener;
import com.edge.dia.io.FitsImageIO;
import com.edge.dia.io.RunReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 流水线配置
 * <p>
 * 从 application.yml 读取参数，校验后组装核心组件。参数非法时启动失败。
 */
@Configuration
public class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Autowired
    private DiaProperties properties;

    @Bean
    public PipelineListener pipelineListener() {
        return new LoggingPipelineListener();
    }

    @Bean
    public DiaPipeline diaPipeline(PipelineListener pipelineListener) {
        properties.validate();
        DiaPipeline pipeline = DiaPipeline.create(
            properties.getAlignment(),
            properties.getDifference(),
            properties.getExtraction(),
            properties.getScoring(),
            properties.getAnnotation(),
            pipelineListener);

        logger.info("DIA pipeline configured: transform={}, detector={}, centralRegion={}, mode={}, preset={}",
            properties.getAlignment().getTransformClass(),
            properties.getAlignment().getFeatureDetector(),
            properties.getAlignment().isUseCentralRegion(),
            properties.getDifference().getMode(),
            properties.getDifference().getPreset());
        logger.info("Scoring strategy={}, reliabilityCutoff={}, markerMetric={}",
            properties.getScoring().getStrategy(),
            properties.getScoring().getReliabilityCutoff(),
            properties.getAnnotation().getMarkerMetric());
        return pipeline;
    }

    @Bean
    public FitsImageIO fitsImageIO() {
        return new FitsImageIO();
    }

    @Bean
    public CatalogWriter catalogWriter() {
        return new CatalogWriter(properties.getCatalog());
    }

    @Bean
    public RunReportWriter runReportWriter() {
        return new RunReportWriter();
    }
}
