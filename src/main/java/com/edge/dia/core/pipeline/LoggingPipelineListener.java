package com.edge.dia.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把流水线事件转发到 SLF4J
 */
public class LoggingPipelineListener implements PipelineListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingPipelineListener.class);

    @Override
    public void onEvent(PipelineEvent event) {
        if (event.isWarning()) {
            logger.warn("[{}] {} - {}", event.getRunId(), event.getStage(), event.getMessage());
        } else if (event.getMetrics().isEmpty()) {
            logger.info("[{}] {} - {}", event.getRunId(), event.getStage(), event.getMessage());
        } else {
            logger.info("[{}] {} - {} {}", event.getRunId(), event.getStage(), event.getMessage(), event.getMetrics());
        }
    }
}
