package com.edge.dia.core.pipeline;

/**
 * 流水线观察者，接收进度与诊断事件
 * <p>
 * 实现不得抛出异常影响运行结果。
 */
@FunctionalInterface
public interface PipelineListener {

    PipelineListener NOOP = event -> { };

    void onEvent(PipelineEvent event);
}
