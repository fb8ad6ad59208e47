package com.edge.dia.core.pipeline;

/**
 * 运行失败原因，机器可读
 */
public enum FailureReason {
    /** 图像非法、为空或不可读 */
    INPUT_ERROR,
    /** 匹配不足且未启用恒等回退 */
    ALIGNMENT_FAILED,
    /** 未预期的运行时错误 */
    INTERNAL_ERROR
}
