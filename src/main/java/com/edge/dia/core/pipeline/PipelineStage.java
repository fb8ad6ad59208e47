package com.edge.dia.core.pipeline;

/**
 * 流水线阶段
 */
public enum PipelineStage {
    /** 几何配准 */
    ALIGNMENT,
    /** 差异图与清理 */
    DIFFERENCE,
    /** 候选提取 */
    EXTRACTION,
    /** 候选评分 */
    SCORING,
    /** 标记图与星表 */
    ANNOTATION,
    /** 运行结束 */
    COMPLETE
}
