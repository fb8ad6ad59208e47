package com.edge.dia.core.difference;

/**
 * 差分方向
 */
public enum DifferenceMode {
    /** 对齐后的科学图像减参考图像，增亮源为正 */
    SCIENCE_MINUS_REFERENCE,

    /** 参考图像减对齐后的科学图像，变暗源为正 */
    REFERENCE_MINUS_SCIENCE,

    /** 绝对差，两个方向的变化都保留 */
    ABSOLUTE
}
