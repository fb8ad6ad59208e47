package com.edge.dia.core.annotate;

/**
 * 标记样式
 */
public enum MarkerStyle {
    /** 1 像素宽圆环，不遮挡源本身 */
    RING,

    /** 实心圆 */
    FILLED
}
