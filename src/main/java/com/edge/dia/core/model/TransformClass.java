package com.edge.dia.core.model;

import com.edge.dia.exception.ConfigurationException;

/**
 * 几何变换类别
 */
public enum TransformClass {
    /**
     * 刚体变换：旋转 + 平移
     * 最少 3 对匹配点
     */
    RIGID(3),

    /**
     * 相似变换：旋转 + 平移 + 等比缩放
     * 最少 3 对匹配点
     */
    SIMILARITY(3),

    /**
     * 单应性变换：含透视
     * 最少 4 对匹配点
     */
    HOMOGRAPHY(4);

    private final int minCorrespondences;

    TransformClass(int minCorrespondences) {
        this.minCorrespondences = minCorrespondences;
    }

    public int getMinCorrespondences() {
        return minCorrespondences;
    }

    /**
     * 解析配置值，大小写与连字符不敏感
     */
    public static TransformClass fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("transform-class must not be empty");
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (TransformClass c : values()) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        throw new ConfigurationException("Unknown transform-class: " + value + " (expected rigid, similarity or homography)");
    }
}
