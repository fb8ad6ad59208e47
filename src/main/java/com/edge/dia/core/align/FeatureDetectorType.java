package com.edge.dia.core.align;

/**
 * 特征检测/匹配组合
 */
public enum FeatureDetectorType {
    /**
     * 星点质心 + 三角形不变量投票
     * 适合稀疏点源场景，对旋转、平移、缩放不变
     */
    ASTERISM,

    /**
     * OpenCV ORB + Hamming 互为最近邻匹配
     * 适合纹理丰富的图像，稀疏星场上关键点往往不足
     */
    ORB
}
