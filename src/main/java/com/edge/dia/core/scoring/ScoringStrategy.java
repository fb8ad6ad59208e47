package com.edge.dia.core.scoring;

/**
 * 评分策略
 */
public enum ScoringStrategy {
    /**
     * 统计阈值：显著性取 SNR 归一化值
     */
    STATISTICAL,

    /**
     * 贝叶斯混合模型：对残差总体拟合背景 + 源两分量高斯混合，显著性取源分量后验概率
     */
    BAYESIAN_MIXTURE,

    /**
     * 多尺度：在多个高斯尺度上重检测，结合持续度；DBSCAN 聚簇的候选降权
     */
    MULTI_SCALE,

    /**
     * 切片启发式：代替神经网络分类器的简单峰值/离散度判据
     */
    CUTOUT_HEURISTIC
}
