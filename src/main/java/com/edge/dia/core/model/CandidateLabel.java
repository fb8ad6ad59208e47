package com.edge.dia.core.model;

/**
 * 候选体分类标签
 */
public enum CandidateLabel {
    /** 尚未评分 */
    UNCLASSIFIED,

    /** 疑似真实暂现源 */
    CANDIDATE,

    /** 落在参考图像中显著恒星上的残差 */
    STELLAR,

    /** 减影伪影：细长、负通量、过小等 */
    ARTIFACT,

    /** 信噪比过低 */
    NOISE
}
