package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;

import java.util.List;

/**
 * 候选评分接口
 * <p>
 * 所有策略共享同一输入输出约定，可通过配置互换。同样的输入与配置必须得到同样的结果。
 */
public interface CandidateScorer {

    ScoringStrategy strategy();

    /**
     * 为候选分配标签、置信度与可靠性，并按阈值划分
     *
     * @param candidates 提取器输出的原始候选
     * @param map        候选所在的差异图
     */
    ScoringResult score(List<Candidate> candidates, DifferenceMap map);
}
