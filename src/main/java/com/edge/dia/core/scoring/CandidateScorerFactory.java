package com.edge.dia.core.scoring;

/**
 * 评分器工厂：按配置的策略创建实现
 */
public class CandidateScorerFactory {

    public static CandidateScorer create(ScoringOptions options) {
        switch (options.getStrategy()) {
            case BAYESIAN_MIXTURE:
                return new BayesianMixtureScorer(options);
            case MULTI_SCALE:
                return new MultiScaleScorer(options);
            case CUTOUT_HEURISTIC:
                return new CutoutHeuristicScorer(options);
            case STATISTICAL:
            default:
                return new StatisticalScorer(options);
        }
    }
}
