package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.DifferenceMap;

import java.util.ArrayList;
import java.util.List;

/**
 * 统计阈值评分：显著性 = min(1, SNR / snrSaturation)
 */
public class StatisticalScorer extends RuleBasedScorer {

    public StatisticalScorer(ScoringOptions options) {
        super(options);
    }

    @Override
    public ScoringStrategy strategy() {
        return ScoringStrategy.STATISTICAL;
    }

    @Override
    protected List<Assessment> assess(List<Candidate> candidates, DifferenceMap map) {
        List<Assessment> out = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            out.add(new Assessment(snrSignificance(c)));
        }
        return out;
    }
}
