package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.CandidateLabel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 评分结果：全部已评分候选，以及按可靠性阈值划分的接受/拒绝子集
 */
public final class ScoringResult {

    private final ScoringStrategy strategy;
    private final double cutoff;
    private final List<Candidate> scored;
    private final List<Candidate> accepted;
    private final List<Candidate> rejected;

    public ScoringResult(ScoringStrategy strategy, double cutoff, List<Candidate> scored) {
        this.strategy = strategy;
        this.cutoff = cutoff;
        this.scored = Collections.unmodifiableList(new ArrayList<>(scored));
        List<Candidate> acc = new ArrayList<>();
        List<Candidate> rej = new ArrayList<>();
        for (Candidate c : scored) {
            if (c.getReliability() >= cutoff) {
                acc.add(c);
            } else {
                rej.add(c);
            }
        }
        this.accepted = Collections.unmodifiableList(acc);
        this.rejected = Collections.unmodifiableList(rej);
    }

    public ScoringStrategy getStrategy() { return strategy; }
    public double getCutoff() { return cutoff; }
    public List<Candidate> getScored() { return scored; }
    public List<Candidate> getAccepted() { return accepted; }
    public List<Candidate> getRejected() { return rejected; }

    public Map<CandidateLabel, Integer> labelCounts() {
        Map<CandidateLabel, Integer> counts = new EnumMap<>(CandidateLabel.class);
        for (Candidate c : scored) {
            counts.merge(c.getLabel(), 1, Integer::sum);
        }
        return counts;
    }
}
