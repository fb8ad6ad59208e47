package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.CandidateLabel;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 规则评分模板
 * <p>
 * 子类只负责给出每个候选的显著性 [0, 1]（以及可选的附加标志、伪源判定），
 * 分类门限与可靠性加权在这里统一完成：
 * <ol>
 *   <li>SNR 过低 -> NOISE</li>
 *   <li>净通量为负 -> ARTIFACT</li>
 *   <li>面积小且细长 -> ARTIFACT</li>
 *   <li>过度细长 -> ARTIFACT</li>
 *   <li>参考图像该处为显著源 -> STELLAR</li>
 *   <li>策略判定为伪源 -> ARTIFACT</li>
 *   <li>其余 -> CANDIDATE</li>
 * </ol>
 * 可靠性 = 100 * 加权特征和，非 CANDIDATE 乘以 (1 - confidence)。
 */
public abstract class RuleBasedScorer implements CandidateScorer {

    private static final Logger logger = LoggerFactory.getLogger(RuleBasedScorer.class);

    protected final ScoringOptions options;
    private final double[] weights;

    protected RuleBasedScorer(ScoringOptions options) {
        options.validate();
        this.options = options;
        this.weights = options.normalizedWeights();
    }

    /**
     * 策略相关的评估
     *
     * @return 与 candidates 一一对应的评估结果
     */
    protected abstract List<Assessment> assess(List<Candidate> candidates, DifferenceMap map);

    @Override
    public final ScoringResult score(List<Candidate> candidates, DifferenceMap map) {
        if (candidates == null || map == null) {
            throw new InputException("Candidates and difference map are required for scoring");
        }
        if (candidates.isEmpty()) {
            return new ScoringResult(strategy(), options.getReliabilityCutoff(), Collections.emptyList());
        }
        List<Assessment> assessments = assess(candidates, map);
        List<Candidate> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            scored.add(scoreOne(candidates.get(i), assessments.get(i)));
        }
        ScoringResult result = new ScoringResult(strategy(), options.getReliabilityCutoff(), scored);
        logger.info("Scored {} candidates with {}: accepted={}, rejected={}, labels={}",
            scored.size(), strategy(), result.getAccepted().size(), result.getRejected().size(), result.labelCounts());
        return result;
    }

    private Candidate scoreOne(Candidate c, Assessment a) {
        double significance = clamp01(a.significance);
        CandidateLabel label;
        double confidence;
        if (c.getSnr() < options.getSnrNoiseCutoff()) {
            label = CandidateLabel.NOISE;
            confidence = 0.9;
        } else if (c.getNetFlux() < 0) {
            label = CandidateLabel.ARTIFACT;
            confidence = 0.7;
        } else if (c.getArea() < options.getArtifactMaxArea() && c.getElongation() > options.getArtifactSmallElongation()) {
            label = CandidateLabel.ARTIFACT;
            confidence = 0.8;
        } else if (c.getElongation() > options.getMaxElongation()) {
            label = CandidateLabel.ARTIFACT;
            confidence = 0.6;
        } else if (c.getReferenceSignificance() > options.getStellarSignificance()) {
            label = CandidateLabel.STELLAR;
            confidence = 0.7;
        } else if (a.bogus) {
            label = CandidateLabel.ARTIFACT;
            confidence = clamp01(1.0 - significance);
        } else {
            label = CandidateLabel.CANDIDATE;
            confidence = 0.5 + 0.5 * significance;
        }

        double shape = 0.5 / Math.max(1.0, c.getElongation()) + 0.5 * clamp01(c.getCompactness());
        double edge = c.isTouchesBoundary() ? 0.0 : clamp01(c.getEdgeDistance() / options.getEdgeMargin());
        double area = clamp01(c.getArea() / options.getAreaSaturation());
        double sign = c.getNetFlux() > 0 ? 1.0 : 0.0;
        double reliability = 100.0 * (weights[0] * significance + weights[1] * shape + weights[2] * edge
            + weights[3] * area + weights[4] * sign);
        if (label != CandidateLabel.CANDIDATE) {
            reliability *= (1.0 - confidence);
        }
        reliability = Math.max(0.0, Math.min(100.0, reliability));
        return c.withScore(label, confidence, reliability, a.flags);
    }

    /**
     * 按 SNR 饱和值归一化的显著性
     */
    protected double snrSignificance(Candidate c) {
        return clamp01(c.getSnr() / options.getSnrSaturation());
    }

    protected static double clamp01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    public ScoringOptions getOptions() {
        return options;
    }

    /**
     * 单个候选的策略评估
     */
    protected static final class Assessment {
        final double significance;
        final boolean bogus;
        final Set<String> flags;

        public Assessment(double significance) {
            this(significance, false, Collections.emptySet());
        }

        public Assessment(double significance, boolean bogus, Set<String> flags) {
            this.significance = significance;
            this.bogus = bogus;
            this.flags = new LinkedHashSet<>(flags);
        }
    }
}
