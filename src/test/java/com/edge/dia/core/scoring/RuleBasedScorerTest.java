package com.edge.dia.core.scoring;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.CandidateLabel;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.DifferenceStatistics;
import com.edge.dia.core.model.Image;
import com.edge.dia.exception.InputException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleBasedScorerTest {

    private static final DifferenceMap MAP = DifferenceMap.fromCleanedImage(Image.zeros(100, 100), DifferenceStatistics.zero());

    private static Candidate.Builder good() {
        return Candidate.builder()
            .id(1).x(50).y(50).area(20).peak(100).total(2000).mean(100)
            .snr(40).elongation(1.0).compactness(1.0).netFlux(2000)
            .edgeDistance(50).centerDistance(0).bounds(48, 48, 52, 52);
    }

    private static Candidate scoreOne(Candidate c) {
        return new StatisticalScorer(new ScoringOptions()).score(List.of(c), MAP).getScored().get(0);
    }

    @Test
    void cleanBrightSourceIsFullyReliable() {
        Candidate c = scoreOne(good().build());
        assertEquals(CandidateLabel.CANDIDATE, c.getLabel());
        assertEquals(100.0, c.getReliability(), 1e-9);
        assertEquals(1.0, c.getConfidence(), 1e-9);
    }

    @Test
    void gatesAreAppliedInOrder() {
        assertEquals(CandidateLabel.NOISE, scoreOne(good().snr(1).netFlux(-5).build()).getLabel());
        assertEquals(CandidateLabel.ARTIFACT, scoreOne(good().netFlux(-10).build()).getLabel());
        assertEquals(CandidateLabel.ARTIFACT, scoreOne(good().area(3).elongation(3.0).build()).getLabel());
        assertEquals(CandidateLabel.ARTIFACT, scoreOne(good().elongation(6.0).build()).getLabel());
        assertEquals(CandidateLabel.STELLAR, scoreOne(good().referenceSignificance(10).build()).getLabel());
    }

    @Test
    void nonCandidatesAreDiscounted() {
        Candidate stellar = scoreOne(good().referenceSignificance(10).build());
        assertEquals(30.0, stellar.getReliability(), 1e-6);

        ScoringResult result = new StatisticalScorer(new ScoringOptions())
            .score(List.of(good().build(), good().id(2).referenceSignificance(10).build()), MAP);
        assertEquals(1, result.getAccepted().size());
        assertEquals(1, result.getAccepted().get(0).getId());
        assertEquals(1, result.getRejected().size());
        assertEquals(1, result.labelCounts().get(CandidateLabel.STELLAR));
    }

    @Test
    void boundaryTouchingCandidatesLoseEdgeScore() {
        Candidate inner = scoreOne(good().build());
        Candidate edge = scoreOne(good().touchesBoundary(true).edgeDistance(1).flag(Candidate.FLAG_BOUNDARY).build());
        assertEquals(inner.getReliability() - 15.0, edge.getReliability(), 1e-6);
        assertTrue(edge.hasFlag(Candidate.FLAG_BOUNDARY));
    }

    @Test
    void reliabilityEqualToCutoffIsAccepted() {
        Candidate c = good().build().withScore(CandidateLabel.CANDIDATE, 0.8, 50.0, null);
        ScoringResult result = new ScoringResult(ScoringStrategy.STATISTICAL, 50.0, List.of(c));
        assertEquals(1, result.getAccepted().size());
        assertTrue(result.getRejected().isEmpty());
    }

    @Test
    void emptyAndMissingInput() {
        StatisticalScorer scorer = new StatisticalScorer(new ScoringOptions());
        ScoringResult empty = scorer.score(Collections.emptyList(), MAP);
        assertTrue(empty.getScored().isEmpty());
        assertSame(ScoringStrategy.STATISTICAL, empty.getStrategy());
        assertThrows(InputException.class, () -> scorer.score(null, MAP));
        assertThrows(InputException.class, () -> scorer.score(List.of(good().build()), null));
    }
}
