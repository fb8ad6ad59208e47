package com.edge.dia.core.pipeline;

import com.edge.dia.core.SyntheticSky;
import com.edge.dia.core.align.AlignmentOptions;
import com.edge.dia.core.annotate.AnnotationOptions;
import com.edge.dia.core.detect.ExtractionOptions;
import com.edge.dia.core.difference.CleaningOptions;
import com.edge.dia.core.difference.DifferenceMode;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.CandidateLabel;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.scoring.ScoringOptions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiaPipelineTest {

    private static DiaPipeline pipeline(AlignmentOptions alignment, PipelineListener listener) {
        return pipeline(alignment, new CleaningOptions(), listener);
    }

    private static DiaPipeline pipeline(AlignmentOptions alignment, CleaningOptions cleaning,
                                        PipelineListener listener) {
        return DiaPipeline.create(alignment, cleaning, new ExtractionOptions(), new ScoringOptions(),
            new AnnotationOptions(), listener);
    }

    @Test
    void findsInjectedTransientsInRotatedPair() {
        AlignmentTransform truth = AlignmentTransform.rigid(Math.toRadians(1.5), 4.3, -3.1);
        SyntheticSky.Pair pair = SyntheticSky.pair(300, 10, 400, 4, 1500, truth, 21);
        List<PipelineEvent> events = new ArrayList<>();

        PipelineResult result = pipeline(new AlignmentOptions(), events::add).run(pair.reference, pair.science, "e2e");

        assertTrue(result.isSuccess(), result.getMessage());
        assertTrue(result.isAlignmentSuccess());
        assertFalse(result.isIdentityFallback());
        assertEquals("e2e", result.getRunId());

        List<Candidate> accepted = result.getAcceptedCandidates();
        assertEquals(4, accepted.size(), String.valueOf(result.getScoring().getScored()));
        for (double[] t : pair.truth) {
            boolean found = accepted.stream().anyMatch(c -> Math.hypot(c.getX() - t[0], c.getY() - t[1]) < 2.0);
            assertTrue(found, "no accepted candidate near " + t[0] + "," + t[1]);
        }
        for (Candidate c : accepted) {
            assertEquals(CandidateLabel.CANDIDATE, c.getLabel());
        }

        assertEquals(4, result.getCatalog().size());
        assertEquals(300, result.getCatalog().getImageWidth());
        assertEquals("RIGID", String.valueOf(result.getCatalog().getParameters().get("transform_class")));
        assertEquals(300, result.getAnnotatedImage().getWidth());
        assertTrue(result.getElapsedMillis() >= 0);

        List<PipelineStage> stages = new ArrayList<>();
        events.forEach(e -> stages.add(e.getStage()));
        assertEquals(List.of(PipelineStage.ALIGNMENT, PipelineStage.DIFFERENCE, PipelineStage.EXTRACTION,
            PipelineStage.SCORING, PipelineStage.ANNOTATION, PipelineStage.COMPLETE), stages);
        assertTrue(events.stream().allMatch(e -> "e2e".equals(e.getRunId())));
    }

    @Test
    void referenceMinusScienceAcceptsSourcesThatFaded() {
        AlignmentTransform truth = AlignmentTransform.rigid(Math.toRadians(-1.0), -3.5, 2.2);
        SyntheticSky.Pair pair = SyntheticSky.pair(300, 10, 400, 4, 1500, truth, 33);
        // 注入源只存在于作为参考帧的那幅图中
        Image reference = pair.science;
        Image science = pair.reference;
        AlignmentTransform toReference = truth.inverse();
        CleaningOptions cleaning = new CleaningOptions();
        cleaning.setMode(DifferenceMode.REFERENCE_MINUS_SCIENCE);

        PipelineResult result = pipeline(new AlignmentOptions(), cleaning, PipelineListener.NOOP)
            .run(reference, science, "fading");

        assertTrue(result.isSuccess(), result.getMessage());
        List<Candidate> accepted = result.getAcceptedCandidates();
        assertEquals(4, accepted.size(), String.valueOf(result.getScoring().getScored()));
        for (double[] t : pair.truth) {
            double[] q = toReference.apply(t[0], t[1]);
            boolean found = accepted.stream().anyMatch(c -> Math.hypot(c.getX() - q[0], c.getY() - q[1]) < 2.0);
            assertTrue(found, "no accepted candidate near " + q[0] + "," + q[1]);
        }
        for (Candidate c : accepted) {
            assertEquals(CandidateLabel.CANDIDATE, c.getLabel());
            assertTrue(c.getNetFlux() > 0);
            assertFalse(c.hasFlag(Candidate.FLAG_NEGATIVE));
        }

        PipelineResult brightening = pipeline(new AlignmentOptions(), PipelineListener.NOOP).run(reference, science);
        assertTrue(brightening.isSuccess(), brightening.getMessage());
        assertEquals(0, brightening.getAcceptedCandidates().size());
    }

    @Test
    void alignmentFailureStopsUnlessFallbackIsEnabled() {
        Image flat = new Image(SyntheticSky.background(120, 120, 100, 0, 1));

        PipelineResult failed = pipeline(new AlignmentOptions(), PipelineListener.NOOP).run(flat, flat);
        assertFalse(failed.isSuccess());
        assertEquals(FailureReason.ALIGNMENT_FAILED, failed.getFailureReason());
        assertNull(failed.getDifferenceMap());

        AlignmentOptions fallback = new AlignmentOptions();
        fallback.setFallbackToIdentity(true);
        List<PipelineEvent> events = new ArrayList<>();
        PipelineResult continued = pipeline(fallback, events::add).run(flat, flat);
        assertTrue(continued.isSuccess(), continued.getMessage());
        assertTrue(continued.isIdentityFallback());
        assertFalse(continued.isAlignmentSuccess());
        assertTrue(continued.getDifferenceMap().isEmptyResidual());
        assertEquals(0, continued.getCandidateCount());
        assertFalse(continued.getWarnings().isEmpty());
        assertTrue(events.get(0).isWarning());
    }

    @Test
    void missingInputIsReportedNotThrown() {
        PipelineResult result = pipeline(new AlignmentOptions(), null).run(null, Image.zeros(10, 10));
        assertFalse(result.isSuccess());
        assertEquals(FailureReason.INPUT_ERROR, result.getFailureReason());
        assertNotNull(result.getRunId());
        assertEquals(8, result.getRunId().length());
    }

    @Test
    void processesPrecomputedDifference() {
        float[][] p = SyntheticSky.background(120, 120, 0, SyntheticSky.NOISE_SIGMA, 3);
        SyntheticSky.addStar(p, 60, 50, 800, SyntheticSky.STAR_SIGMA);

        PipelineResult result = pipeline(new AlignmentOptions(), PipelineListener.NOOP).runOnDifference(new Image(p));

        assertTrue(result.isSuccess(), result.getMessage());
        assertNull(result.getAlignment());
        assertEquals(1, result.getCandidateCount());
        Candidate c = result.getAcceptedCandidates().get(0);
        assertEquals(60.0, c.getX(), 1.0);
        assertEquals(50.0, c.getY(), 1.0);
    }

    @Test
    void failingListenerDoesNotBreakTheRun() {
        PipelineListener broken = event -> {
            throw new IllegalStateException("listener down");
        };
        float[][] p = SyntheticSky.background(60, 60, 0, 1, 4);
        PipelineResult result = pipeline(new AlignmentOptions(), broken).runOnDifference(new Image(p));
        assertTrue(result.isSuccess(), result.getMessage());
    }
}
