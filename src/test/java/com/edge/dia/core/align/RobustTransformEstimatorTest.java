package com.edge.dia.core.align;

import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.CorrespondencePair;
import com.edge.dia.core.model.FeaturePoint;
import com.edge.dia.core.model.TransformClass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobustTransformEstimatorTest {

    private final RobustTransformEstimator estimator = new RobustTransformEstimator(3.0, 2000, 0.99, 0.25, 10);

    static List<CorrespondencePair> correspondences(AlignmentTransform truth, int count, int outliers, long seed) {
        Random random = new Random(seed);
        List<CorrespondencePair> pairs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double x = 10 + random.nextDouble() * 280;
            double y = 10 + random.nextDouble() * 280;
            double[] r = truth.apply(x, y);
            pairs.add(new CorrespondencePair(point(x, y), point(r[0], r[1]), 0));
        }
        for (int i = 0; i < outliers; i++) {
            pairs.add(new CorrespondencePair(
                point(random.nextDouble() * 300, random.nextDouble() * 300),
                point(random.nextDouble() * 300, random.nextDouble() * 300), 0));
        }
        return pairs;
    }

    static FeaturePoint point(double x, double y) {
        return new FeaturePoint(x, y, 1f, new float[0]);
    }

    static void assertSameMapping(AlignmentTransform expected, AlignmentTransform actual, double tolerance) {
        double[][] samplePoints = {{0, 0}, {300, 0}, {0, 300}, {300, 300}, {150, 150}};
        for (double[] p : samplePoints) {
            double[] e = expected.apply(p[0], p[1]);
            double[] a = actual.apply(p[0], p[1]);
            assertEquals(e[0], a[0], tolerance, "x at " + p[0] + "," + p[1]);
            assertEquals(e[1], a[1], tolerance, "y at " + p[0] + "," + p[1]);
        }
    }

    @Test
    void recoversRigidTransformFromPerfectMatches() {
        AlignmentTransform truth = AlignmentTransform.rigid(Math.toRadians(3), 5.5, -7.25);
        EstimationResult result = estimator.estimate(correspondences(truth, 20, 0, 1), TransformClass.RIGID);
        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(20, result.getInlierCount());
        assertSameMapping(truth, result.getTransform(), 1e-6);
        assertEquals(0.0, result.getRmsError(), 1e-6);
    }

    @Test
    void recoversSimilarityTransformFromPerfectMatches() {
        AlignmentTransform truth = AlignmentTransform.similarity(0.97, Math.toRadians(-6), -4, 11);
        EstimationResult result = estimator.estimate(correspondences(truth, 20, 0, 2), TransformClass.SIMILARITY);
        assertTrue(result.isSuccess(), result.getMessage());
        // OpenCV 内部以 float32 处理坐标
        assertSameMapping(truth, result.getTransform(), 1e-3);
        assertEquals(0.97, result.getTransform().getScale(), 1e-6);
    }

    @Test
    void recoversHomographyFromPerfectMatches() {
        AlignmentTransform truth = new AlignmentTransform(new double[][]{
            {1.02, 0.03, 4.0},
            {-0.01, 0.98, -6.0},
            {2e-5, -1e-5, 1.0}}, TransformClass.HOMOGRAPHY);
        EstimationResult result = estimator.estimate(correspondences(truth, 25, 0, 3), TransformClass.HOMOGRAPHY);
        assertTrue(result.isSuccess(), result.getMessage());
        assertSameMapping(truth, result.getTransform(), 1e-3);
    }

    @Test
    void rejectsOutliers() {
        AlignmentTransform truth = AlignmentTransform.rigid(Math.toRadians(-1.5), 12, 3);
        List<CorrespondencePair> pairs = correspondences(truth, 30, 12, 4);
        EstimationResult result = estimator.estimate(pairs, TransformClass.RIGID);
        assertTrue(result.isSuccess(), result.getMessage());
        assertTrue(result.getInlierCount() >= 30, "inliers " + result.getInlierCount());
        assertSameMapping(truth, result.getTransform(), 1e-6);
        for (int i = 0; i < 30; i++) {
            assertTrue(result.getInlierMask()[i]);
        }
    }

    @Test
    void inlierCountMatchesMask() {
        AlignmentTransform truth = AlignmentTransform.similarity(1.01, Math.toRadians(4), 2, -9);
        EstimationResult result = estimator.estimate(correspondences(truth, 24, 8, 11), TransformClass.SIMILARITY);
        assertTrue(result.isSuccess(), result.getMessage());
        int marked = 0;
        for (boolean b : result.getInlierMask()) {
            if (b) marked++;
        }
        assertEquals(marked, result.getInlierCount());
        assertTrue(marked >= 24);
    }

    @Test
    void rigidFitFailsWhenFramesDifferInScale() {
        AlignmentTransform truth = AlignmentTransform.similarity(1.1, Math.toRadians(1), 4, 4);
        EstimationResult rigid = estimator.estimate(correspondences(truth, 20, 0, 12), TransformClass.RIGID);
        assertFalse(rigid.isSuccess());
        assertTrue(rigid.getMessage().contains("exceeds threshold"), rigid.getMessage());

        EstimationResult similarity = estimator.estimate(correspondences(truth, 20, 0, 12), TransformClass.SIMILARITY);
        assertTrue(similarity.isSuccess(), similarity.getMessage());
    }

    @Test
    void failsWithTooFewCorrespondences() {
        AlignmentTransform truth = AlignmentTransform.rigid(0, 1, 1);
        EstimationResult result = estimator.estimate(correspondences(truth, 2, 0, 5), TransformClass.RIGID);
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("Insufficient correspondences"));

        EstimationResult homography = estimator.estimate(correspondences(truth, 3, 0, 5), TransformClass.HOMOGRAPHY);
        assertFalse(homography.isSuccess());
    }

    @Test
    void failsWhenInlierRatioIsBelowFloor() {
        AlignmentTransform truth = AlignmentTransform.rigid(0, 1, 1);
        List<CorrespondencePair> pairs = correspondences(truth, 4, 40, 6);
        EstimationResult result = estimator.estimate(pairs, TransformClass.RIGID);
        assertFalse(result.isSuccess());
    }

    @Test
    void isDeterministicForTheSameSeed() {
        AlignmentTransform truth = AlignmentTransform.rigid(Math.toRadians(2), -3, 4);
        List<CorrespondencePair> pairs = correspondences(truth, 25, 15, 7);
        EstimationResult a = estimator.estimate(pairs, TransformClass.RIGID);
        EstimationResult b = estimator.estimate(pairs, TransformClass.RIGID);
        assertEquals(a.getInlierCount(), b.getInlierCount());
        assertSameMapping(a.getTransform(), b.getTransform(), 0);
    }
}
