package com.edge.dia.core.difference;

import com.edge.dia.core.SyntheticSky;
import com.edge.dia.core.model.AlignmentTransform;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.Image;
import com.edge.dia.core.model.TransformClass;
import com.edge.dia.exception.InputException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DifferenceEngineTest {

    private static final AlignmentTransform IDENTITY = AlignmentTransform.identity(TransformClass.RIGID);

    private static Image noisyField(long seed) {
        float[][] p = SyntheticSky.background(200, 200, SyntheticSky.BACKGROUND, SyntheticSky.NOISE_SIGMA, seed);
        SyntheticSky.addStar(p, 60, 70, 500, SyntheticSky.STAR_SIGMA);
        SyntheticSky.addStar(p, 140, 120, 700, SyntheticSky.STAR_SIGMA);
        return new Image(p, Map.of("OBJECT", "FIELD"));
    }

    @Test
    void identicalImagesGiveAnEmptyMap() {
        Image image = noisyField(1);
        DifferenceMap map = new DifferenceEngine(new CleaningOptions()).compute(image, image, IDENTITY);

        assertEquals(0, map.countNonZero());
        assertTrue(map.isEmptyResidual());
        assertFalse(map.getReport().getWarnings().isEmpty());
        assertEquals("FIELD", map.getPixels().getHeader().get("OBJECT"));
    }

    @Test
    void brighteningSourceSurvivesCleaning() {
        Image reference = noisyField(2);
        float[][] sci = SyntheticSky.background(200, 200, SyntheticSky.BACKGROUND, SyntheticSky.NOISE_SIGMA, 3);
        SyntheticSky.addStar(sci, 60, 70, 500, SyntheticSky.STAR_SIGMA);
        SyntheticSky.addStar(sci, 140, 120, 700, SyntheticSky.STAR_SIGMA);
        SyntheticSky.addStar(sci, 100, 40, 1500, SyntheticSky.STAR_SIGMA);

        DifferenceMap map = new DifferenceEngine(new CleaningOptions()).compute(reference, new Image(sci), IDENTITY);

        assertTrue(map.get(100, 40) > 0, "source pixel must survive");
        assertEquals(0f, map.get(20, 180));
        assertTrue(map.getResidual(100, 40) > 1000);
        assertTrue(map.getStatistics().getNoiseSigma() > 0);
        assertTrue(map.getStatistics().getDetectionThreshold() > map.getStatistics().getNoiseFloor());
        assertEquals(100.0, map.getStatistics().getBaselineBackground(), 5.0);
        assertTrue(map.getReport().getStagePixelCounts().containsKey(DifferenceEngine.STAGE_GAUSSIAN));
        assertNotNull(map.getAlignedScience());
        // 平滑不扩大支撑
        int residualSupport = map.getReport().getStagePixelCounts().get(DifferenceEngine.STAGE_MORPHOLOGY);
        assertTrue(map.countNonZero() <= residualSupport);
    }

    @Test
    void modeControlsWhichSignIsKept() {
        float[][] ref = SyntheticSky.background(150, 150, SyntheticSky.BACKGROUND, SyntheticSky.NOISE_SIGMA, 4);
        SyntheticSky.addStar(ref, 75, 75, 1000, SyntheticSky.STAR_SIGMA);
        Image reference = new Image(ref);
        Image science = new Image(SyntheticSky.background(150, 150, SyntheticSky.BACKGROUND, SyntheticSky.NOISE_SIGMA, 5));

        DifferenceMap brightening = new DifferenceEngine(new CleaningOptions()).compute(reference, science, IDENTITY);
        assertEquals(0f, brightening.get(75, 75));
        assertTrue(brightening.getResidual(75, 75) < -500);

        CleaningOptions dimming = new CleaningOptions();
        dimming.setMode(DifferenceMode.REFERENCE_MINUS_SCIENCE);
        DifferenceMap fading = new DifferenceEngine(dimming).compute(reference, science, IDENTITY);
        assertTrue(fading.get(75, 75) > 0);
        // 残差随差分方向取号，基准帧换成科学图像
        assertTrue(fading.getResidual(75, 75) > 500);
        assertTrue(fading.getBaseline() == fading.getAlignedScience());
        assertTrue(brightening.getBaseline() == reference);

        CleaningOptions absolute = new CleaningOptions();
        absolute.setMode(DifferenceMode.ABSOLUTE);
        assertTrue(new DifferenceEngine(absolute).compute(reference, science, IDENTITY).get(75, 75) > 0);
    }

    @Test
    void cleanedPixelsStayInInputUnits() {
        Image reference = noisyField(8);
        float[][] sci = reference.toArray();
        SyntheticSky.addStar(sci, 100, 100, 800, SyntheticSky.STAR_SIGMA);
        CleaningOptions options = new CleaningOptions();
        options.setMorphologyEnabled(false);
        options.setMedianEnabled(false);
        options.setGaussianEnabled(false);

        DifferenceMap map = new DifferenceEngine(options).compute(reference, new Image(sci), IDENTITY);

        assertEquals(map.getResidual(100, 100), map.get(100, 100), 1e-3);
        assertEquals(800.0, map.get(100, 100), 1.0);
        assertTrue(map.get(100, 100) / map.getStatistics().getNoiseSigma() > 1.0);
    }

    @Test
    void pixelsOutsideWarpedScienceAreUncovered() {
        Image reference = noisyField(6);
        Image science = noisyField(7);
        AlignmentTransform shift = AlignmentTransform.rigid(0, 15, 0);

        DifferenceMap map = new DifferenceEngine(new CleaningOptions()).compute(reference, science, shift);

        assertFalse(map.isCovered(5, 100));
        assertEquals(0f, map.getResidual(5, 100));
        assertEquals(0f, map.get(5, 100));
        assertTrue(map.isCovered(100, 100));
        assertTrue(map.coveredPixelCount() < 200 * 200);
    }

    @Test
    void constantDifferenceSkipsThresholdInsteadOfFailing() {
        float[][] p = new float[50][50];
        for (float[] row : p) {
            java.util.Arrays.fill(row, 5f);
        }
        DifferenceMap map = new DifferenceEngine(new CleaningOptions()).clean(new Image(p));
        assertTrue(map.getReport().getSkippedStages().stream().anyMatch(s -> s.startsWith(DifferenceEngine.STAGE_THRESHOLD)));
        assertFalse(map.isEmptyResidual());
    }

    @Test
    void disabledStagesAreReportedAsSkipped() {
        CleaningOptions options = new CleaningOptions();
        options.setMorphologyEnabled(false);
        options.setMedianEnabled(false);
        options.setGaussianEnabled(false);
        float[][] p = SyntheticSky.background(80, 80, 0, 1, 8);
        SyntheticSky.addStar(p, 40, 40, 100, 2);
        DifferenceMap map = new DifferenceEngine(options).clean(new Image(p));

        assertEquals(3, map.getReport().getSkippedStages().size());
        assertTrue(map.get(40, 40) > 0);
        assertEquals(map.getReport().finalPixelCount(), map.countNonZero());
    }

    @Test
    void missingInputsAreInputErrors() {
        DifferenceEngine engine = new DifferenceEngine(new CleaningOptions());
        assertThrows(InputException.class, () -> engine.compute(null, Image.zeros(5, 5), IDENTITY));
        assertThrows(InputException.class, () -> engine.clean(null));
    }
}
