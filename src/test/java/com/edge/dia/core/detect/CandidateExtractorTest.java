package com.edge.dia.core.detect;

import com.edge.dia.core.model.Candidate;
import com.edge.dia.core.model.CleaningReport;
import com.edge.dia.core.model.DifferenceMap;
import com.edge.dia.core.model.DifferenceStatistics;
import com.edge.dia.core.model.Image;
import com.edge.dia.exception.ConfigurationException;
import com.edge.dia.exception.InputException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CandidateExtractorTest {

    private static final DifferenceStatistics STATS = new DifferenceStatistics(0, 2.0, 100, 0, 8, 0, 100, 5);

    private static void block(float[][] p, int x0, int y0, int w, int h, float value) {
        for (int y = y0; y < y0 + h; y++) {
            for (int x = x0; x < x0 + w; x++) {
                p[y][x] = value;
            }
        }
    }

    private static DifferenceMap map(float[][] p) {
        return DifferenceMap.fromCleanedImage(new Image(p), STATS);
    }

    @Test
    void smallComponentsAreDiscarded() {
        float[][] p = new float[60][60];
        p[5][5] = 50f;
        block(p, 20, 30, 3, 3, 10f);

        List<Candidate> candidates = new CandidateExtractor(new ExtractionOptions()).extract(map(p));

        assertEquals(1, candidates.size());
        Candidate c = candidates.get(0);
        assertEquals(9, c.getArea());
        assertEquals(21.0, c.getX(), 1e-9);
        assertEquals(31.0, c.getY(), 1e-9);
        assertEquals(10.0, c.getPeak(), 1e-9);
        assertEquals(90.0, c.getTotal(), 1e-6);
        assertEquals(10.0, c.getMean(), 1e-6);
        assertEquals(15.0, c.getSnr(), 1e-6);
        assertEquals(1.0, c.getElongation(), 1e-9);
        assertTrue(c.getCompactness() > 0 && c.getCompactness() <= 1.0);
        assertFalse(c.isTouchesBoundary());
        assertTrue(c.getFlags().isEmpty());
    }

    @Test
    void reExtractingRetainedComponentsIsStable() {
        float[][] p = new float[80][80];
        p[3][70] = 5f;
        p[4][70] = 5f;
        block(p, 10, 10, 4, 4, 20f);
        block(p, 50, 40, 2, 6, 30f);
        CandidateExtractor extractor = new CandidateExtractor(new ExtractionOptions());
        DifferenceMap first = map(p);

        List<Candidate> once = extractor.extract(first);
        Image retained = extractor.retainComponents(first);
        List<Candidate> twice = extractor.extract(DifferenceMap.fromCleanedImage(retained, STATS));

        assertEquals(2, once.size());
        assertEquals(once.size(), twice.size());
        for (int i = 0; i < once.size(); i++) {
            assertEquals(once.get(i).getX(), twice.get(i).getX(), 1e-9);
            assertEquals(once.get(i).getY(), twice.get(i).getY(), 1e-9);
            assertEquals(once.get(i).getArea(), twice.get(i).getArea());
        }
        assertEquals(0f, retained.get(70, 3));
    }

    @Test
    void rankingWeighsCenterAgainstBrightness() {
        float[][] p = new float[101][101];
        block(p, 49, 49, 3, 3, 1f);
        block(p, 9, 9, 3, 3, 100f);

        List<Candidate> byDefault = new CandidateExtractor(new ExtractionOptions()).extract(map(p));
        assertEquals(50.0, byDefault.get(0).getX(), 1e-9);
        assertTrue(byDefault.get(0).getRankScore() > byDefault.get(1).getRankScore());

        ExtractionOptions brightFirst = new ExtractionOptions();
        brightFirst.setCenterWeight(0);
        brightFirst.setBrightnessWeight(1);
        List<Candidate> byBrightness = new CandidateExtractor(brightFirst).extract(map(p));
        assertEquals(10.0, byBrightness.get(0).getX(), 1e-9);
        assertEquals(1.0, byBrightness.get(0).getRankScore(), 1e-9);
    }

    @Test
    void connectivityDecidesWhetherDiagonalBlocksMerge() {
        float[][] p = new float[30][30];
        block(p, 10, 10, 2, 2, 7f);
        block(p, 12, 12, 2, 2, 7f);

        assertEquals(1, new CandidateExtractor(new ExtractionOptions()).extract(map(p)).size());

        ExtractionOptions four = new ExtractionOptions();
        four.setConnectivity(4);
        List<Candidate> split = new CandidateExtractor(four).extract(map(p));
        assertEquals(2, split.size());
        assertEquals(4, split.get(0).getArea());
    }

    @Test
    void shapeAndFluxFlags() {
        float[][] p = new float[40][40];
        block(p, 0, 5, 3, 3, 9f);
        block(p, 20, 10, 1, 12, 9f);
        float[][] residual = new float[40][40];
        for (float[] row : residual) {
            Arrays.fill(row, -1f);
        }
        boolean[][] coverage = new boolean[40][40];
        for (boolean[] row : coverage) {
            Arrays.fill(row, true);
        }
        DifferenceMap map = new DifferenceMap(new Image(p), residual, coverage, null, null, STATS,
            new CleaningReport(), false);

        List<Candidate> candidates = new CandidateExtractor(new ExtractionOptions()).extract(map);
        Candidate edge = candidates.stream().filter(c -> c.getX() < 5).findFirst().orElseThrow();
        Candidate streak = candidates.stream().filter(c -> c.getX() > 15).findFirst().orElseThrow();

        assertTrue(edge.isTouchesBoundary());
        assertTrue(edge.hasFlag(Candidate.FLAG_BOUNDARY));
        assertTrue(edge.hasFlag(Candidate.FLAG_NEGATIVE));
        assertEquals(-9.0, edge.getNetFlux(), 1e-6);
        assertTrue(streak.getElongation() > 5.0);
    }

    @Test
    void measuresReferenceSignificanceUnderCentroid() {
        float[][] p = new float[50][50];
        block(p, 24, 24, 3, 3, 10f);
        float[][] ref = new float[50][50];
        for (float[] row : ref) {
            Arrays.fill(row, 100f);
        }
        ref[25][25] = 600f;
        boolean[][] coverage = new boolean[50][50];
        for (boolean[] row : coverage) {
            Arrays.fill(row, true);
        }
        DifferenceMap map = new DifferenceMap(new Image(p), p, coverage, new Image(ref), null, STATS,
            new CleaningReport(), false);

        Candidate c = new CandidateExtractor(new ExtractionOptions()).extract(map).get(0);
        assertEquals(100.0, c.getReferenceSignificance(), 1e-6);
    }

    @Test
    void emptyAndMissingMaps() {
        CandidateExtractor extractor = new CandidateExtractor(new ExtractionOptions());
        assertTrue(extractor.extract(map(new float[10][10])).isEmpty());
        assertThrows(InputException.class, () -> extractor.extract(null));
    }

    @Test
    void rejectsInvalidOptions() {
        ExtractionOptions connectivity = new ExtractionOptions();
        connectivity.setConnectivity(6);
        assertThrows(ConfigurationException.class, () -> new CandidateExtractor(connectivity));

        ExtractionOptions negative = new ExtractionOptions();
        negative.setCenterWeight(-1);
        assertThrows(ConfigurationException.class, negative::validate);

        ExtractionOptions zero = new ExtractionOptions();
        zero.setCenterWeight(0);
        zero.setBrightnessWeight(0);
        assertThrows(ConfigurationException.class, zero::normalizedWeights);

        ExtractionOptions area = new ExtractionOptions();
        area.setMinCandidateArea(0);
        assertThrows(ConfigurationException.class, area::validate);
    }
}
