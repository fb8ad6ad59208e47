package com.edge.dia.core.align;

import com.edge.dia.core.model.AlignmentResult;
import com.edge.dia.core.model.FeaturePoint;
import com.edge.dia.core.model.Image;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrbAlignmentTest {

    private static final int BLOCK = 12;

    private static float texture(int x, int y) {
        int bx = Math.floorDiv(x, BLOCK);
        int by = Math.floorDiv(y, BLOCK);
        return new Random(bx * 73856093L ^ by * 19349663L).nextInt(256);
    }

    private static Image shifted(int size, int dx, int dy) {
        float[][] p = new float[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                p[y][x] = texture(x - dx, y - dy);
            }
        }
        return new Image(p);
    }

    @Test
    void orbDetectorProducesBinaryDescriptors() {
        IntensityNormalizer normalizer = new IntensityNormalizer(0.5, 99.95);
        List<FeaturePoint> points = new OrbFeatureDetector(500).detectAndDescribe(normalizer.normalize(shifted(300, 0, 0)));
        assertFalse(points.isEmpty());
        assertEquals(32, points.get(0).getDescriptorLength());
    }

    @Test
    void recoversTranslationOfBlockTexture() {
        Image reference = shifted(300, 0, 0);
        Image science = shifted(300, 7, 5);

        AlignmentOptions options = new AlignmentOptions();
        options.setFeatureDetector(FeatureDetectorType.ORB);
        AlignmentResult result = new FeatureAligner(options).align(reference, science);

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(-7.0, result.getTransform().getTranslationX(), 0.5);
        assertEquals(-5.0, result.getTransform().getTranslationY(), 0.5);
        assertEquals(0.0, result.getTransform().getRotationDegrees(), 0.2);
    }
}
