package com.edge.dia.core.annotate;

import com.edge.dia.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RadiusMapperTest {

    private final RadiusMapper mapper = new RadiusMapper(3, 20);

    @Test
    void mapsRangeEndsToRadiusEnds() {
        assertEquals(3.0, mapper.radius(10, 10, 110), 1e-12);
        assertEquals(20.0, mapper.radius(110, 10, 110), 1e-12);
        assertEquals(11.5, mapper.radius(60, 10, 110), 1e-12);
    }

    @Test
    void clampsOutsideValues() {
        assertEquals(3.0, mapper.radius(-50, 10, 110), 1e-12);
        assertEquals(20.0, mapper.radius(500, 10, 110), 1e-12);
    }

    @Test
    void equalBoundsGiveMidpoint() {
        assertEquals(11.5, mapper.radius(7, 7, 7), 1e-12);
    }

    @Test
    void rejectsInvertedRadii() {
        assertThrows(ConfigurationException.class, () -> new RadiusMapper(10, 5));

        AnnotationOptions options = new AnnotationOptions();
        options.setMinRadius(25);
        assertThrows(ConfigurationException.class, () -> new Annotator(options));
    }
}
