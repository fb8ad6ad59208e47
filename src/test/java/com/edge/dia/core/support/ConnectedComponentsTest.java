package com.edge.dia.core.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ConnectedComponentsTest {

    private static float[][] field() {
        float[][] p = new float[10][10];
        // 2x2 块
        p[1][1] = 1f;
        p[1][2] = 1f;
        p[2][1] = 1f;
        p[2][2] = 1f;
        // 对角相接的单像素
        p[3][3] = -2f;
        // 孤立像素
        p[8][8] = 5f;
        return p;
    }

    @Test
    void eightConnectivityJoinsDiagonals() {
        ConnectedComponents cc = ConnectedComponents.label(field(), 8);
        assertEquals(2, cc.getCount());
        assertEquals(cc.labelAt(1, 1), cc.labelAt(3, 3));
        assertEquals(5, cc.areaOf(cc.labelAt(1, 1)));
        assertEquals(0, cc.labelAt(0, 0));
    }

    @Test
    void fourConnectivitySeparatesDiagonals() {
        ConnectedComponents cc = ConnectedComponents.label(field(), 4);
        assertEquals(3, cc.getCount());
        assertNotEquals(cc.labelAt(1, 1), cc.labelAt(3, 3));
    }

    @Test
    void removesComponentsBelowMinimumArea() {
        float[][] p = field();
        float[][] kept = ConnectedComponents.label(p, 8).removeSmall(p, 2);
        assertEquals(1f, kept[1][1]);
        assertEquals(-2f, kept[3][3]);
        assertEquals(0f, kept[8][8]);
        assertEquals(5f, p[8][8]);
    }
}
