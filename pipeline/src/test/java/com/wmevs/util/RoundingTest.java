package com.wmevs.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RoundingTest {

    @Test
    public void testRound1TiesToEven() {
        assertEquals(2.2, Rounding.round1(2.25), 1e-12);
        assertEquals(2.8, Rounding.round1(2.75), 1e-12);
        assertEquals(1.0, Rounding.round1(1.04), 1e-12);
        assertEquals(1.1, Rounding.round1(1.06), 1e-12);
    }

    @Test
    public void testFormat2ShortestForm() {
        assertEquals("0", Rounding.format2(0.0));
        assertEquals("0", Rounding.format2(-0.0));
        assertEquals("0.5", Rounding.format2(0.5));
        assertEquals("1", Rounding.format2(1.0));
        assertEquals("100", Rounding.format2(100.0));
        assertEquals("12.34", Rounding.format2(12.345));
        assertEquals("3.12", Rounding.format2(3.125));
    }

    @Test
    public void testFormat2AbsorbsSubtractionNoise() {
        // 104.6 - 100.0 is not exactly 4.6 in binary
        assertEquals("4.6", Rounding.format2(104.6 - 100.0));
        assertEquals("7.9", Rounding.format2(124.0 - 116.1));
    }

    @Test
    public void testFormat2RejectsNaN() {
        assertThrows(IllegalArgumentException.class, () -> Rounding.format2(Double.NaN));
    }
}
