package com.wangbin.liveprobe.common.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NumberUtilTest {

    @Test
    void numbersWithUnitsAndCommaDecimals() {
        assertEquals(2048L, NumberUtil.toLong("2048 kbps"));
        assertEquals(1.5, NumberUtil.toDouble("1,5%"), 1e-9);
        assertEquals(-3.0, NumberUtil.toDouble("-3"), 1e-9);
        assertEquals(1.0, NumberUtil.toDouble(Boolean.TRUE), 1e-9);
        assertNull(NumberUtil.toDouble("n/a"));
        assertNull(NumberUtil.toDouble(Double.NaN));
        assertNull(NumberUtil.toLong(null));
    }

    @Test
    void onlyTheLeadingNumberIsRead() {
        assertEquals(1500.0, NumberUtil.toDouble("1.5e3"), 1e-9);
        assertEquals(12L, NumberUtil.toLong("12 kb/s (avg 10)"));
        assertEquals(7.0, NumberUtil.toDouble("+7ms"), 1e-9);
        assertEquals(0.25, NumberUtil.toDouble(".25"), 1e-9);
        assertNull(NumberUtil.toDouble("avg 10"));
        assertNull(NumberUtil.toDouble("-"));
        assertNull(NumberUtil.toDouble(""));
    }

    @Test
    void coordinatesHonourHemisphereLetters() {
        assertEquals(48.85, NumberUtil.toCoordinate("48.85N"), 1e-9);
        assertEquals(-22.9, NumberUtil.toCoordinate("22.9 S"), 1e-9);
        assertEquals(-43.2, NumberUtil.toCoordinate("43,2w"), 1e-9);
        assertEquals(2.35, NumberUtil.toCoordinate(2.35), 1e-9);
        assertNull(NumberUtil.toCoordinate(""));
        assertNull(NumberUtil.toCoordinate("abcN"));
    }

    @Test
    void timestampsInSecondsMillisAndIso() {
        Instant expected = Instant.parse("2024-05-01T10:00:00Z");
        assertEquals(expected, NumberUtil.toInstant(1714557600L));
        assertEquals(expected, NumberUtil.toInstant(1714557600000L));
        assertEquals(expected, NumberUtil.toInstant("1714557600000"));
        assertEquals(expected, NumberUtil.toInstant("2024-05-01T10:00:00Z"));
        assertEquals(expected, NumberUtil.toInstant("2024-05-01T12:00:00+02:00"));
        assertNull(NumberUtil.toInstant("yesterday"));
        assertNull(NumberUtil.toInstant(0));
    }
}
