package com.enterprise.taskworker.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitTest {

    @Test
    void testParseUnits() {
        assertEquals(new RateLimit(10, Duration.ofSeconds(1)), RateLimit.parse("10/s"));
        assertEquals(new RateLimit(100, Duration.ofMinutes(1)), RateLimit.parse("100/m"));
        assertEquals(new RateLimit(1000, Duration.ofHours(1)), RateLimit.parse(" 1000/h "));
    }

    @Test
    void testBareNumberIsPerSecond() {
        assertEquals(new RateLimit(7, Duration.ofSeconds(1)), RateLimit.parse("7"));
    }

    @Test
    void testInvalidExpressions() {
        assertThrows(IllegalArgumentException.class, () -> RateLimit.parse(""));
        assertThrows(IllegalArgumentException.class, () -> RateLimit.parse("ten/s"));
        assertThrows(IllegalArgumentException.class, () -> RateLimit.parse("10/d"));
        assertThrows(IllegalArgumentException.class, () -> RateLimit.parse("0/s"));
    }
}
