package com.enterprise.taskworker.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

    private static final Duration BASE = Duration.ofSeconds(1);
    private static final Duration MAX = Duration.ofSeconds(60);

    @Test
    void testDelayDoublesPerRetry() {
        assertEquals(Duration.ofSeconds(1), ExponentialBackoff.nextDelay(0, BASE, MAX, false));
        assertEquals(Duration.ofSeconds(2), ExponentialBackoff.nextDelay(1, BASE, MAX, false));
        assertEquals(Duration.ofSeconds(8), ExponentialBackoff.nextDelay(3, BASE, MAX, false));
    }

    @Test
    void testDelayIsCappedAtMax() {
        assertEquals(MAX, ExponentialBackoff.nextDelay(10, BASE, MAX, false));
        assertEquals(MAX, ExponentialBackoff.nextDelay(62, BASE, MAX, false));
        assertEquals(MAX, ExponentialBackoff.nextDelay(Integer.MAX_VALUE, BASE, MAX, false));
    }

    @Test
    void testOverflowClampsToMax() {
        Duration hugeBase = Duration.ofMillis(Long.MAX_VALUE / 4);
        Duration hugeMax = Duration.ofMillis(Long.MAX_VALUE / 2);
        assertEquals(hugeMax, ExponentialBackoff.nextDelay(5, hugeBase, hugeMax, false));
    }

    @Test
    void testJitterStaysWithinBounds() {
        for (int i = 0; i < 200; i++) {
            Duration delay = ExponentialBackoff.nextDelay(3, BASE, MAX, true);
            assertFalse(delay.isNegative());
            assertTrue(delay.compareTo(Duration.ofSeconds(8)) <= 0, "jittered delay " + delay + " exceeds 8s");
        }
    }

    @Test
    void testJitterUsesSuppliedRandomSource() {
        assertEquals(Duration.ZERO, ExponentialBackoff.nextDelay(3, BASE, MAX, true, bound -> 0));
        assertEquals(Duration.ofSeconds(8), ExponentialBackoff.nextDelay(3, BASE, MAX, true, bound -> bound));
    }

    @Test
    void testNegativeRetryCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ExponentialBackoff.nextDelay(-1, BASE, MAX, false));
    }
}
