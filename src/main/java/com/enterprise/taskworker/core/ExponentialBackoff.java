package com.enterprise.taskworker.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff: {@code min(maxDelay, base * 2^retryCount)}, optionally jittered
 * uniformly over {@code [0, delay]} so workers retrying in lockstep spread out.
 */
public final class ExponentialBackoff {
    
    private static final LongUnaryOperator RANDOM = bound -> ThreadLocalRandom.current().nextLong(bound + 1);
    
    private ExponentialBackoff() {
    }
    
    public static Duration nextDelay(int retryCount, Duration base, Duration maxDelay, boolean jitter) {
        return nextDelay(retryCount, base, maxDelay, jitter, RANDOM);
    }
    
    /**
     * @param random given an inclusive upper bound, returns a value in {@code [0, bound]}
     */
    public static Duration nextDelay(int retryCount, Duration base, Duration maxDelay, boolean jitter,
                                     LongUnaryOperator random) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count cannot be negative: " + retryCount);
        }
        long baseMs = base.toMillis();
        long maxMs = maxDelay.toMillis();
        
        long delayMs;
        if (retryCount >= Long.SIZE - 1) {
            delayMs = maxMs;
        } else {
            try {
                delayMs = Math.min(maxMs, Math.multiplyExact(baseMs, 1L << retryCount));
            } catch (ArithmeticException overflow) {
                delayMs = maxMs;
            }
        }
        
        if (jitter && delayMs > 0) {
            delayMs = random.applyAsLong(delayMs);
        }
        return Duration.ofMillis(delayMs);
    }
}
