package com.enterprise.taskworker.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Maximum dispatches of one task type per time window, parsed from "10/s", "100/m" or "1000/h".
 * A bare number means per second.
 */
public final class RateLimit {
    
    private final int limit;
    private final Duration period;
    
    public RateLimit(int limit, Duration period) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Rate limit must be greater than 0");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Rate limit period must be positive");
        }
        this.limit = limit;
        this.period = period;
    }
    
    public static RateLimit parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new IllegalArgumentException("Rate limit expression is empty");
        }
        String value = expression.trim();
        int slash = value.indexOf('/');
        String count = slash < 0 ? value : value.substring(0, slash);
        String unit = slash < 0 ? "s" : value.substring(slash + 1).trim();
        
        int limit;
        try {
            limit = Integer.parseInt(count.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid rate limit: " + expression, e);
        }
        
        Duration period;
        switch (unit) {
            case "s":
                period = Duration.ofSeconds(1);
                break;
            case "m":
                period = Duration.ofMinutes(1);
                break;
            case "h":
                period = Duration.ofHours(1);
                break;
            default:
                throw new IllegalArgumentException("Invalid rate limit unit '" + unit + "' in: " + expression);
        }
        return new RateLimit(limit, period);
    }
    
    public int getLimit() { return limit; }
    
    public Duration getPeriod() { return period; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateLimit)) return false;
        RateLimit that = (RateLimit) o;
        return limit == that.limit && period.equals(that.period);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(limit, period);
    }
    
    @Override
    public String toString() {
        return limit + " per " + period;
    }
}
