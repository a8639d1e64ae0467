package com.enterprise.taskworker.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry policy of a task definition
 */
public interface RetryPolicy {
    
    /**
     * Maximum number of retries, or null for unlimited
     */
    Integer getMaxRetries();
    
    /**
     * Whether {@code retries} retries already used up the budget
     */
    default boolean isExhausted(int retries) {
        Integer max = getMaxRetries();
        return max != null && retries >= max;
    }
    
    /**
     * Whether a failure with this error may be retried at all
     */
    boolean isRetryable(ExceptionInfo error);
    
    /**
     * Delay before the retry following {@code retries} previous retries
     */
    Duration getRetryDelay(int retries);
    
    /**
     * Default retry policy implementation based on exponential backoff
     */
    class DefaultRetryPolicy implements RetryPolicy {
        private final Integer maxRetries;
        private final Duration baseDelay;
        private final Duration maxDelay;
        private final boolean jitter;
        private final List<Class<? extends Throwable>> retryOn;
        private final List<Class<? extends Throwable>> dontRetryOn;
        
        public DefaultRetryPolicy(Integer maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter,
                                  List<Class<? extends Throwable>> retryOn,
                                  List<Class<? extends Throwable>> dontRetryOn) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.maxDelay = maxDelay;
            this.jitter = jitter;
            this.retryOn = List.copyOf(retryOn);
            this.dontRetryOn = List.copyOf(dontRetryOn);
        }
        
        @Override
        public Integer getMaxRetries() {
            return maxRetries;
        }
        
        @Override
        public boolean isRetryable(ExceptionInfo error) {
            if (error == null) {
                return true;
            }
            for (Class<? extends Throwable> type : dontRetryOn) {
                if (error.isInstanceOf(type)) {
                    return false;
                }
            }
            if (retryOn.isEmpty()) {
                return true;
            }
            return retryOn.stream().anyMatch(error::isInstanceOf);
        }
        
        @Override
        public Duration getRetryDelay(int retries) {
            return ExponentialBackoff.nextDelay(retries, baseDelay, maxDelay, jitter);
        }
        
        public Duration getBaseDelay() { return baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public boolean isJitter() { return jitter; }
    }
    
    /**
     * Builder for creating retry policies
     */
    class Builder {
        private Integer maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(10);
        private boolean jitter = true;
        private final List<Class<? extends Throwable>> retryOn = new ArrayList<>();
        private final List<Class<? extends Throwable>> dontRetryOn = new ArrayList<>();
        
        /**
         * Maximum retries; null means unlimited
         */
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder unlimited() {
            this.maxRetries = null;
            return this;
        }
        
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }
        
        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }
        
        /**
         * Restrict retries to failures of these types (and subtypes)
         */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            this.retryOn.addAll(List.of(types));
            return this;
        }
        
        /**
         * Never retry failures of these types (and subtypes)
         */
        @SafeVarargs
        public final Builder dontRetryOn(Class<? extends Throwable>... types) {
            this.dontRetryOn.addAll(List.of(types));
            return this;
        }
        
        public RetryPolicy build() {
            if (maxRetries != null && maxRetries < 0) {
                throw new IllegalArgumentException("Maximum retries cannot be negative");
            }
            if (baseDelay.isNegative() || maxDelay.isNegative()) {
                throw new IllegalArgumentException("Retry delays cannot be negative");
            }
            return new DefaultRetryPolicy(maxRetries, baseDelay, maxDelay, jitter, retryOn, dontRetryOn);
        }
    }
    
    static Builder builder() {
        return new Builder();
    }
    
    /**
     * Predefined retry policies
     */
    class Predefined {
        
        /**
         * No retry policy
         */
        public static RetryPolicy noRetry() {
            return builder().maxRetries(0).build();
        }
        
        /**
         * Three retries, 1s base, capped at ten minutes
         */
        public static RetryPolicy standard() {
            return builder().build();
        }
        
        /**
         * Retry forever, backing off up to one hour
         */
        public static RetryPolicy unlimited() {
            return builder()
                .unlimited()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofHours(1))
                .build();
        }
        
        /**
         * Retry policy for network-related failures
         */
        public static RetryPolicy networkRetry() {
            return builder()
                .maxRetries(5)
                .baseDelay(Duration.ofSeconds(3))
                .maxDelay(Duration.ofMinutes(2))
                .retryOn(java.io.IOException.class)
                .build();
        }
    }
}
