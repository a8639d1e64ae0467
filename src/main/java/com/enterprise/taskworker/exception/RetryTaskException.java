package com.enterprise.taskworker.exception;

import java.time.Duration;

/**
 * Thrown by a handler to ask for the task to be retried.
 * Use {@code TaskContext.retry(...)} to create one.
 */
public class RetryTaskException extends RuntimeException {
    
    private final Duration countdown;
    
    public RetryTaskException(Duration countdown, Throwable cause) {
        super(cause != null ? "Retry requested: " + cause.getMessage() : "Retry requested", cause);
        this.countdown = countdown;
    }
    
    /**
     * Delay before the retry, or null to use the task's retry policy
     */
    public Duration getCountdown() {
        return countdown;
    }
}
