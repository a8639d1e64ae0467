package com.enterprise.taskworker.exception;

/**
 * Raised inside a running task once its soft time limit has passed
 */
public class SoftTimeLimitExceededException extends RuntimeException {
    
    public SoftTimeLimitExceededException(String message) {
        super(message);
    }
}
