package com.enterprise.taskworker.exception;

/**
 * Recorded as the error of a task killed by its hard time limit
 */
public class TimeLimitExceededException extends Exception {
    
    public TimeLimitExceededException(String message) {
        super(message);
    }
}
