package com.enterprise.taskworker.exception;

/**
 * Exception thrown when an execution pool cannot be started,
 * e.g. because its strategy is unavailable on this platform.
 */
public class PoolStartException extends TaskWorkerException {
    
    public PoolStartException(String message) {
        super(message);
    }
    
    public PoolStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
