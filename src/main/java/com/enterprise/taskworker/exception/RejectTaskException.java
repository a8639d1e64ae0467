package com.enterprise.taskworker.exception;

/**
 * Thrown by a handler to reject its message outright, bypassing retries
 */
public class RejectTaskException extends RuntimeException {
    
    private final boolean requeue;
    
    public RejectTaskException(String reason, boolean requeue) {
        super(reason);
        this.requeue = requeue;
    }
    
    public boolean isRequeue() {
        return requeue;
    }
}
