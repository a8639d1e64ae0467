package com.enterprise.taskworker.exception;

/**
 * Exception thrown when a broker message cannot be decoded into a task request
 */
public class MalformedMessageException extends TaskWorkerException {
    
    public MalformedMessageException(String message) {
        super(message);
    }
    
    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
