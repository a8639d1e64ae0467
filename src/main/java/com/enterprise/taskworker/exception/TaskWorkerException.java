package com.enterprise.taskworker.exception;

/**
 * Base exception for task worker related errors
 */
public class TaskWorkerException extends Exception {
    
    public TaskWorkerException(String message) {
        super(message);
    }
    
    public TaskWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
