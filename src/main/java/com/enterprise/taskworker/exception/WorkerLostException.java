package com.enterprise.taskworker.exception;

/**
 * Recorded as the error of a task whose thread or process died before reporting
 */
public class WorkerLostException extends Exception {
    
    public WorkerLostException(String message) {
        super(message);
    }
}
