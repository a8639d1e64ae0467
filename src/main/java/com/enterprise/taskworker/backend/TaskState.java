package com.enterprise.taskworker.backend;

/**
 * Request states recorded in a result backend
 */
public enum TaskState {
    SUCCESS,
    FAILURE,
    RETRY,
    REVOKED,
    REJECTED;
    
    public boolean isReady() {
        return this != RETRY;
    }
}
