package com.enterprise.taskworker.backend;

import java.util.Optional;

/**
 * Where request states and results are reported. The dispatcher treats every
 * failure here as non-fatal.
 */
public interface ResultBackend {
    
    void storeResult(String requestId, TaskResultRecord record) throws Exception;
    
    Optional<TaskResultRecord> getResult(String requestId) throws Exception;
    
    default void close() {
    }
    
    /**
     * Backend that stores nothing
     */
    static ResultBackend disabled() {
        return new ResultBackend() {
            @Override
            public void storeResult(String requestId, TaskResultRecord record) {
            }
            
            @Override
            public Optional<TaskResultRecord> getResult(String requestId) {
                return Optional.empty();
            }
        };
    }
}
