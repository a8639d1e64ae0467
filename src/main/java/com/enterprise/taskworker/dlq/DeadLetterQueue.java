package com.enterprise.taskworker.dlq;

import java.util.List;
import java.util.Optional;

/**
 * Store for requests the worker rejected: retries exhausted, non-retryable failures,
 * revoked, expired or undeliverable messages. Entries are keyed by request id.
 */
public interface DeadLetterQueue {
    
    /**
     * Adds a rejected request. An entry for the same request id is replaced.
     * 
     * @return false if the queue is full or the entry could not be written
     */
    boolean add(DeadLetterEntry entry);
    
    Optional<DeadLetterEntry> get(String requestId);
    
    /**
     * Entries of one task, oldest first
     */
    List<DeadLetterEntry> findByTask(String taskName);
    
    /**
     * @return true if the entry existed
     */
    boolean remove(String requestId);
    
    int size();
    
    boolean isAtCapacity();
    
    DeadLetterQueueStatistics getStatistics();
    
    /**
     * Drops entries older than the retention period.
     * 
     * @return number of entries dropped
     */
    int cleanupOldEntries();
    
    void close();
}
