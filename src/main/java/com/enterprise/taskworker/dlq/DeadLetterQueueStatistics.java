package com.enterprise.taskworker.dlq;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the dead letter queue. Added/removed totals survive restarts.
 */
public class DeadLetterQueueStatistics {
    
    private final int currentSize;
    private final long totalAdded;
    private final long totalRemoved;
    private final Instant oldestEntryTime;
    private final Map<RejectionReason, Integer> reasonCounts;
    private final Map<String, Integer> errorTypeCounts;
    private final Map<String, Integer> taskNameCounts;
    
    public DeadLetterQueueStatistics(int currentSize, long totalAdded, long totalRemoved, Instant oldestEntryTime,
                                     Map<RejectionReason, Integer> reasonCounts,
                                     Map<String, Integer> errorTypeCounts,
                                     Map<String, Integer> taskNameCounts) {
        this.currentSize = currentSize;
        this.totalAdded = totalAdded;
        this.totalRemoved = totalRemoved;
        this.oldestEntryTime = oldestEntryTime;
        this.reasonCounts = Map.copyOf(reasonCounts);
        this.errorTypeCounts = Map.copyOf(errorTypeCounts);
        this.taskNameCounts = Map.copyOf(taskNameCounts);
    }
    
    public int getCurrentSize() { return currentSize; }
    public long getTotalAdded() { return totalAdded; }
    public long getTotalRemoved() { return totalRemoved; }
    public Instant getOldestEntryTime() { return oldestEntryTime; }
    
    public int countFor(RejectionReason reason) {
        return reasonCounts.getOrDefault(reason, 0);
    }
    
    public Map<RejectionReason, Integer> getReasonCounts() { return reasonCounts; }
    
    /**
     * Counts by the last error's exception class; timeouts and lost workers show up as
     * their marker exceptions
     */
    public Map<String, Integer> getErrorTypeCounts() { return errorTypeCounts; }
    
    public Map<String, Integer> getTaskNameCounts() { return taskNameCounts; }
    
    @Override
    public String toString() {
        return "DeadLetterQueueStatistics{" +
                "size=" + currentSize +
                ", added=" + totalAdded +
                ", removed=" + totalRemoved +
                ", reasons=" + reasonCounts +
                ", tasks=" + taskNameCounts +
                '}';
    }
}
