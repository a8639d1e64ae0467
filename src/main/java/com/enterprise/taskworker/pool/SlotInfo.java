package com.enterprise.taskworker.pool;

import java.time.Instant;

/**
 * Read-only snapshot of a pool slot
 */
public final class SlotInfo {
    
    private final int slotId;
    private final String requestId;
    private final String taskName;
    private final Instant startedAt;
    private final long completedCount;
    private final Long pid;
    private final Long memoryBytes;
    private final boolean alive;
    
    public SlotInfo(int slotId, String requestId, String taskName, Instant startedAt, long completedCount,
                    Long pid, Long memoryBytes, boolean alive) {
        this.slotId = slotId;
        this.requestId = requestId;
        this.taskName = taskName;
        this.startedAt = startedAt;
        this.completedCount = completedCount;
        this.pid = pid;
        this.memoryBytes = memoryBytes;
        this.alive = alive;
    }
    
    public int getSlotId() { return slotId; }
    
    /** Id of the request occupying the slot, or null when idle */
    public String getRequestId() { return requestId; }
    
    public String getTaskName() { return taskName; }
    
    public Instant getStartedAt() { return startedAt; }
    
    public long getCompletedCount() { return completedCount; }
    
    /** Process id for process strategies, otherwise null */
    public Long getPid() { return pid; }
    
    /** Last memory usage reported by the worker, or null */
    public Long getMemoryBytes() { return memoryBytes; }
    
    public boolean isAlive() { return alive; }
    
    public boolean isBusy() { return requestId != null; }
    
    @Override
    public String toString() {
        return "SlotInfo{slot=" + slotId + ", request=" + requestId + ", completed=" + completedCount
            + ", pid=" + pid + ", alive=" + alive + "}";
    }
}
