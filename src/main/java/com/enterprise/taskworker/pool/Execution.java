package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One submission of a request to a pool, from submit until its outcome is delivered
 */
public final class Execution {
    
    private final TaskRequest request;
    private final TaskDefinition definition;
    private final Duration softTimeLimit;
    private final Duration hardTimeLimit;
    private final Consumer<TaskOutcome> callback;
    private final AtomicBoolean delivered = new AtomicBoolean(false);
    private final AtomicBoolean softSignalled = new AtomicBoolean(false);
    
    private volatile int slotId = -1;
    private volatile long startedNanos;
    private volatile Instant startedAt;
    private volatile TaskContext context;
    
    Execution(TaskRequest request, TaskDefinition definition, Duration softTimeLimit, Duration hardTimeLimit,
              Consumer<TaskOutcome> callback) {
        this.request = request;
        this.definition = definition;
        this.softTimeLimit = softTimeLimit;
        this.hardTimeLimit = hardTimeLimit;
        this.callback = callback;
    }
    
    public TaskRequest getRequest() { return request; }
    
    public String getRequestId() { return request.getId(); }
    
    public TaskDefinition getDefinition() { return definition; }
    
    public Duration getSoftTimeLimit() { return softTimeLimit; }
    
    public Duration getHardTimeLimit() { return hardTimeLimit; }
    
    public int getSlotId() { return slotId; }
    
    public Instant getStartedAt() { return startedAt; }
    
    /**
     * Context of the running handler, for strategies that run it in this JVM
     */
    public TaskContext getContext() { return context; }
    
    public void attachContext(TaskContext context) {
        this.context = context;
    }
    
    Consumer<TaskOutcome> getCallback() { return callback; }
    
    void markStarted(int slotId) {
        this.slotId = slotId;
        this.startedNanos = System.nanoTime();
        this.startedAt = Instant.now();
    }
    
    boolean isStarted() {
        return startedAt != null;
    }
    
    long elapsedMillis() {
        return isStarted() ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos) : 0;
    }
    
    boolean isSoftDeadlinePassed(long nowNanos) {
        return isStarted() && softTimeLimit != null && nowNanos - startedNanos >= softTimeLimit.toNanos();
    }
    
    boolean isHardDeadlinePassed(long nowNanos) {
        return isStarted() && hardTimeLimit != null && nowNanos - startedNanos >= hardTimeLimit.toNanos();
    }
    
    /**
     * Returns true only for the first caller
     */
    boolean markSoftSignalled() {
        return softSignalled.compareAndSet(false, true);
    }
    
    boolean markDelivered() {
        return delivered.compareAndSet(false, true);
    }
    
    @Override
    public String toString() {
        return request.toString();
    }
}
