package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.exception.PoolStartException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Runs task requests on a fixed number of slots using one execution strategy.
 * Every accepted submission gets exactly one outcome, delivered on the pool's callback thread.
 */
public interface ExecutionPool {
    
    /**
     * Create and start all slots
     *
     * @throws PoolStartException if the strategy is unavailable or a slot cannot be started
     */
    void start(WorkerConfig.PoolConfig config) throws PoolStartException;
    
    /**
     * Run a request on a free slot, or queue it behind the busy ones. Never blocks.
     * If the slot fails to take the request, its WORKER_LOST outcome is handed to the
     * callback thread only after the pool lock is released; it may still arrive before
     * this method returns.
     *
     * @throws IllegalStateException after shutdown
     * @throws IllegalArgumentException if the request id is already in the pool
     * @throws java.util.concurrent.RejectedExecutionException if the backlog is full
     */
    void submit(TaskRequest request, Consumer<TaskOutcome> onComplete);
    
    /**
     * Replace the slot's worker, after its current request if it has one
     */
    void restartSlot(int slotId);
    
    /**
     * Forcibly end a request. Its outcome is TIMEOUT if the hard deadline already
     * passed, WORKER_LOST otherwise.
     *
     * @return false if the request is not in the pool
     */
    boolean terminate(String requestId);
    
    /**
     * Stop accepting work, wait up to the grace period, then kill what is still running.
     * Calling it again returns the same future.
     */
    CompletableFuture<Void> shutdown(Duration gracePeriod);
    
    List<SlotInfo> slots();
    
    int concurrency();
    
    PoolStrategy strategy();
    
    /**
     * Number of requests running or queued in the pool
     */
    int activeCount();
    
    boolean isRunning();
}
