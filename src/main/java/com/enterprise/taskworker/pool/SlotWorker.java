package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.exception.PoolStartException;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * The thing occupying a pool slot: a thread, a thread launcher or a child process.
 * Runs at most one execution at a time and reports through its {@link Listener}.
 */
public interface SlotWorker {
    
    void start() throws PoolStartException;
    
    /**
     * Begin running an execution without waiting for it
     */
    void run(Execution execution) throws IOException;
    
    boolean isAlive();
    
    /**
     * Deliver the cooperative soft time-limit signal to the running execution
     */
    void signalSoftTimeout(Execution execution);
    
    /**
     * Forcibly end whatever is running. The worker is not reused afterwards.
     */
    void kill();
    
    /**
     * Release an idle worker
     */
    void stop();
    
    default OptionalLong memoryUsage() {
        return OptionalLong.empty();
    }
    
    default OptionalLong pid() {
        return OptionalLong.empty();
    }
    
    /**
     * Callbacks from a worker to its pool
     */
    interface Listener {
        
        void completed(SlotWorker worker, Execution execution, TaskOutcome outcome);
        
        /**
         * The worker ended unexpectedly; the pool may also notice through {@link #isAlive()}
         */
        void died(SlotWorker worker, String detail);
    }
}
