package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.pool.process.ProcessForkPool;
import com.enterprise.taskworker.pool.process.SpawnProcessPool;
import com.enterprise.taskworker.pool.thread.GreenThreadPool;
import com.enterprise.taskworker.pool.thread.NativeThreadPool;
import com.enterprise.taskworker.pool.thread.SoloPool;

/**
 * Factory for execution pools
 */
public final class ExecutionPools {
    
    private ExecutionPools() {
    }
    
    /**
     * Create an unstarted pool for the strategy
     */
    public static ExecutionPool create(PoolStrategy strategy, TaskRegistry registry) {
        switch (strategy) {
            case PROCESS_FORK:
                return new ProcessForkPool(registry);
            case PROCESS_SPAWN:
                return new SpawnProcessPool(registry);
            case GREEN_THREAD:
                return new GreenThreadPool(registry);
            case NATIVE_THREAD:
                return new NativeThreadPool(registry);
            case SOLO:
                return new SoloPool(registry);
            default:
                throw new IllegalArgumentException("Unsupported pool strategy: " + strategy);
        }
    }
}
