package com.enterprise.taskworker.pool.process;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.pool.AbstractExecutionPool;
import com.enterprise.taskworker.pool.PoolStrategy;
import com.enterprise.taskworker.pool.SlotWorker;

/**
 * Copy-on-write forked children. The JVM cannot fork itself, so this pool never starts.
 */
public class ProcessForkPool extends AbstractExecutionPool {
    
    public ProcessForkPool(TaskRegistry registry) {
        super(PoolStrategy.PROCESS_FORK, registry);
    }
    
    @Override
    protected void checkAvailable(WorkerConfig.PoolConfig config) throws PoolStartException {
        throw new PoolStartException("The " + PoolStrategy.PROCESS_FORK + " strategy is not available on the JVM: "
            + "a running JVM cannot fork(2) itself. Use " + PoolStrategy.PROCESS_SPAWN
            + ", which starts a fresh child JVM per slot");
    }
    
    @Override
    protected SlotWorker createWorker(int slotId, SlotWorker.Listener listener) {
        throw new UnsupportedOperationException(PoolStrategy.PROCESS_FORK + " pool has no workers");
    }
}
