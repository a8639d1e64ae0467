package com.enterprise.taskworker.pool.process;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRegistryProvider;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.pool.AbstractExecutionPool;
import com.enterprise.taskworker.pool.PoolStrategy;
import com.enterprise.taskworker.pool.SlotWorker;

/**
 * One freshly started child JVM per slot. Children rebuild the task registry from
 * the configured {@link TaskRegistryProvider}, so they inherit no descriptors,
 * threads or locks from the parent.
 */
public class SpawnProcessPool extends AbstractExecutionPool {
    
    public SpawnProcessPool(TaskRegistry registry) {
        super(PoolStrategy.PROCESS_SPAWN, registry);
    }
    
    @Override
    protected void checkAvailable(WorkerConfig.PoolConfig config) throws PoolStartException {
        String provider = config.getRegistryProvider();
        if (provider == null || provider.trim().isEmpty()) {
            throw new PoolStartException("The " + PoolStrategy.PROCESS_SPAWN
                + " strategy needs a registry provider class for its child JVMs");
        }
        try {
            Class<?> type = Class.forName(provider);
            if (!TaskRegistryProvider.class.isAssignableFrom(type)) {
                throw new PoolStartException(provider + " does not implement " + TaskRegistryProvider.class.getName());
            }
        } catch (ClassNotFoundException e) {
            throw new PoolStartException("Registry provider class not found: " + provider, e);
        }
    }
    
    @Override
    protected SlotWorker createWorker(int slotId, SlotWorker.Listener listener) {
        return new SpawnedChildWorker(slotId, config(), listener);
    }
}
