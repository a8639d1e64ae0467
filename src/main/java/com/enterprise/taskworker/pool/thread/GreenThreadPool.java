package com.enterprise.taskworker.pool.thread;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.NamedThreadFactory;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.pool.AbstractExecutionPool;
import com.enterprise.taskworker.pool.PoolStrategy;
import com.enterprise.taskworker.pool.SlotWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slots are logical; each execution runs on its own small-stack daemon thread
 */
public class GreenThreadPool extends AbstractExecutionPool {
    
    private static final Logger logger = LoggerFactory.getLogger(GreenThreadPool.class);
    
    static final long STACK_SIZE = 256 * 1024;
    
    public GreenThreadPool(TaskRegistry registry) {
        super(PoolStrategy.GREEN_THREAD, registry);
    }
    
    @Override
    protected void checkAvailable(WorkerConfig.PoolConfig config) {
        if (config.getMaxMemoryPerChild() != null) {
            logger.warn("maxMemoryPerChild is ignored by the {} pool: threads share one heap", strategy());
        }
    }
    
    @Override
    protected SlotWorker createWorker(int slotId, SlotWorker.Listener listener) {
        return new GreenThreadWorker(new NamedThreadFactory("green-" + slotId + "-", true, STACK_SIZE), listener);
    }
}
