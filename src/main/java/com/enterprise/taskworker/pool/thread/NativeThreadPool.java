package com.enterprise.taskworker.pool.thread;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.pool.AbstractExecutionPool;
import com.enterprise.taskworker.pool.PoolStrategy;
import com.enterprise.taskworker.pool.SlotWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One platform thread per slot
 */
public class NativeThreadPool extends AbstractExecutionPool {
    
    private static final Logger logger = LoggerFactory.getLogger(NativeThreadPool.class);
    
    private final AtomicInteger workerNumber = new AtomicInteger(1);
    
    public NativeThreadPool(TaskRegistry registry) {
        this(PoolStrategy.NATIVE_THREAD, registry);
    }
    
    protected NativeThreadPool(PoolStrategy strategy, TaskRegistry registry) {
        super(strategy, registry);
    }
    
    @Override
    protected void checkAvailable(WorkerConfig.PoolConfig config) {
        if (config.getMaxMemoryPerChild() != null) {
            logger.warn("maxMemoryPerChild is ignored by the {} pool: threads share one heap", strategy());
        }
    }
    
    @Override
    protected SlotWorker createWorker(int slotId, SlotWorker.Listener listener) {
        String name = strategy().getConfigName() + "-worker-" + slotId + "-" + workerNumber.getAndIncrement();
        return new NativeThreadWorker(name, listener);
    }
}
