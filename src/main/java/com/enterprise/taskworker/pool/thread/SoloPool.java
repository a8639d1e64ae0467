package com.enterprise.taskworker.pool.thread;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.pool.PoolStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single execution thread, never recycled
 */
public class SoloPool extends NativeThreadPool {
    
    private static final Logger logger = LoggerFactory.getLogger(SoloPool.class);
    
    public SoloPool(TaskRegistry registry) {
        super(PoolStrategy.SOLO, registry);
    }
    
    @Override
    protected int effectiveConcurrency(WorkerConfig.PoolConfig config) {
        if (config.getConcurrency() != 1) {
            logger.warn("The solo pool runs one task at a time; ignoring concurrency={}", config.getConcurrency());
        }
        return 1;
    }
    
    @Override
    protected boolean supportsRecycling() {
        return false;
    }
}
