package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskRequest;

import java.time.Duration;

/**
 * Effective time limits: message override, then task definition, then pool default
 */
public final class TimeLimits {
    
    private TimeLimits() {
    }
    
    public static Duration soft(TaskRequest request, TaskDefinition definition, WorkerConfig.PoolConfig config) {
        return firstNonNull(request.getSoftTimeLimit(), definition.getSoftTimeLimit(), config.getSoftTimeLimit());
    }
    
    public static Duration hard(TaskRequest request, TaskDefinition definition, WorkerConfig.PoolConfig config) {
        return firstNonNull(request.getHardTimeLimit(), definition.getHardTimeLimit(), config.getHardTimeLimit());
    }
    
    private static Duration firstNonNull(Duration first, Duration second, Duration third) {
        if (first != null) {
            return first;
        }
        return second != null ? second : third;
    }
}
