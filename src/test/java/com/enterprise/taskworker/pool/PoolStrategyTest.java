package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.pool.process.ProcessForkPool;
import com.enterprise.taskworker.pool.process.SpawnProcessPool;
import com.enterprise.taskworker.pool.thread.GreenThreadPool;
import com.enterprise.taskworker.pool.thread.NativeThreadPool;
import com.enterprise.taskworker.pool.thread.SoloPool;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PoolStrategyTest {

    @Test
    void testFromName() {
        assertEquals(PoolStrategy.PROCESS_SPAWN, PoolStrategy.fromName("process-spawn"));
        assertEquals(PoolStrategy.GREEN_THREAD, PoolStrategy.fromName("GREEN_THREAD"));
        assertEquals(PoolStrategy.SOLO, PoolStrategy.fromName(" solo "));
        assertThrows(IllegalArgumentException.class, () -> PoolStrategy.fromName("eventlet"));
        assertThrows(IllegalArgumentException.class, () -> PoolStrategy.fromName(null));
    }

    @Test
    void testFactoryPicksImplementation() {
        TaskRegistry registry = new TaskRegistry();

        assertInstanceOf(ProcessForkPool.class, ExecutionPools.create(PoolStrategy.PROCESS_FORK, registry));
        assertInstanceOf(SpawnProcessPool.class, ExecutionPools.create(PoolStrategy.PROCESS_SPAWN, registry));
        assertInstanceOf(GreenThreadPool.class, ExecutionPools.create(PoolStrategy.GREEN_THREAD, registry));
        assertInstanceOf(NativeThreadPool.class, ExecutionPools.create(PoolStrategy.NATIVE_THREAD, registry));
        assertInstanceOf(SoloPool.class, ExecutionPools.create(PoolStrategy.SOLO, registry));
    }
}
