package com.enterprise.taskworker.pool.process;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.examples.ExampleTasks;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.exception.WorkerLostException;
import com.enterprise.taskworker.pool.PoolStrategy;
import com.enterprise.taskworker.pool.SlotInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Starts real child JVMs, so kept to a handful of requests
 */
@Timeout(60)
class SpawnProcessPoolTest {

    private TaskRegistry registry;
    private SpawnProcessPool pool;

    @BeforeEach
    void setUp() throws Exception {
        registry = new TaskRegistry();
        new ExampleTasks().registerTasks(registry);
        pool = new SpawnProcessPool(registry);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(Duration.ofSeconds(5)).join();
    }

    private WorkerConfig.PoolConfig.Builder config() {
        return WorkerConfig.PoolConfig.builder()
            .strategy(PoolStrategy.PROCESS_SPAWN)
            .concurrency(1)
            .watchdogInterval(Duration.ofMillis(100))
            .startupTimeout(Duration.ofSeconds(30))
            .registryProvider(ExampleTasks.class.getName());
    }

    private TaskOutcome run(String id, String task, Object... args) throws Exception {
        CompletableFuture<TaskOutcome> outcome = new CompletableFuture<>();
        pool.submit(TaskRequest.builder(id, task)
            .arguments(new TaskArguments(List.of(args), Map.of()))
            .build(), outcome::complete);
        return outcome.get(30, TimeUnit.SECONDS);
    }

    @Test
    void testChildRunsTaskAndReportsPid() throws Exception {
        pool.start(config().build());

        TaskOutcome outcome = run("spawn-1", ExampleTasks.ADD, 20, 22);

        assertEquals(TaskOutcome.Kind.SUCCESS, outcome.getKind());
        assertEquals(42L, ((Number) outcome.getResult()).longValue());

        SlotInfo slot = pool.slots().get(0);
        assertNotNull(slot.getPid());
        assertNotEquals(ProcessHandle.current().pid(), slot.getPid().longValue());
        assertEquals(1, slot.getCompletedCount());
    }

    @Test
    void testHandlerErrorCrossesProcessBoundary() throws Exception {
        pool.start(config().build());

        TaskOutcome outcome = run("spawn-2", ExampleTasks.RAISE_ERROR);

        assertEquals(TaskOutcome.Kind.FAILURE, outcome.getKind());
        assertTrue(outcome.getError().isInstanceOf(IllegalStateException.class));
    }

    @Test
    void testChildExitIsWorkerLost() throws Exception {
        pool.start(config().build());
        Long firstPid = pool.slots().get(0).getPid();

        TaskOutcome lost = run("spawn-3", ExampleTasks.HALT_PROCESS);

        assertEquals(TaskOutcome.Kind.WORKER_LOST, lost.getKind());
        assertTrue(lost.getError().isInstanceOf(WorkerLostException.class));

        // the slot gets a fresh child
        TaskOutcome next = run("spawn-4", ExampleTasks.MULTIPLY, 6, 7);
        assertEquals(42L, ((Number) next.getResult()).longValue());
        assertNotEquals(firstPid, pool.slots().get(0).getPid());
    }

    @Test
    void testStartRequiresRegistryProvider() {
        PoolStartException missing = assertThrows(PoolStartException.class,
            () -> pool.start(config().registryProvider(null).build()));
        assertTrue(missing.getMessage().contains("registry provider"));

        assertThrows(PoolStartException.class,
            () -> new SpawnProcessPool(registry).start(config().registryProvider("com.example.Missing").build()));
        assertThrows(PoolStartException.class,
            () -> new SpawnProcessPool(registry).start(config().registryProvider(String.class.getName()).build()));
    }

    @Test
    void testProtocolMessageCarriesOutcome() throws Exception {
        TaskOutcome retry = TaskOutcome.retryRequested(
            com.enterprise.taskworker.core.ExceptionInfo.from(new java.io.IOException("down")),
            Duration.ofSeconds(3), 12);

        ProtocolMessage decoded = ProtocolMessage.fromJson(ProtocolMessage.result("r-1", retry, 1024).toJson());
        TaskOutcome restored = decoded.toOutcome();

        assertEquals(ProtocolMessage.RESULT, decoded.getType());
        assertEquals("r-1", decoded.getRequestId());
        assertEquals(1024L, decoded.getMemoryBytes());
        assertTrue(restored.isRetryRequested());
        assertEquals(Duration.ofSeconds(3), restored.getRetryCountdown());
        assertEquals(12, restored.getRuntimeMs());
    }
}
