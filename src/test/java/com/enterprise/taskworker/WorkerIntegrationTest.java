package com.enterprise.taskworker;

import com.enterprise.taskworker.backend.InMemoryResultBackend;
import com.enterprise.taskworker.backend.TaskResultRecord;
import com.enterprise.taskworker.backend.TaskState;
import com.enterprise.taskworker.broker.InMemoryBroker;
import com.enterprise.taskworker.broker.TaskMessage;
import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.dlq.DeadLetterEntry;
import com.enterprise.taskworker.dlq.DeadLetterQueue;
import com.enterprise.taskworker.dlq.RejectionReason;
import com.enterprise.taskworker.examples.ExampleTasks;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.pool.PoolStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: broker in, results and dead letters out
 */
@Timeout(60)
class WorkerIntegrationTest {
    
    @TempDir
    File tempDir;
    
    private InMemoryBroker broker;
    private TaskRegistry registry;
    private Worker worker;
    
    @BeforeEach
    void setUp() throws Exception {
        broker = new InMemoryBroker();
        registry = new TaskRegistry();
        new ExampleTasks().registerTasks(registry);
    }
    
    @AfterEach
    void tearDown() throws Exception {
        if (worker != null) {
            worker.stop(Duration.ofSeconds(1)).get(20, TimeUnit.SECONDS);
        }
    }
    
    private WorkerConfig config(PoolStrategy strategy) {
        return WorkerConfig.builder()
            .poolConfig(WorkerConfig.PoolConfig.builder()
                .strategy(strategy)
                .concurrency(2)
                .watchdogInterval(Duration.ofMillis(50))
                .build())
            .dlqConfig(new WorkerConfig.DeadLetterQueueConfig(
                true, new File(tempDir, "dlq.db").getAbsolutePath(), 1000, true, 30, Duration.ofHours(6)))
            .build();
    }
    
    private TaskResultRecord awaitFinal(String id) {
        InMemoryResultBackend backend = (InMemoryResultBackend) worker.getResultBackend();
        await().atMost(10, TimeUnit.SECONDS).until(() -> backend.getResult(id)
            .map(record -> record.getState().isReady())
            .orElse(false));
        return backend.getResult(id).get();
    }
    
    @Test
    void testWorkerRunsExampleTasks() throws Exception {
        worker = WorkerFactory.create(config(PoolStrategy.NATIVE_THREAD), registry, broker);
        worker.start();
        assertTrue(worker.isRunning());
        
        broker.publish(TaskMessage.builder(ExampleTasks.ADD).id("add-1").args(40, 2).build());
        broker.publish(TaskMessage.builder(ExampleTasks.MULTIPLY).id("mul-1").kwargs(Map.of("x", 6, "y", 7)).build());
        broker.publish(TaskMessage.builder(ExampleTasks.IDENTITY).id("id-1").args("echo").build());
        
        assertEquals(42L, ((Number) awaitFinal("add-1").getResult()).longValue());
        assertEquals(42L, ((Number) awaitFinal("mul-1").getResult()).longValue());
        assertEquals("echo", awaitFinal("id-1").getResult());
        
        await().atMost(5, TimeUnit.SECONDS).until(() -> broker.getAcked().size() == 3);
        assertEquals(3.0, worker.getMetricsCollector().getMetrics().get("tasks.succeeded"));
    }
    
    @Test
    void testFailedRequestCanBeReplayedFromDeadLetterQueue() throws Exception {
        worker = WorkerFactory.create(config(PoolStrategy.GREEN_THREAD), registry, broker);
        worker.start();
        
        broker.publish(TaskMessage.builder(ExampleTasks.RAISE_ERROR).id("boom").build());
        
        TaskResultRecord failed = awaitFinal("boom");
        assertEquals(TaskState.FAILURE, failed.getState());
        assertEquals(2, failed.getRetries());
        await().atMost(5, TimeUnit.SECONDS).until(() -> worker.getDeadLetterQueue().get("boom").isPresent());
        DeadLetterEntry entry = worker.getDeadLetterQueue().get("boom").get();
        assertEquals(IllegalStateException.class.getName(), entry.getErrorType());
        assertEquals(RejectionReason.RETRIES_EXHAUSTED, entry.getReason());
        
        InMemoryResultBackend backend = (InMemoryResultBackend) worker.getResultBackend();
        int recordsBeforeReplay = backend.getHistory("boom").size();
        
        assertTrue(worker.retryFromDeadLetterQueue("boom"));
        assertFalse(worker.getDeadLetterQueue().get("boom").isPresent());
        assertFalse(worker.retryFromDeadLetterQueue("boom"));
        
        // the replay runs through the full retry budget again
        await().atMost(10, TimeUnit.SECONDS).until(() -> backend.getHistory("boom").size() == recordsBeforeReplay * 2);
        await().atMost(5, TimeUnit.SECONDS).until(() -> worker.getDeadLetterQueue().get("boom").isPresent());
        assertEquals(1.0, worker.getMetricsCollector().getMetrics().get("tasks.retried_from_dlq"));
    }
    
    @Test
    void testRetryDeadLetteredReplaysOnlyReplayableEntries() throws Exception {
        worker = WorkerFactory.create(config(PoolStrategy.NATIVE_THREAD), registry, broker);
        worker.start();
        
        DeadLetterQueue dlq = worker.getDeadLetterQueue();
        dlq.add(DeadLetterEntry.create(addRequest("sum-1"), RejectionReason.RETRIES_EXHAUSTED, "Max retries (3) exceeded",
            ExceptionInfo.from(new IllegalStateException("flaky"))));
        dlq.add(DeadLetterEntry.create(addRequest("sum-2"), RejectionReason.TIME_LIMIT_EXCEEDED, "Time limit exceeded",
            null));
        dlq.add(DeadLetterEntry.create(addRequest("sum-3"), RejectionReason.CONTENT_REFUSED, "Content type refused",
            null));
        
        assertEquals(2, worker.retryDeadLettered(ExampleTasks.ADD));
        
        assertEquals(TaskState.SUCCESS, awaitFinal("sum-1").getState());
        assertEquals(TaskState.SUCCESS, awaitFinal("sum-2").getState());
        assertEquals(1, dlq.size());
        assertEquals(RejectionReason.CONTENT_REFUSED, dlq.get("sum-3").get().getReason());
        assertEquals(0, worker.retryDeadLettered(ExampleTasks.ADD));
        assertEquals(2.0, worker.getMetricsCollector().getMetrics().get("tasks.retried_from_dlq"));
    }
    
    private static TaskRequest addRequest(String id) {
        return TaskRequest.builder(id, ExampleTasks.ADD)
            .arguments(new TaskArguments(List.of(40, 2), Map.of()))
            .build();
    }
    
    @Test
    void testRevokeThroughWorker() throws Exception {
        worker = WorkerFactory.create(config(PoolStrategy.NATIVE_THREAD), registry, broker);
        worker.start();
        
        broker.publish(TaskMessage.builder(ExampleTasks.SLEEP).id("nap").args(30_000).build());
        await().atMost(5, TimeUnit.SECONDS).until(() -> worker.getDispatcher().getDispatchedCount() == 1);
        worker.revoke("nap");
        
        assertEquals(TaskState.REVOKED, awaitFinal("nap").getState());
    }
    
    @Test
    void testStopFreezesLifecycle() throws Exception {
        worker = WorkerFactory.create(config(PoolStrategy.SOLO), registry, broker);
        worker.start();
        
        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> worker.start());
        
        worker.stop(Duration.ofSeconds(1)).get(10, TimeUnit.SECONDS);
        
        assertFalse(worker.isRunning());
        assertFalse(worker.getPool().isRunning());
        assertSame(worker.stop(), worker.stop(Duration.ZERO));
    }
    
    @Test
    void testUnavailablePoolStrategyFailsStart() {
        worker = WorkerFactory.create(config(PoolStrategy.PROCESS_FORK), registry, broker);
        
        assertThrows(PoolStartException.class, () -> worker.start());
        assertFalse(worker.isRunning());
    }
}
