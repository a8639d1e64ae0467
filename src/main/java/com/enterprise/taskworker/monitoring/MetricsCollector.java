package com.enterprise.taskworker.monitoring;

import com.enterprise.taskworker.core.TaskOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for a worker
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> taskCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> taskTimers = new ConcurrentHashMap<>();
    
    private final Counter messagesReceived;
    private final Counter tasksSucceeded;
    private final Counter tasksFailed;
    private final Counter tasksTimedOut;
    private final Counter workersLost;
    private final Counter tasksRetried;
    private final Counter tasksRejected;
    private final Counter tasksRevoked;
    private final Counter tasksRequeued;
    private final Counter tasksMovedToDlq;
    private final Counter tasksRetriedFromDlq;
    private final Counter brokerErrors;
    
    private final Timer taskRuntime;
    
    private final AtomicLong trackedRequests = new AtomicLong(0);
    private final AtomicLong dispatchedRequests = new AtomicLong(0);
    private final AtomicLong pendingSettlements = new AtomicLong(0);
    private final AtomicLong dlqSize = new AtomicLong(0);
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.messagesReceived = Counter.builder("taskworker.messages.received")
            .description("Messages received from the broker")
            .register(meterRegistry);
        
        this.tasksSucceeded = Counter.builder("taskworker.tasks.succeeded")
            .description("Executions that returned a result")
            .register(meterRegistry);
        
        this.tasksFailed = Counter.builder("taskworker.tasks.failed")
            .description("Executions whose handler raised")
            .register(meterRegistry);
        
        this.tasksTimedOut = Counter.builder("taskworker.tasks.timedout")
            .description("Executions killed at their hard time limit")
            .register(meterRegistry);
        
        this.workersLost = Counter.builder("taskworker.tasks.worker.lost")
            .description("Executions whose worker died or was terminated")
            .register(meterRegistry);
        
        this.tasksRetried = Counter.builder("taskworker.tasks.retried")
            .description("Retries scheduled")
            .register(meterRegistry);
        
        this.tasksRejected = Counter.builder("taskworker.tasks.rejected")
            .description("Deliveries rejected without requeue")
            .register(meterRegistry);
        
        this.tasksRevoked = Counter.builder("taskworker.tasks.revoked")
            .description("Requests revoked")
            .register(meterRegistry);
        
        this.tasksRequeued = Counter.builder("taskworker.tasks.requeued")
            .description("Deliveries returned to the broker")
            .register(meterRegistry);
        
        this.tasksMovedToDlq = Counter.builder("taskworker.tasks.moved.to.dlq")
            .description("Requests written to the Dead Letter Queue")
            .register(meterRegistry);
        
        this.tasksRetriedFromDlq = Counter.builder("taskworker.tasks.retried.from.dlq")
            .description("Requests replayed from the Dead Letter Queue")
            .register(meterRegistry);
        
        this.brokerErrors = Counter.builder("taskworker.broker.errors")
            .description("Broker operations that failed")
            .register(meterRegistry);
        
        this.taskRuntime = Timer.builder("taskworker.task.runtime")
            .description("Task execution time")
            .register(meterRegistry);
        
        Gauge.builder("taskworker.requests.tracked", trackedRequests, AtomicLong::get)
            .description("Requests tracked by the dispatcher")
            .register(meterRegistry);
        
        Gauge.builder("taskworker.requests.dispatched", dispatchedRequests, AtomicLong::get)
            .description("Requests currently in the execution pool")
            .register(meterRegistry);
        
        Gauge.builder("taskworker.settlements.pending", pendingSettlements, AtomicLong::get)
            .description("Acks and rejects waiting for the broker")
            .register(meterRegistry);
        
        Gauge.builder("taskworker.dlq.size", dlqSize, AtomicLong::get)
            .description("Current Dead Letter Queue size")
            .register(meterRegistry);
        
        logger.info("MetricsCollector initialized");
    }
    
    public void recordMessageReceived() {
        messagesReceived.increment();
    }
    
    /**
     * Record the outcome of one execution attempt
     */
    public void recordOutcome(String taskName, TaskOutcome outcome) {
        switch (outcome.getKind()) {
            case SUCCESS:
                tasksSucceeded.increment();
                break;
            case FAILURE:
                tasksFailed.increment();
                break;
            case TIMEOUT:
                tasksTimedOut.increment();
                break;
            case WORKER_LOST:
                workersLost.increment();
                break;
            default:
                break;
        }
        getTaskCounter(taskName, outcome.getKind().name().toLowerCase()).increment();
        
        taskRuntime.record(outcome.getRuntimeMs(), TimeUnit.MILLISECONDS);
        getTaskTimer(taskName, outcome.getKind()).record(outcome.getRuntimeMs(), TimeUnit.MILLISECONDS);
        
        logger.debug("Recorded {} for task {} in {}ms", outcome.getKind(), taskName, outcome.getRuntimeMs());
    }
    
    public void recordRetry(String taskName) {
        tasksRetried.increment();
        getTaskCounter(taskName, "retried").increment();
    }
    
    public void recordRejected(String taskName) {
        tasksRejected.increment();
        getTaskCounter(taskName, "rejected").increment();
    }
    
    public void recordRevoked(String taskName) {
        tasksRevoked.increment();
        getTaskCounter(taskName, "revoked").increment();
    }
    
    public void recordRequeued(String taskName) {
        tasksRequeued.increment();
    }
    
    public void recordMovedToDlq(String taskName, String reason) {
        tasksMovedToDlq.increment();
        getTaskCounter(taskName, "moved_to_dlq").increment();
        logger.debug("Recorded task {} moved to DLQ: {}", taskName, reason);
    }
    
    public void recordRetriedFromDlq(String taskName) {
        tasksRetriedFromDlq.increment();
        getTaskCounter(taskName, "retried_from_dlq").increment();
    }
    
    public void recordBrokerError() {
        brokerErrors.increment();
    }
    
    public void updateTrackedRequests(int count) {
        trackedRequests.set(count);
    }
    
    public void updateDispatchedRequests(int count) {
        dispatchedRequests.set(count);
    }
    
    public void updatePendingSettlements(int count) {
        pendingSettlements.set(count);
    }
    
    public void updateDlqSize(int size) {
        dlqSize.set(size);
    }
    
    private Counter getTaskCounter(String taskName, String status) {
        String key = taskName + "." + status;
        return taskCounters.computeIfAbsent(key, k ->
            Counter.builder("taskworker.task")
                .tag("task", taskName)
                .tag("status", status)
                .description("Task count by name and status")
                .register(meterRegistry)
        );
    }
    
    private Timer getTaskTimer(String taskName, TaskOutcome.Kind kind) {
        String status = kind.name().toLowerCase();
        return taskTimers.computeIfAbsent(taskName + "." + status, k ->
            Timer.builder("taskworker.task.runtime.by.task")
                .tag("task", taskName)
                .tag("status", status)
                .description("Task execution time by task name and outcome")
                .register(meterRegistry)
        );
    }
    
    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        
        metrics.put("messages.received", messagesReceived.count());
        metrics.put("tasks.succeeded", tasksSucceeded.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.timedout", tasksTimedOut.count());
        metrics.put("tasks.worker_lost", workersLost.count());
        metrics.put("tasks.retried", tasksRetried.count());
        metrics.put("tasks.rejected", tasksRejected.count());
        metrics.put("tasks.revoked", tasksRevoked.count());
        metrics.put("tasks.requeued", tasksRequeued.count());
        metrics.put("tasks.moved_to_dlq", tasksMovedToDlq.count());
        metrics.put("tasks.retried_from_dlq", tasksRetriedFromDlq.count());
        metrics.put("broker.errors", brokerErrors.count());
        
        metrics.put("task.runtime.mean", taskRuntime.mean(TimeUnit.MILLISECONDS));
        metrics.put("task.runtime.max", taskRuntime.max(TimeUnit.MILLISECONDS));
        
        metrics.put("requests.tracked", trackedRequests.get());
        metrics.put("requests.dispatched", dispatchedRequests.get());
        metrics.put("settlements.pending", pendingSettlements.get());
        metrics.put("dlq.size", dlqSize.get());
        
        return metrics;
    }
}
