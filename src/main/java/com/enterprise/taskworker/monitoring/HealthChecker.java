package com.enterprise.taskworker.monitoring;

import com.enterprise.taskworker.dispatch.Dispatcher;
import com.enterprise.taskworker.dlq.DeadLetterQueue;
import com.enterprise.taskworker.pool.ExecutionPool;
import com.enterprise.taskworker.pool.SlotInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for a running worker
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private final Dispatcher dispatcher;
    private final ExecutionPool pool;
    private final DeadLetterQueue deadLetterQueue;

    public HealthChecker(Dispatcher dispatcher, ExecutionPool pool, DeadLetterQueue deadLetterQueue) {
        this.dispatcher = dispatcher;
        this.pool = pool;
        this.deadLetterQueue = deadLetterQueue;
    }

    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(() -> {
            HealthStatus.Builder builder = HealthStatus.builder();

            checkDispatcher(builder);
            checkPool(builder);
            checkDeadLetterQueue(builder);
            checkSystemResources(builder);

            HealthStatus status = builder.build();
            if (!status.isHealthy()) {
                logger.warn("Health check failed: {}", status.failedChecks());
            }
            return status;
        });
    }

    private void checkDispatcher(HealthStatus.Builder builder) {
        try {
            boolean running = dispatcher.isRunning();
            builder.addCheck("dispatcher.running", running,
                running ? "Dispatcher is running" : "Dispatcher is not running");

            boolean brokerAvailable = dispatcher.isBrokerAvailable();
            builder.addCheck("broker.available", brokerAvailable,
                brokerAvailable ? "Broker is reachable" : "Broker is unavailable, consumer is backing off");

            int pending = dispatcher.getPendingSettlementCount();
            builder.addCheck("broker.settlements", pending == 0,
                String.format("Pending acks/rejects: %d", pending));
        } catch (Exception e) {
            builder.addCheck("dispatcher.status", false, "Error checking dispatcher: " + e.getMessage());
        }
    }

    private void checkPool(HealthStatus.Builder builder) {
        try {
            boolean running = pool.isRunning();
            builder.addCheck("pool.running", running,
                String.format("%s pool is %s", pool.strategy(), running ? "running" : "stopped"));

            List<SlotInfo> slots = pool.slots();
            long alive = slots.stream().filter(SlotInfo::isAlive).count();
            builder.addCheck("pool.slots", alive == slots.size(),
                String.format("Live slots: %d/%d, busy: %d", alive, slots.size(), pool.activeCount()));
        } catch (Exception e) {
            builder.addCheck("pool.status", false, "Error checking pool: " + e.getMessage());
        }
    }

    private void checkDeadLetterQueue(HealthStatus.Builder builder) {
        if (deadLetterQueue == null) {
            return;
        }
        try {
            int size = deadLetterQueue.size();
            boolean healthy = !deadLetterQueue.isAtCapacity();
            builder.addCheck("dlq.capacity", healthy,
                String.format("Dead letter queue size: %d%s", size, healthy ? "" : " (at capacity)"));
        } catch (Exception e) {
            builder.addCheck("dlq.status", false, "Error checking dead letter queue: " + e.getMessage());
        }
    }

    private void checkSystemResources(HealthStatus.Builder builder) {
        try {
            Runtime runtime = Runtime.getRuntime();
            long totalMemory = runtime.totalMemory();
            long usedMemory = totalMemory - runtime.freeMemory();
            double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

            boolean memoryHealthy = memoryUsagePercent < 90;
            builder.addCheck("system.memory", memoryHealthy,
                String.format("Memory usage: %.2f%% (%d/%d MB)",
                    memoryUsagePercent, usedMemory / 1024 / 1024, runtime.maxMemory() / 1024 / 1024));
        } catch (Exception e) {
            builder.addCheck("system.resources", false, "Error checking system resources: " + e.getMessage());
        }
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        public CheckResult getCheck(String name) {
            return checks.get(name);
        }

        List<String> failedChecks() {
            return checks.entrySet().stream()
                .filter(e -> !e.getValue().isPassed())
                .map(e -> e.getKey() + ": " + e.getValue().getMessage())
                .sorted()
                .toList();
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
