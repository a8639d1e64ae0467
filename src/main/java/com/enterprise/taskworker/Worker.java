package com.enterprise.taskworker;

import com.enterprise.taskworker.backend.ResultBackend;
import com.enterprise.taskworker.broker.Broker;
import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.NamedThreadFactory;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.dispatch.Dispatcher;
import com.enterprise.taskworker.dlq.DeadLetterEntry;
import com.enterprise.taskworker.dlq.DeadLetterQueue;
import com.enterprise.taskworker.exception.BrokerUnavailableException;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.monitoring.HealthChecker;
import com.enterprise.taskworker.monitoring.MetricsCollector;
import com.enterprise.taskworker.pool.ExecutionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A configured worker: registry, execution pool and dispatcher plus the stores around them.
 * Created by {@link WorkerFactory}.
 */
public class Worker {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final WorkerConfig config;
    private final TaskRegistry registry;
    private final Broker broker;
    private final ExecutionPool pool;
    private final Dispatcher dispatcher;
    private final ResultBackend resultBackend;
    private final DeadLetterQueue deadLetterQueue;
    private final MetricsCollector metricsCollector;
    private final HealthChecker healthChecker;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledExecutorService maintenance;
    private volatile CompletableFuture<Void> stopFuture;

    Worker(WorkerConfig config, TaskRegistry registry, Broker broker, ExecutionPool pool, Dispatcher dispatcher,
           ResultBackend resultBackend, DeadLetterQueue deadLetterQueue, MetricsCollector metricsCollector) {
        this.config = config;
        this.registry = registry;
        this.broker = broker;
        this.pool = pool;
        this.dispatcher = dispatcher;
        this.resultBackend = resultBackend;
        this.deadLetterQueue = deadLetterQueue;
        this.metricsCollector = metricsCollector;
        this.healthChecker = new HealthChecker(dispatcher, pool, deadLetterQueue);
    }

    /**
     * Freeze the registry, start the pool and begin consuming
     *
     * @throws PoolStartException if the pool strategy is unavailable or its slots cannot start
     */
    public void start() throws PoolStartException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker already started");
        }
        registry.freeze();
        logger.info("Starting worker {} with {} registered tasks", config.getDispatcherConfig().getHostname(),
                   registry.size());

        try {
            pool.start(config.getPoolConfig());
        } catch (PoolStartException e) {
            logger.error("Could not start {} pool", config.getPoolConfig().getStrategy(), e);
            closeStores();
            throw e;
        }
        dispatcher.start();

        maintenance = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("worker-maintenance-", true));
        long cleanupMs = config.getDlqConfig().getCleanupInterval().toMillis();
        if (deadLetterQueue != null && cleanupMs > 0) {
            maintenance.scheduleAtFixedRate(this::cleanupDeadLetters, cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);
        }
        long intervalMs = config.getMonitoringConfig().getHealthCheckInterval().toMillis();
        if (config.getMonitoringConfig().isEnableHealthChecks() && intervalMs > 0) {
            maintenance.scheduleAtFixedRate(this::logHealth, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        logger.info("Worker started");
    }

    /**
     * Stop with the configured shutdown timeout as grace period
     */
    public CompletableFuture<Void> stop() {
        return stop(config.getDispatcherConfig().getShutdownTimeout());
    }

    /**
     * Graceful stop: undispatched requests go back to the broker, running ones get
     * {@code gracePeriod} to finish before they are killed.
     */
    public synchronized CompletableFuture<Void> stop(Duration gracePeriod) {
        if (!stopped.compareAndSet(false, true)) {
            return stopFuture;
        }
        logger.info("Stopping worker");
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        CompletableFuture<Void> dispatcherStopped = started.get()
            ? dispatcher.stop(gracePeriod)
            : CompletableFuture.completedFuture(null);
        stopFuture = dispatcherStopped.whenComplete((ignored, error) -> {
            if (error != null) {
                logger.error("Dispatcher did not stop cleanly", error);
            }
            closeStores();
            logger.info("Worker stopped");
        });
        return stopFuture;
    }

    /**
     * Revoke a request by id. Queued requests are rejected, running ones terminated.
     */
    public void revoke(String requestId) {
        logger.info("Revoke requested for {}", requestId);
        dispatcher.revoke(requestId);
    }

    /**
     * Publish a dead-lettered request again with its retry count reset
     *
     * @return false if there is no such entry
     */
    public boolean retryFromDeadLetterQueue(String requestId) throws BrokerUnavailableException {
        if (deadLetterQueue == null) {
            throw new IllegalStateException("Dead letter queue is disabled");
        }
        Optional<DeadLetterEntry> entry = deadLetterQueue.get(requestId);
        if (entry.isEmpty()) {
            logger.warn("No dead letter entry for {}", requestId);
            return false;
        }
        broker.publish(entry.get().toReplayMessage());
        deadLetterQueue.remove(requestId);
        metricsCollector.recordRetriedFromDlq(entry.get().getTaskName());
        metricsCollector.updateDlqSize(deadLetterQueue.size());
        logger.info("Replayed {} ({}) from the dead letter queue", requestId, entry.get().getTaskName());
        return true;
    }

    /**
     * Replay every dead-lettered request of one task, oldest first. Requests rejected for
     * reasons a replay cannot fix (unknown task, refused content type) stay in the queue.
     *
     * @return number of requests published again
     */
    public int retryDeadLettered(String taskName) throws BrokerUnavailableException {
        if (deadLetterQueue == null) {
            throw new IllegalStateException("Dead letter queue is disabled");
        }
        int replayed = 0;
        for (DeadLetterEntry entry : deadLetterQueue.findByTask(taskName)) {
            if (!entry.getReason().isReplayable()) {
                logger.debug("Not replaying {}: {}", entry.getRequestId(), entry.getReason());
                continue;
            }
            broker.publish(entry.toReplayMessage());
            deadLetterQueue.remove(entry.getRequestId());
            metricsCollector.recordRetriedFromDlq(taskName);
            replayed++;
        }
        metricsCollector.updateDlqSize(deadLetterQueue.size());
        logger.info("Replayed {} dead-lettered {} requests", replayed, taskName);
        return replayed;
    }

    public boolean isRunning() {
        return started.get() && !stopped.get() && dispatcher.isRunning();
    }

    public WorkerConfig getConfig() { return config; }
    public TaskRegistry getRegistry() { return registry; }
    public ExecutionPool getPool() { return pool; }
    public Dispatcher getDispatcher() { return dispatcher; }
    public ResultBackend getResultBackend() { return resultBackend; }
    public DeadLetterQueue getDeadLetterQueue() { return deadLetterQueue; }
    public MetricsCollector getMetricsCollector() { return metricsCollector; }
    public HealthChecker getHealthChecker() { return healthChecker; }

    private void cleanupDeadLetters() {
        try {
            if (deadLetterQueue.cleanupOldEntries() > 0) {
                metricsCollector.updateDlqSize(deadLetterQueue.size());
            }
        } catch (Exception e) {
            logger.error("Dead letter cleanup failed", e);
        }
    }

    private void logHealth() {
        healthChecker.performHealthCheck().thenAccept(status -> {
            if (status.isHealthy()) {
                logger.debug("Health check passed ({} checks)", status.getChecks().size());
            }
        });
    }

    private void closeStores() {
        try {
            resultBackend.close();
        } catch (Exception e) {
            logger.error("Error closing result backend", e);
        }
        if (deadLetterQueue != null) {
            try {
                deadLetterQueue.close();
            } catch (Exception e) {
                logger.error("Error closing dead letter queue", e);
            }
        }
    }
}
