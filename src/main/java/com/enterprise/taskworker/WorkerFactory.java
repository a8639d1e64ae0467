package com.enterprise.taskworker;

import com.enterprise.taskworker.backend.InMemoryResultBackend;
import com.enterprise.taskworker.backend.MapDBResultBackend;
import com.enterprise.taskworker.backend.ResultBackend;
import com.enterprise.taskworker.broker.Broker;
import com.enterprise.taskworker.config.ConfigValidator;
import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.dispatch.Dispatcher;
import com.enterprise.taskworker.dlq.DeadLetterQueue;
import com.enterprise.taskworker.dlq.MapDBDeadLetterQueue;
import com.enterprise.taskworker.monitoring.MetricsCollector;
import com.enterprise.taskworker.pool.ExecutionPool;
import com.enterprise.taskworker.pool.ExecutionPools;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating and wiring workers
 */
public class WorkerFactory {

    private static final Logger logger = LoggerFactory.getLogger(WorkerFactory.class);

    private WorkerFactory() {
    }

    /**
     * Create a worker with default configuration
     */
    public static Worker createDefault(TaskRegistry registry, Broker broker) {
        return create(WorkerConfig.builder().build(), registry, broker);
    }

    /**
     * Create a worker with custom configuration and a private meter registry
     */
    public static Worker create(WorkerConfig config, TaskRegistry registry, Broker broker) {
        return create(config, registry, broker, new SimpleMeterRegistry());
    }

    /**
     * Create a worker reporting metrics to the given registry
     *
     * @throws IllegalArgumentException listing every validation error if the configuration is invalid
     */
    public static Worker create(WorkerConfig config, TaskRegistry registry, Broker broker, MeterRegistry meterRegistry) {
        new ConfigValidator().validateOrThrow(config);
        logger.info("Creating worker: pool={}, concurrency={}, retryMode={}, resultBackend={}",
                   config.getPoolConfig().getStrategy(), config.getPoolConfig().getConcurrency(),
                   config.getDispatcherConfig().getRetryMode(), config.getResultConfig().getBackendType());

        MeterRegistry metersTarget = config.getMonitoringConfig().isEnableMetrics()
            ? meterRegistry
            : new SimpleMeterRegistry();
        MetricsCollector metricsCollector = new MetricsCollector(metersTarget);

        ResultBackend resultBackend = createResultBackend(config.getResultConfig());
        DeadLetterQueue deadLetterQueue = createDeadLetterQueue(config.getDlqConfig());
        ExecutionPool pool = ExecutionPools.create(config.getPoolConfig().getStrategy(), registry);
        Dispatcher dispatcher = new Dispatcher(registry, pool, broker, resultBackend, deadLetterQueue,
            metricsCollector, config);

        if (deadLetterQueue != null) {
            metricsCollector.updateDlqSize(deadLetterQueue.size());
        }
        return new Worker(config, registry, broker, pool, dispatcher, resultBackend, deadLetterQueue, metricsCollector);
    }

    private static ResultBackend createResultBackend(WorkerConfig.ResultConfig config) {
        switch (config.getBackendType()) {
            case NONE:
                return ResultBackend.disabled();
            case MEMORY:
                return new InMemoryResultBackend();
            case MAPDB:
                return new MapDBResultBackend(config.getDbPath());
            default:
                throw new IllegalArgumentException("Unsupported result backend: " + config.getBackendType());
        }
    }

    private static DeadLetterQueue createDeadLetterQueue(WorkerConfig.DeadLetterQueueConfig config) {
        if (!config.isEnabled()) {
            return null;
        }
        return new MapDBDeadLetterQueue(
            config.getDbPath(),
            config.getMaxCapacity(),
            config.isEnableRetentionPolicy(),
            config.getRetentionDays()
        );
    }
}
