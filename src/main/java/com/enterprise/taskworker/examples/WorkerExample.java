package com.enterprise.taskworker.examples;

import com.enterprise.taskworker.Worker;
import com.enterprise.taskworker.WorkerFactory;
import com.enterprise.taskworker.backend.TaskResultRecord;
import com.enterprise.taskworker.broker.InMemoryBroker;
import com.enterprise.taskworker.broker.TaskMessage;
import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.config.WorkerConfigLoader;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.monitoring.HealthChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs a worker against an in-memory broker and prints what happened.
 * An optional argument names a properties file with {@code worker.*} settings.
 */
public class WorkerExample {

    private static final Logger logger = LoggerFactory.getLogger(WorkerExample.class);

    public static void main(String[] args) throws Exception {
        WorkerConfig config = args.length > 0
            ? WorkerConfigLoader.load(Paths.get(args[0]))
            : WorkerConfig.builder().build();

        TaskRegistry registry = new TaskRegistry();
        new ExampleTasks().registerTasks(registry);
        InMemoryBroker broker = new InMemoryBroker();
        Worker worker = WorkerFactory.create(config, registry, broker);

        worker.start();
        logger.info("Worker started with {} pool", worker.getPool().strategy());

        List<String> ids = new ArrayList<>();
        try {
            ids.add(publish(broker, TaskMessage.builder(ExampleTasks.ADD).args(2, 3).build()));
            ids.add(publish(broker, TaskMessage.builder(ExampleTasks.MULTIPLY).kwargs(Map.of("x", 6, "y", 7)).build()));
            ids.add(publish(broker, TaskMessage.builder(ExampleTasks.SEND_EMAIL)
                .kwargs(Map.of("recipient", "user@example.com", "subject", "Welcome", "body", "Thanks for signing up"))
                .build()));
            ids.add(publish(broker, TaskMessage.builder(ExampleTasks.IDENTITY).args("later")
                .countdown(Duration.ofSeconds(2)).build()));
            ids.add(publish(broker, TaskMessage.builder(ExampleTasks.RAISE_ERROR).args("always fails").build()));

            String slow = publish(broker, TaskMessage.builder(ExampleTasks.SLEEP).args(60_000).build());
            Thread.sleep(500);
            worker.revoke(slow);
            ids.add(slow);

            Thread.sleep(5000);

            for (String id : ids) {
                Optional<TaskResultRecord> record = worker.getResultBackend().getResult(id);
                logger.info("{} -> {}", id, record.map(TaskResultRecord::toString).orElse("no result yet"));
            }
            if (worker.getDeadLetterQueue() != null) {
                logger.info("Dead letter queue: {}", worker.getDeadLetterQueue().getStatistics());
            }
            HealthChecker.HealthStatus health = worker.getHealthChecker().performHealthCheck().get(5, TimeUnit.SECONDS);
            logger.info("Healthy: {}", health.isHealthy());
            logger.info("Metrics: {}", worker.getMetricsCollector().getMetrics());
        } finally {
            worker.stop(Duration.ofSeconds(5)).get(30, TimeUnit.SECONDS);
        }
    }

    private static String publish(InMemoryBroker broker, TaskMessage message) throws Exception {
        broker.publish(message);
        logger.info("Published {} {}", message.getTaskName(), message.getId());
        return message.getId();
    }
}
