package com.enterprise.taskworker.config;

import com.enterprise.taskworker.pool.PoolStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    @Test
    void testDefaultConfigIsValid() {
        assertTrue(validator.validate(WorkerConfig.builder().build()).isEmpty());
    }

    @Test
    void testInvalidPoolSettingsAreAllReported() {
        WorkerConfig config = WorkerConfig.builder()
            .poolConfig(WorkerConfig.PoolConfig.builder()
                .concurrency(0)
                .maxTasksPerChild(0)
                .softTimeLimit(Duration.ofSeconds(10))
                .hardTimeLimit(Duration.ofSeconds(5))
                .build())
            .build();

        List<String> fields = validator.validate(config).stream()
            .map(ConfigValidator.ValidationError::getField)
            .collect(Collectors.toList());

        assertTrue(fields.contains("pool.concurrency"));
        assertTrue(fields.contains("pool.maxTasksPerChild"));
        assertTrue(fields.contains("pool.timeLimits"));
    }

    @Test
    void testSpawnRequiresRegistryProvider() {
        WorkerConfig config = WorkerConfig.builder()
            .poolConfig(WorkerConfig.PoolConfig.builder().strategy(PoolStrategy.PROCESS_SPAWN).build())
            .build();

        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        assertEquals(1, errors.size());
        assertEquals("pool.registryProvider", errors.get(0).getField());
    }

    @Test
    void testInvalidDispatcherSettings() {
        WorkerConfig config = WorkerConfig.builder()
            .dispatcherConfig(WorkerConfig.Defaults.defaultDispatcherConfig()
                .withPrefetchMultiplier(0)
                .withBrokerBackoff(Duration.ofSeconds(10), Duration.ofSeconds(1)))
            .build();

        List<String> fields = validator.validate(config).stream()
            .map(ConfigValidator.ValidationError::getField)
            .collect(Collectors.toList());

        assertEquals(List.of("dispatcher.prefetchMultiplier", "dispatcher.brokerBackoff"), fields);
    }

    @Test
    void testValidateOrThrowListsEveryError() {
        WorkerConfig config = WorkerConfig.builder()
            .poolConfig(WorkerConfig.PoolConfig.builder().concurrency(-1).maxMemoryPerChild(0L).build())
            .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> validator.validateOrThrow(config));
        assertTrue(e.getMessage().contains("pool.concurrency"));
        assertTrue(e.getMessage().contains("pool.maxMemoryPerChild"));
    }
}
