package com.enterprise.taskworker.config;

import com.enterprise.taskworker.dispatch.RetryMode;
import com.enterprise.taskworker.pool.PoolStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;

/**
 * Builds a {@link WorkerConfig} from {@code worker.*} properties, starting from the defaults.
 * Durations are ISO-8601 ({@code PT30S}) or plain milliseconds; memory sizes accept
 * {@code k}, {@code m} and {@code g} suffixes.
 */
public final class WorkerConfigLoader {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkerConfigLoader.class);
    
    public static final String POOL = "worker.pool";
    public static final String CONCURRENCY = "worker.concurrency";
    public static final String MAX_TASKS_PER_CHILD = "worker.max-tasks-per-child";
    public static final String MAX_MEMORY_PER_CHILD = "worker.max-memory-per-child";
    public static final String SOFT_TIME_LIMIT = "worker.soft-time-limit";
    public static final String TIME_LIMIT = "worker.time-limit";
    public static final String PREFETCH_MULTIPLIER = "worker.prefetch-multiplier";
    public static final String RETRY_MODE = "worker.retry-mode";
    public static final String HOSTNAME = "worker.hostname";
    public static final String REGISTRY_PROVIDER = "worker.registry-provider";
    public static final String WATCHDOG_INTERVAL = "worker.watchdog-interval";
    
    private WorkerConfigLoader() {
    }
    
    public static WorkerConfig load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(propertiesFile)) {
            properties.load(in);
        }
        logger.info("Loading worker configuration from {}", propertiesFile);
        return fromProperties(properties);
    }
    
    public static WorkerConfig fromProperties(Properties properties) {
        WorkerConfig.PoolConfig.Builder pool = WorkerConfig.PoolConfig.builder();
        WorkerConfig.DispatcherConfig dispatcher = WorkerConfig.Defaults.defaultDispatcherConfig();
        
        String value;
        if ((value = get(properties, POOL)) != null) {
            pool.strategy(PoolStrategy.fromName(value));
        }
        if ((value = get(properties, CONCURRENCY)) != null) {
            pool.concurrency(parseInt(CONCURRENCY, value));
        }
        if ((value = get(properties, MAX_TASKS_PER_CHILD)) != null) {
            pool.maxTasksPerChild(parseInt(MAX_TASKS_PER_CHILD, value));
        }
        if ((value = get(properties, MAX_MEMORY_PER_CHILD)) != null) {
            pool.maxMemoryPerChild(parseBytes(MAX_MEMORY_PER_CHILD, value));
        }
        if ((value = get(properties, SOFT_TIME_LIMIT)) != null) {
            pool.softTimeLimit(parseDuration(SOFT_TIME_LIMIT, value));
        }
        if ((value = get(properties, TIME_LIMIT)) != null) {
            pool.hardTimeLimit(parseDuration(TIME_LIMIT, value));
        }
        if ((value = get(properties, WATCHDOG_INTERVAL)) != null) {
            pool.watchdogInterval(parseDuration(WATCHDOG_INTERVAL, value));
        }
        if ((value = get(properties, REGISTRY_PROVIDER)) != null) {
            pool.registryProvider(value);
        }
        if ((value = get(properties, PREFETCH_MULTIPLIER)) != null) {
            dispatcher = dispatcher.withPrefetchMultiplier(parseInt(PREFETCH_MULTIPLIER, value));
        }
        if ((value = get(properties, RETRY_MODE)) != null) {
            dispatcher = dispatcher.withRetryMode(parseRetryMode(value));
        }
        if ((value = get(properties, HOSTNAME)) != null) {
            dispatcher = dispatcher.withHostname(value);
        }
        
        return WorkerConfig.builder()
            .poolConfig(pool.build())
            .dispatcherConfig(dispatcher)
            .build();
    }
    
    private static String get(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }
    
    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }
    
    static Duration parseDuration(String key, String value) {
        try {
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            }
            return Duration.ofMillis(Long.parseLong(value));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }
    
    static long parseBytes(String key, String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        long multiplier = 1;
        char last = normalized.charAt(normalized.length() - 1);
        if (last == 'k') {
            multiplier = 1024L;
        } else if (last == 'm') {
            multiplier = 1024L * 1024;
        } else if (last == 'g') {
            multiplier = 1024L * 1024 * 1024;
        }
        if (multiplier != 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        try {
            return Math.multiplyExact(Long.parseLong(normalized.trim()), multiplier);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid memory size for " + key + ": " + value, e);
        }
    }
    
    private static RetryMode parseRetryMode(String value) {
        String normalized = value.toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return RetryMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + RETRY_MODE + ": " + value, e);
        }
    }
}
