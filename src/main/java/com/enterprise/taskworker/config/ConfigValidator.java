package com.enterprise.taskworker.config;

import com.enterprise.taskworker.pool.PoolStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates worker configuration
 */
public class ConfigValidator {
    
    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(WorkerConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validatePoolConfig(config.getPoolConfig(), errors);
        validateDispatcherConfig(config.getDispatcherConfig(), errors);
        validateResultConfig(config.getResultConfig(), errors);
        validateDeadLetterQueueConfig(config.getDlqConfig(), errors);
        validateMonitoringConfig(config.getMonitoringConfig(), errors);
        
        return errors;
    }
    
    /**
     * Validate and fail with every error at once
     */
    public void validateOrThrow(WorkerConfig config) {
        List<ValidationError> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid worker configuration: " + errors);
        }
    }
    
    private void validatePoolConfig(WorkerConfig.PoolConfig config, List<ValidationError> errors) {
        if (config.getStrategy() == null) {
            errors.add(new ValidationError("pool.strategy", "Pool strategy is required"));
        }
        
        if (config.getConcurrency() <= 0) {
            errors.add(new ValidationError("pool.concurrency",
                "Concurrency must be greater than 0"));
        }
        
        if (config.getMaxTasksPerChild() != null && config.getMaxTasksPerChild() <= 0) {
            errors.add(new ValidationError("pool.maxTasksPerChild",
                "Max tasks per child must be greater than 0"));
        }
        
        if (config.getMaxMemoryPerChild() != null && config.getMaxMemoryPerChild() <= 0) {
            errors.add(new ValidationError("pool.maxMemoryPerChild",
                "Max memory per child must be greater than 0"));
        }
        
        if (!isPositiveOrUnset(config.getSoftTimeLimit())) {
            errors.add(new ValidationError("pool.softTimeLimit",
                "Soft time limit must be greater than 0"));
        }
        
        if (!isPositiveOrUnset(config.getHardTimeLimit())) {
            errors.add(new ValidationError("pool.hardTimeLimit",
                "Hard time limit must be greater than 0"));
        }
        
        if (config.getSoftTimeLimit() != null && config.getHardTimeLimit() != null
                && config.getSoftTimeLimit().compareTo(config.getHardTimeLimit()) > 0) {
            errors.add(new ValidationError("pool.timeLimits",
                "Soft time limit cannot be greater than hard time limit"));
        }
        
        if (!isPositive(config.getWatchdogInterval())) {
            errors.add(new ValidationError("pool.watchdogInterval",
                "Watchdog interval must be greater than 0"));
        }
        
        if (config.getStrategy() == PoolStrategy.PROCESS_SPAWN) {
            if (!isPositive(config.getStartupTimeout())) {
                errors.add(new ValidationError("pool.startupTimeout",
                    "Startup timeout must be greater than 0"));
            }
            if (config.getRegistryProvider() == null || config.getRegistryProvider().trim().isEmpty()) {
                errors.add(new ValidationError("pool.registryProvider",
                    "Registry provider class is required for the process-spawn strategy"));
            }
        }
    }
    
    private void validateDispatcherConfig(WorkerConfig.DispatcherConfig config, List<ValidationError> errors) {
        if (config.getPrefetchMultiplier() <= 0) {
            errors.add(new ValidationError("dispatcher.prefetchMultiplier",
                "Prefetch multiplier must be greater than 0"));
        }
        
        if (config.getRetryMode() == null) {
            errors.add(new ValidationError("dispatcher.retryMode", "Retry mode is required"));
        }
        
        if (!isPositive(config.getPollTimeout())) {
            errors.add(new ValidationError("dispatcher.pollTimeout",
                "Poll timeout must be greater than 0"));
        }
        
        if (!isPositive(config.getBrokerBackoffBase()) || !isPositive(config.getBrokerBackoffMax())) {
            errors.add(new ValidationError("dispatcher.brokerBackoff",
                "Broker backoff delays must be greater than 0"));
        } else if (config.getBrokerBackoffBase().compareTo(config.getBrokerBackoffMax()) > 0) {
            errors.add(new ValidationError("dispatcher.brokerBackoff",
                "Base backoff cannot be greater than maximum backoff"));
        }
        
        if (config.getRevokedExpiry() == null || config.getRevokedExpiry().isNegative()) {
            errors.add(new ValidationError("dispatcher.revokedExpiry",
                "Revoked expiry cannot be negative"));
        }
        
        if (config.getAcceptContent().isEmpty()) {
            errors.add(new ValidationError("dispatcher.acceptContent",
                "At least one accepted content type is required"));
        }
        
        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("dispatcher.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }
    
    private void validateResultConfig(WorkerConfig.ResultConfig config, List<ValidationError> errors) {
        if (config.getBackendType() == null) {
            errors.add(new ValidationError("result.backendType", "Result backend type is required"));
        } else if (config.getBackendType() == WorkerConfig.ResultConfig.BackendType.MAPDB
                && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("result.dbPath",
                "Database path is required for the MapDB result backend"));
        }
    }
    
    private void validateDeadLetterQueueConfig(WorkerConfig.DeadLetterQueueConfig config, List<ValidationError> errors) {
        if (!config.isEnabled()) {
            return;
        }
        
        if (config.getDbPath() == null || config.getDbPath().trim().isEmpty()) {
            errors.add(new ValidationError("dlq.dbPath",
                "Database path is required"));
        }
        
        if (config.getMaxCapacity() <= 0) {
            errors.add(new ValidationError("dlq.maxCapacity",
                "Maximum capacity must be greater than 0"));
        }
        
        if (config.getRetentionDays() < 0) {
            errors.add(new ValidationError("dlq.retentionDays",
                "Retention days cannot be negative"));
        }
        
        if (config.getCleanupInterval().isNegative()) {
            errors.add(new ValidationError("dlq.cleanupInterval",
                "Cleanup interval cannot be negative"));
        }
    }
    
    private void validateMonitoringConfig(WorkerConfig.MonitoringConfig config, List<ValidationError> errors) {
        if (config.getHealthCheckInterval().isNegative()) {
            errors.add(new ValidationError("monitoring.healthCheckInterval",
                "Health check interval cannot be negative"));
        }
    }
    
    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
    
    private static boolean isPositiveOrUnset(Duration duration) {
        return duration == null || isPositive(duration);
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
