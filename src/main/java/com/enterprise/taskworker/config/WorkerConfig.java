package com.enterprise.taskworker.config;

import com.enterprise.taskworker.core.JsonPayloadCodec;
import com.enterprise.taskworker.dispatch.RetryMode;
import com.enterprise.taskworker.pool.PoolStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Configuration for a worker
 */
public class WorkerConfig {
    
    private final PoolConfig poolConfig;
    private final DispatcherConfig dispatcherConfig;
    private final ResultConfig resultConfig;
    private final DeadLetterQueueConfig dlqConfig;
    private final MonitoringConfig monitoringConfig;
    
    public WorkerConfig(PoolConfig poolConfig, DispatcherConfig dispatcherConfig, ResultConfig resultConfig,
                        DeadLetterQueueConfig dlqConfig, MonitoringConfig monitoringConfig) {
        this.poolConfig = poolConfig;
        this.dispatcherConfig = dispatcherConfig;
        this.resultConfig = resultConfig;
        this.dlqConfig = dlqConfig;
        this.monitoringConfig = monitoringConfig;
    }
    
    public PoolConfig getPoolConfig() { return poolConfig; }
    public DispatcherConfig getDispatcherConfig() { return dispatcherConfig; }
    public ResultConfig getResultConfig() { return resultConfig; }
    public DeadLetterQueueConfig getDlqConfig() { return dlqConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    
    /**
     * Execution pool configuration.
     * Null limits mean "not limited"; null child limits disable recycling.
     */
    public static class PoolConfig {
        private final PoolStrategy strategy;
        private final int concurrency;
        private final Integer maxTasksPerChild;
        private final Long maxMemoryPerChild;
        private final Duration softTimeLimit;
        private final Duration hardTimeLimit;
        private final Duration watchdogInterval;
        private final Duration startupTimeout;
        private final String registryProvider;
        private final List<String> childJvmOptions;
        
        public PoolConfig(PoolStrategy strategy, int concurrency, Integer maxTasksPerChild, Long maxMemoryPerChild,
                          Duration softTimeLimit, Duration hardTimeLimit, Duration watchdogInterval,
                          Duration startupTimeout, String registryProvider, List<String> childJvmOptions) {
            this.strategy = strategy;
            this.concurrency = concurrency;
            this.maxTasksPerChild = maxTasksPerChild;
            this.maxMemoryPerChild = maxMemoryPerChild;
            this.softTimeLimit = softTimeLimit;
            this.hardTimeLimit = hardTimeLimit;
            this.watchdogInterval = watchdogInterval;
            this.startupTimeout = startupTimeout;
            this.registryProvider = registryProvider;
            this.childJvmOptions = childJvmOptions != null ? List.copyOf(childJvmOptions) : List.of();
        }
        
        public PoolStrategy getStrategy() { return strategy; }
        public int getConcurrency() { return concurrency; }
        public Integer getMaxTasksPerChild() { return maxTasksPerChild; }
        /** Resident memory ceiling for a spawned child, in bytes */
        public Long getMaxMemoryPerChild() { return maxMemoryPerChild; }
        public Duration getSoftTimeLimit() { return softTimeLimit; }
        public Duration getHardTimeLimit() { return hardTimeLimit; }
        public Duration getWatchdogInterval() { return watchdogInterval; }
        public Duration getStartupTimeout() { return startupTimeout; }
        /** Class name of the {@code TaskRegistryProvider} spawned children load */
        public String getRegistryProvider() { return registryProvider; }
        public List<String> getChildJvmOptions() { return childJvmOptions; }
        
        public Builder toBuilder() {
            return new Builder(this);
        }
        
        public static Builder builder() {
            return new Builder(Defaults.defaultPoolConfig());
        }
        
        public static class Builder {
            private PoolStrategy strategy;
            private int concurrency;
            private Integer maxTasksPerChild;
            private Long maxMemoryPerChild;
            private Duration softTimeLimit;
            private Duration hardTimeLimit;
            private Duration watchdogInterval;
            private Duration startupTimeout;
            private String registryProvider;
            private List<String> childJvmOptions;
            
            private Builder(PoolConfig base) {
                this.strategy = base.strategy;
                this.concurrency = base.concurrency;
                this.maxTasksPerChild = base.maxTasksPerChild;
                this.maxMemoryPerChild = base.maxMemoryPerChild;
                this.softTimeLimit = base.softTimeLimit;
                this.hardTimeLimit = base.hardTimeLimit;
                this.watchdogInterval = base.watchdogInterval;
                this.startupTimeout = base.startupTimeout;
                this.registryProvider = base.registryProvider;
                this.childJvmOptions = base.childJvmOptions;
            }
            
            public Builder strategy(PoolStrategy strategy) { this.strategy = strategy; return this; }
            public Builder concurrency(int concurrency) { this.concurrency = concurrency; return this; }
            public Builder maxTasksPerChild(Integer maxTasksPerChild) { this.maxTasksPerChild = maxTasksPerChild; return this; }
            public Builder maxMemoryPerChild(Long maxMemoryPerChild) { this.maxMemoryPerChild = maxMemoryPerChild; return this; }
            public Builder softTimeLimit(Duration softTimeLimit) { this.softTimeLimit = softTimeLimit; return this; }
            public Builder hardTimeLimit(Duration hardTimeLimit) { this.hardTimeLimit = hardTimeLimit; return this; }
            public Builder watchdogInterval(Duration watchdogInterval) { this.watchdogInterval = watchdogInterval; return this; }
            public Builder startupTimeout(Duration startupTimeout) { this.startupTimeout = startupTimeout; return this; }
            public Builder registryProvider(String registryProvider) { this.registryProvider = registryProvider; return this; }
            public Builder childJvmOptions(List<String> childJvmOptions) { this.childJvmOptions = childJvmOptions; return this; }
            
            public PoolConfig build() {
                return new PoolConfig(strategy, concurrency, maxTasksPerChild, maxMemoryPerChild, softTimeLimit,
                                      hardTimeLimit, watchdogInterval, startupTimeout, registryProvider, childJvmOptions);
            }
        }
    }
    
    /**
     * Dispatcher loop and broker consumption configuration
     */
    public static class DispatcherConfig {
        private final int prefetchMultiplier;
        private final RetryMode retryMode;
        private final Duration pollTimeout;
        private final Duration brokerBackoffBase;
        private final Duration brokerBackoffMax;
        private final Duration revokedExpiry;
        private final Set<String> acceptContent;
        private final String hostname;
        private final Duration shutdownTimeout;
        
        public DispatcherConfig(int prefetchMultiplier, RetryMode retryMode, Duration pollTimeout,
                                Duration brokerBackoffBase, Duration brokerBackoffMax, Duration revokedExpiry,
                                Set<String> acceptContent, String hostname, Duration shutdownTimeout) {
            this.prefetchMultiplier = prefetchMultiplier;
            this.retryMode = retryMode;
            this.pollTimeout = pollTimeout;
            this.brokerBackoffBase = brokerBackoffBase;
            this.brokerBackoffMax = brokerBackoffMax;
            this.revokedExpiry = revokedExpiry;
            this.acceptContent = acceptContent != null ? Set.copyOf(acceptContent) : Set.of();
            this.hostname = hostname;
            this.shutdownTimeout = shutdownTimeout;
        }
        
        public int getPrefetchMultiplier() { return prefetchMultiplier; }
        public RetryMode getRetryMode() { return retryMode; }
        public Duration getPollTimeout() { return pollTimeout; }
        public Duration getBrokerBackoffBase() { return brokerBackoffBase; }
        public Duration getBrokerBackoffMax() { return brokerBackoffMax; }
        public Duration getRevokedExpiry() { return revokedExpiry; }
        /** Content types the worker accepts; anything else is rejected unexecuted */
        public Set<String> getAcceptContent() { return acceptContent; }
        public String getHostname() { return hostname; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        
        public DispatcherConfig withRetryMode(RetryMode retryMode) {
            return new DispatcherConfig(prefetchMultiplier, retryMode, pollTimeout, brokerBackoffBase,
                                        brokerBackoffMax, revokedExpiry, acceptContent, hostname, shutdownTimeout);
        }
        
        public DispatcherConfig withPrefetchMultiplier(int prefetchMultiplier) {
            return new DispatcherConfig(prefetchMultiplier, retryMode, pollTimeout, brokerBackoffBase,
                                        brokerBackoffMax, revokedExpiry, acceptContent, hostname, shutdownTimeout);
        }
        
        public DispatcherConfig withHostname(String hostname) {
            return new DispatcherConfig(prefetchMultiplier, retryMode, pollTimeout, brokerBackoffBase,
                                        brokerBackoffMax, revokedExpiry, acceptContent, hostname, shutdownTimeout);
        }
        
        public DispatcherConfig withBrokerBackoff(Duration base, Duration max) {
            return new DispatcherConfig(prefetchMultiplier, retryMode, pollTimeout, base,
                                        max, revokedExpiry, acceptContent, hostname, shutdownTimeout);
        }
    }
    
    /**
     * Result backend configuration
     */
    public static class ResultConfig {
        
        public enum BackendType {
            NONE,
            MEMORY,
            MAPDB
        }
        
        private final BackendType backendType;
        private final String dbPath;
        
        public ResultConfig(BackendType backendType, String dbPath) {
            this.backendType = backendType;
            this.dbPath = dbPath;
        }
        
        public BackendType getBackendType() { return backendType; }
        public String getDbPath() { return dbPath; }
    }
    
    /**
     * Dead Letter Queue configuration
     */
    public static class DeadLetterQueueConfig {
        private final boolean enabled;
        private final String dbPath;
        private final int maxCapacity;
        private final boolean enableRetentionPolicy;
        private final long retentionDays;
        private final Duration cleanupInterval;
        
        public DeadLetterQueueConfig(boolean enabled, String dbPath, int maxCapacity,
                                   boolean enableRetentionPolicy, long retentionDays,
                                   Duration cleanupInterval) {
            this.enabled = enabled;
            this.dbPath = dbPath;
            this.maxCapacity = maxCapacity;
            this.enableRetentionPolicy = enableRetentionPolicy;
            this.retentionDays = retentionDays;
            this.cleanupInterval = cleanupInterval;
        }
        
        public boolean isEnabled() { return enabled; }
        public String getDbPath() { return dbPath; }
        public int getMaxCapacity() { return maxCapacity; }
        public boolean isEnableRetentionPolicy() { return enableRetentionPolicy; }
        public long getRetentionDays() { return retentionDays; }
        public Duration getCleanupInterval() { return cleanupInterval; }
    }
    
    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;
        private final Duration healthCheckInterval;
        
        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks, Duration healthCheckInterval) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
            this.healthCheckInterval = healthCheckInterval;
        }
        
        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
    }
    
    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private PoolConfig poolConfig = Defaults.defaultPoolConfig();
        private DispatcherConfig dispatcherConfig = Defaults.defaultDispatcherConfig();
        private ResultConfig resultConfig = Defaults.defaultResultConfig();
        private DeadLetterQueueConfig dlqConfig = Defaults.defaultDeadLetterQueueConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        
        public Builder poolConfig(PoolConfig poolConfig) {
            this.poolConfig = poolConfig;
            return this;
        }
        
        public Builder dispatcherConfig(DispatcherConfig dispatcherConfig) {
            this.dispatcherConfig = dispatcherConfig;
            return this;
        }
        
        public Builder resultConfig(ResultConfig resultConfig) {
            this.resultConfig = resultConfig;
            return this;
        }
        
        public Builder dlqConfig(DeadLetterQueueConfig dlqConfig) {
            this.dlqConfig = dlqConfig;
            return this;
        }
        
        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }
        
        public WorkerConfig build() {
            return new WorkerConfig(poolConfig, dispatcherConfig, resultConfig, dlqConfig, monitoringConfig);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Default configurations
     */
    public static class Defaults {
        
        public static final int DEFAULT_PREFETCH_MULTIPLIER = 4;
        
        public static PoolConfig defaultPoolConfig() {
            return new PoolConfig(
                PoolStrategy.NATIVE_THREAD, Runtime.getRuntime().availableProcessors(), null, null,
                null, null, Duration.ofSeconds(1), Duration.ofSeconds(30), null, List.of()
            );
        }
        
        public static DispatcherConfig defaultDispatcherConfig() {
            return new DispatcherConfig(
                DEFAULT_PREFETCH_MULTIPLIER, RetryMode.INTERNAL_TIMER, Duration.ofMillis(100),
                Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofHours(3),
                Set.of(JsonPayloadCodec.CONTENT_TYPE), defaultHostname(), Duration.ofSeconds(30)
            );
        }
        
        public static ResultConfig defaultResultConfig() {
            return new ResultConfig(ResultConfig.BackendType.MEMORY, null);
        }
        
        public static DeadLetterQueueConfig defaultDeadLetterQueueConfig() {
            return new DeadLetterQueueConfig(
                true, tempDbPath("dlq-"), 10000, true, 30, Duration.ofHours(6)
            );
        }
        
        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(
                true, true, Duration.ofMinutes(1)
            );
        }
        
        static String tempDbPath(String prefix) {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String uniqueName = java.util.UUID.randomUUID().toString();
            return tmpDir.endsWith("/") ? (tmpDir + prefix + uniqueName + ".db")
                                        : (tmpDir + "/" + prefix + uniqueName + ".db");
        }
        
        static String defaultHostname() {
            try {
                return java.net.InetAddress.getLocalHost().getHostName();
            } catch (java.net.UnknownHostException e) {
                return "localhost";
            }
        }
    }
}
