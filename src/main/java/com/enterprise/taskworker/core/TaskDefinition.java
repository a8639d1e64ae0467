package com.enterprise.taskworker.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable registration of a task: its handler and the options the worker
 * applies to every request for it.
 */
public final class TaskDefinition {
    
    public static final String DEFAULT_QUEUE = "default";
    
    private final String name;
    private final TaskHandler handler;
    private final String queue;
    private final String routingKey;
    private final String serializer;
    private final RetryPolicy retryPolicy;
    private final Duration softTimeLimit;
    private final Duration hardTimeLimit;
    private final AckMode ackMode;
    private final RateLimit rateLimit;
    private final boolean ignoreResult;
    private final boolean rejectOnWorkerLost;
    private final boolean retryOnTimeout;
    
    private TaskDefinition(Builder builder) {
        this.name = builder.name;
        this.handler = builder.handler;
        this.queue = builder.queue;
        this.routingKey = builder.routingKey != null ? builder.routingKey : builder.queue;
        this.serializer = builder.serializer;
        this.retryPolicy = builder.retryPolicy;
        this.softTimeLimit = builder.softTimeLimit;
        this.hardTimeLimit = builder.hardTimeLimit;
        this.ackMode = builder.ackMode;
        this.rateLimit = builder.rateLimit;
        this.ignoreResult = builder.ignoreResult;
        this.rejectOnWorkerLost = builder.rejectOnWorkerLost;
        this.retryOnTimeout = builder.retryOnTimeout;
    }
    
    public String getName() { return name; }
    
    public TaskHandler getHandler() { return handler; }
    
    public String getQueue() { return queue; }
    
    public String getRoutingKey() { return routingKey; }
    
    public String getSerializer() { return serializer; }
    
    public RetryPolicy getRetryPolicy() { return retryPolicy; }
    
    /**
     * Soft time limit, or null to use the pool default
     */
    public Duration getSoftTimeLimit() { return softTimeLimit; }
    
    /**
     * Hard time limit, or null to use the pool default
     */
    public Duration getHardTimeLimit() { return hardTimeLimit; }
    
    public AckMode getAckMode() { return ackMode; }
    
    /**
     * Rate limit, or null when dispatch is not rate limited
     */
    public RateLimit getRateLimit() { return rateLimit; }
    
    public boolean isIgnoreResult() { return ignoreResult; }
    
    public boolean isRejectOnWorkerLost() { return rejectOnWorkerLost; }
    
    public boolean isRetryOnTimeout() { return retryOnTimeout; }
    
    @Override
    public String toString() {
        return "TaskDefinition{name=" + name + ", queue=" + queue + ", ackMode=" + ackMode + "}";
    }
    
    public static Builder builder(String name, TaskHandler handler) {
        return new Builder(name, handler);
    }
    
    /**
     * Builder for creating task definitions
     */
    public static class Builder {
        private final String name;
        private final TaskHandler handler;
        private String queue = DEFAULT_QUEUE;
        private String routingKey;
        private String serializer = JsonPayloadCodec.NAME;
        private RetryPolicy retryPolicy = RetryPolicy.Predefined.standard();
        private Duration softTimeLimit;
        private Duration hardTimeLimit;
        private AckMode ackMode = AckMode.LATE;
        private RateLimit rateLimit;
        private boolean ignoreResult = false;
        private boolean rejectOnWorkerLost = false;
        private boolean retryOnTimeout = false;
        
        private Builder(String name, TaskHandler handler) {
            this.name = name;
            this.handler = handler;
        }
        
        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }
        
        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }
        
        public Builder serializer(String serializer) {
            this.serializer = serializer;
            return this;
        }
        
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }
        
        public Builder softTimeLimit(Duration softTimeLimit) {
            this.softTimeLimit = softTimeLimit;
            return this;
        }
        
        public Builder hardTimeLimit(Duration hardTimeLimit) {
            this.hardTimeLimit = hardTimeLimit;
            return this;
        }
        
        public Builder ackMode(AckMode ackMode) {
            this.ackMode = ackMode;
            return this;
        }
        
        public Builder rateLimit(RateLimit rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }
        
        public Builder rateLimit(String expression) {
            this.rateLimit = RateLimit.parse(expression);
            return this;
        }
        
        public Builder ignoreResult(boolean ignoreResult) {
            this.ignoreResult = ignoreResult;
            return this;
        }
        
        public Builder rejectOnWorkerLost(boolean rejectOnWorkerLost) {
            this.rejectOnWorkerLost = rejectOnWorkerLost;
            return this;
        }
        
        public Builder retryOnTimeout(boolean retryOnTimeout) {
            this.retryOnTimeout = retryOnTimeout;
            return this;
        }
        
        public TaskDefinition build() {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Task name is required");
            }
            Objects.requireNonNull(handler, "Task handler is required");
            Objects.requireNonNull(retryPolicy, "Retry policy is required");
            Objects.requireNonNull(ackMode, "Ack mode is required");
            if (PayloadCodecs.forName(serializer).isEmpty()) {
                throw new IllegalArgumentException("Unknown serializer '" + serializer + "' for task " + name);
            }
            if (softTimeLimit != null && (softTimeLimit.isNegative() || softTimeLimit.isZero())) {
                throw new IllegalArgumentException("Soft time limit must be positive for task " + name);
            }
            if (hardTimeLimit != null && (hardTimeLimit.isNegative() || hardTimeLimit.isZero())) {
                throw new IllegalArgumentException("Hard time limit must be positive for task " + name);
            }
            if (softTimeLimit != null && hardTimeLimit != null && softTimeLimit.compareTo(hardTimeLimit) > 0) {
                throw new IllegalArgumentException(
                    "Soft time limit must be less than or equal to the hard time limit for task " + name);
            }
            return new TaskDefinition(this);
        }
    }
}
