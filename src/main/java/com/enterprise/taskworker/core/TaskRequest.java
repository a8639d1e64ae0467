package com.enterprise.taskworker.core;

import com.enterprise.taskworker.exception.MalformedMessageException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One dequeued task message. Immutable apart from the lazily decoded arguments;
 * a retry is a copy with an incremented retry count.
 */
public final class TaskRequest {
    
    private final String id;
    private final String taskName;
    private final byte[] body;
    private final String contentType;
    private final long deliveryTag;
    private final boolean redelivered;
    private final int retries;
    private final Instant eta;
    private final Instant expires;
    private final String origin;
    private final Duration softTimeLimit;
    private final Duration hardTimeLimit;
    private final Map<String, String> headers;
    
    private volatile TaskArguments arguments;
    
    private TaskRequest(Builder builder) {
        this.id = builder.id;
        this.taskName = builder.taskName;
        this.body = builder.body;
        this.contentType = builder.contentType;
        this.deliveryTag = builder.deliveryTag;
        this.redelivered = builder.redelivered;
        this.retries = builder.retries;
        this.eta = builder.eta;
        this.expires = builder.expires;
        this.origin = builder.origin;
        this.softTimeLimit = builder.softTimeLimit;
        this.hardTimeLimit = builder.hardTimeLimit;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    }
    
    public String getId() { return id; }
    
    public String getTaskName() { return taskName; }
    
    /**
     * Encoded arguments, exactly as received
     */
    public byte[] getBody() { return body; }
    
    public String getContentType() { return contentType; }
    
    public long getDeliveryTag() { return deliveryTag; }
    
    public boolean isRedelivered() { return redelivered; }
    
    public int getRetries() { return retries; }
    
    public Instant getEta() { return eta; }
    
    public Instant getExpires() { return expires; }
    
    public String getOrigin() { return origin; }
    
    public Duration getSoftTimeLimit() { return softTimeLimit; }
    
    public Duration getHardTimeLimit() { return hardTimeLimit; }
    
    public Map<String, String> getHeaders() { return headers; }
    
    public boolean isDue(Instant now) {
        return eta == null || !eta.isAfter(now);
    }
    
    public boolean isExpired(Instant now) {
        return expires != null && !expires.isAfter(now);
    }
    
    /**
     * Decode the body with the codec named by the content type, on first access
     */
    public TaskArguments getArguments() throws MalformedMessageException {
        TaskArguments decoded = arguments;
        if (decoded == null) {
            decoded = decodeArguments(body, contentType);
            arguments = decoded;
        }
        return decoded;
    }
    
    public static TaskArguments decodeArguments(byte[] body, String contentType) throws MalformedMessageException {
        if (body == null || body.length == 0) {
            return TaskArguments.empty();
        }
        PayloadCodec codec = PayloadCodecs.forContentType(contentType)
            .orElseThrow(() -> new MalformedMessageException("No codec for content type " + contentType));
        try {
            return codec.decode(body);
        } catch (IOException e) {
            throw new MalformedMessageException("Cannot decode " + contentType + " body", e);
        }
    }
    
    public TaskRequest withRetries(int retries) {
        return toBuilder().retries(retries).build();
    }
    
    public TaskRequest withEta(Instant eta) {
        return toBuilder().eta(eta).build();
    }
    
    public Builder toBuilder() {
        return new Builder(id, taskName)
            .body(body)
            .contentType(contentType)
            .deliveryTag(deliveryTag)
            .redelivered(redelivered)
            .retries(retries)
            .eta(eta)
            .expires(expires)
            .origin(origin)
            .softTimeLimit(softTimeLimit)
            .hardTimeLimit(hardTimeLimit)
            .headers(headers);
    }
    
    @Override
    public String toString() {
        return taskName + "[" + id + "]";
    }
    
    public static Builder builder(String id, String taskName) {
        return new Builder(id, taskName);
    }
    
    /**
     * Builder for task requests
     */
    public static class Builder {
        private final String id;
        private final String taskName;
        private byte[] body = new byte[0];
        private String contentType = JsonPayloadCodec.CONTENT_TYPE;
        private long deliveryTag;
        private boolean redelivered;
        private int retries;
        private Instant eta;
        private Instant expires;
        private String origin;
        private Duration softTimeLimit;
        private Duration hardTimeLimit;
        private Map<String, String> headers = Map.of();
        
        private Builder(String id, String taskName) {
            this.id = id;
            this.taskName = taskName;
        }
        
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder deliveryTag(long deliveryTag) { this.deliveryTag = deliveryTag; return this; }
        public Builder redelivered(boolean redelivered) { this.redelivered = redelivered; return this; }
        public Builder retries(int retries) { this.retries = retries; return this; }
        public Builder eta(Instant eta) { this.eta = eta; return this; }
        public Builder expires(Instant expires) { this.expires = expires; return this; }
        public Builder origin(String origin) { this.origin = origin; return this; }
        public Builder softTimeLimit(Duration softTimeLimit) { this.softTimeLimit = softTimeLimit; return this; }
        public Builder hardTimeLimit(Duration hardTimeLimit) { this.hardTimeLimit = hardTimeLimit; return this; }
        public Builder headers(Map<String, String> headers) { this.headers = headers; return this; }
        
        /**
         * Encode arguments with the JSON codec
         */
        public Builder arguments(TaskArguments arguments) {
            try {
                this.body = PayloadCodecs.json().encode(arguments);
            } catch (IOException e) {
                throw new IllegalArgumentException("Arguments are not JSON serializable", e);
            }
            this.contentType = JsonPayloadCodec.CONTENT_TYPE;
            return this;
        }
        
        public TaskRequest build() {
            Objects.requireNonNull(id, "Request id is required");
            Objects.requireNonNull(taskName, "Task name is required");
            if (retries < 0) {
                throw new IllegalArgumentException("Retry count cannot be negative");
            }
            return new TaskRequest(this);
        }
    }
}
