package com.enterprise.taskworker.broker;

import com.enterprise.taskworker.core.JsonPayloadCodec;
import com.enterprise.taskworker.core.PayloadCodecs;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskRequest;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A task message as carried by a broker: string headers plus an encoded body.
 * Times are ISO-8601 instants, time limits milliseconds.
 */
public final class TaskMessage {
    
    public static final String HEADER_ID = "id";
    public static final String HEADER_TASK = "task";
    public static final String HEADER_RETRIES = "retries";
    public static final String HEADER_ETA = "eta";
    public static final String HEADER_EXPIRES = "expires";
    public static final String HEADER_ORIGIN = "origin";
    public static final String HEADER_SOFT_TIME_LIMIT = "soft_time_limit";
    public static final String HEADER_TIME_LIMIT = "time_limit";
    
    private final Map<String, String> headers;
    private final byte[] body;
    private final String contentType;
    
    public TaskMessage(Map<String, String> headers, byte[] body, String contentType) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body != null ? body : new byte[0];
        this.contentType = contentType;
    }
    
    public Map<String, String> getHeaders() { return headers; }
    
    public String getHeader(String name) { return headers.get(name); }
    
    public byte[] getBody() { return body; }
    
    public String getContentType() { return contentType; }
    
    public String getId() { return headers.get(HEADER_ID); }
    
    public String getTaskName() { return headers.get(HEADER_TASK); }
    
    /**
     * Message that re-delivers a request: same id and body, current retry count and eta
     */
    public static TaskMessage fromRequest(TaskRequest request) {
        Map<String, String> headers = new LinkedHashMap<>(request.getHeaders());
        headers.put(HEADER_ID, request.getId());
        headers.put(HEADER_TASK, request.getTaskName());
        headers.put(HEADER_RETRIES, Integer.toString(request.getRetries()));
        putOrRemove(headers, HEADER_ETA, request.getEta() != null ? request.getEta().toString() : null);
        putOrRemove(headers, HEADER_EXPIRES, request.getExpires() != null ? request.getExpires().toString() : null);
        putOrRemove(headers, HEADER_ORIGIN, request.getOrigin());
        putOrRemove(headers, HEADER_SOFT_TIME_LIMIT,
            request.getSoftTimeLimit() != null ? Long.toString(request.getSoftTimeLimit().toMillis()) : null);
        putOrRemove(headers, HEADER_TIME_LIMIT,
            request.getHardTimeLimit() != null ? Long.toString(request.getHardTimeLimit().toMillis()) : null);
        return new TaskMessage(headers, request.getBody(), request.getContentType());
    }
    
    private static void putOrRemove(Map<String, String> headers, String name, String value) {
        if (value == null) {
            headers.remove(name);
        } else {
            headers.put(name, value);
        }
    }
    
    @Override
    public String toString() {
        return "TaskMessage{headers=" + headers + ", contentType=" + contentType + ", body=" + body.length + " bytes}";
    }
    
    public static Builder builder(String taskName) {
        return new Builder(taskName);
    }
    
    /**
     * Builder that produces messages the way a producer would send them
     */
    public static class Builder {
        private final Map<String, String> headers = new LinkedHashMap<>();
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private byte[] rawBody;
        private String contentType = JsonPayloadCodec.CONTENT_TYPE;
        
        private Builder(String taskName) {
            headers.put(HEADER_ID, UUID.randomUUID().toString());
            headers.put(HEADER_TASK, taskName);
            headers.put(HEADER_RETRIES, "0");
        }
        
        public Builder id(String id) {
            headers.put(HEADER_ID, id);
            return this;
        }
        
        public Builder args(Object... args) {
            this.args = Arrays.asList(args);
            return this;
        }
        
        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
            return this;
        }
        
        public Builder retries(int retries) {
            headers.put(HEADER_RETRIES, Integer.toString(retries));
            return this;
        }
        
        public Builder eta(Instant eta) {
            headers.put(HEADER_ETA, eta.toString());
            return this;
        }
        
        /**
         * Converted to an eta relative to now
         */
        public Builder countdown(Duration countdown) {
            return eta(Instant.now().plus(countdown));
        }
        
        public Builder expires(Instant expires) {
            headers.put(HEADER_EXPIRES, expires.toString());
            return this;
        }
        
        public Builder origin(String origin) {
            headers.put(HEADER_ORIGIN, origin);
            return this;
        }
        
        public Builder softTimeLimit(Duration limit) {
            headers.put(HEADER_SOFT_TIME_LIMIT, Long.toString(limit.toMillis()));
            return this;
        }
        
        public Builder timeLimit(Duration limit) {
            headers.put(HEADER_TIME_LIMIT, Long.toString(limit.toMillis()));
            return this;
        }
        
        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }
        
        /**
         * Use an already encoded body instead of args/kwargs
         */
        public Builder rawBody(byte[] body, String contentType) {
            this.rawBody = body;
            this.contentType = contentType;
            return this;
        }
        
        public TaskMessage build() {
            byte[] body = rawBody;
            if (body == null) {
                try {
                    body = PayloadCodecs.json().encode(new TaskArguments(args, kwargs));
                } catch (IOException e) {
                    throw new IllegalArgumentException("Arguments are not JSON serializable", e);
                }
            }
            return new TaskMessage(headers, body, contentType);
        }
    }
}
