package com.enterprise.taskworker.pool.process;

import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.time.Duration;

/**
 * One line of the parent/child pipe protocol. Parent to child: {@code run},
 * {@code soft_timeout}, {@code shutdown}. Child to parent: {@code ready}, {@code result}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProtocolMessage {
    
    public static final String RUN = "run";
    public static final String SOFT_TIMEOUT = "soft_timeout";
    public static final String SHUTDOWN = "shutdown";
    public static final String READY = "ready";
    public static final String RESULT = "result";
    
    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());
    
    private String type;
    private String requestId;
    
    // run
    private String taskName;
    private byte[] body;
    private String contentType;
    private Integer retries;
    
    // result
    private String kind;
    private Object result;
    private ExceptionInfo error;
    private Boolean retryRequested;
    private Long retryCountdownMs;
    private Boolean rejectRequested;
    private Boolean requeue;
    private Long runtimeMs;
    private Long memoryBytes;
    
    // ready
    private Long pid;
    
    public ProtocolMessage() {
    }
    
    private ProtocolMessage(String type) {
        this.type = type;
    }
    
    public static ProtocolMessage run(String requestId, String taskName, byte[] body, String contentType, int retries) {
        ProtocolMessage message = new ProtocolMessage(RUN);
        message.requestId = requestId;
        message.taskName = taskName;
        message.body = body;
        message.contentType = contentType;
        message.retries = retries;
        return message;
    }
    
    public static ProtocolMessage softTimeout(String requestId) {
        ProtocolMessage message = new ProtocolMessage(SOFT_TIMEOUT);
        message.requestId = requestId;
        return message;
    }
    
    public static ProtocolMessage shutdown() {
        return new ProtocolMessage(SHUTDOWN);
    }
    
    public static ProtocolMessage ready(long pid) {
        ProtocolMessage message = new ProtocolMessage(READY);
        message.pid = pid;
        return message;
    }
    
    public static ProtocolMessage result(String requestId) {
        ProtocolMessage message = new ProtocolMessage(RESULT);
        message.requestId = requestId;
        return message;
    }
    
    public static ProtocolMessage result(String requestId, TaskOutcome outcome, long memoryBytes) {
        ProtocolMessage message = result(requestId);
        message.kind = outcome.getKind().name();
        message.result = outcome.getResult();
        message.error = outcome.getError();
        message.runtimeMs = outcome.getRuntimeMs();
        message.memoryBytes = memoryBytes;
        if (outcome.isRetryRequested()) {
            message.retryRequested = true;
            message.retryCountdownMs = outcome.getRetryCountdown() != null ? outcome.getRetryCountdown().toMillis() : null;
        }
        if (outcome.isRejectRequested()) {
            message.rejectRequested = true;
            message.requeue = outcome.isRequeue();
        }
        return message;
    }
    
    /**
     * Rebuild the outcome a child reported
     */
    public TaskOutcome toOutcome() {
        long runtime = runtimeMs != null ? runtimeMs : 0;
        if (TaskOutcome.Kind.SUCCESS.name().equals(kind)) {
            return TaskOutcome.success(result, runtime);
        }
        if (Boolean.TRUE.equals(retryRequested)) {
            return TaskOutcome.retryRequested(error, retryCountdownMs != null ? Duration.ofMillis(retryCountdownMs) : null, runtime);
        }
        if (Boolean.TRUE.equals(rejectRequested)) {
            return TaskOutcome.rejectRequested(error, Boolean.TRUE.equals(requeue), runtime);
        }
        return TaskOutcome.failure(error, runtime);
    }
    
    public String toJson() throws IOException {
        return MAPPER.writeValueAsString(this);
    }
    
    public static ProtocolMessage fromJson(String line) throws IOException {
        return MAPPER.readValue(line, ProtocolMessage.class);
    }
    
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }
    
    public String getTaskName() { return taskName; }
    public void setTaskName(String taskName) { this.taskName = taskName; }
    
    public byte[] getBody() { return body; }
    public void setBody(byte[] body) { this.body = body; }
    
    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }
    
    public Integer getRetries() { return retries; }
    public void setRetries(Integer retries) { this.retries = retries; }
    
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    
    public Object getResult() { return result; }
    public void setResult(Object result) { this.result = result; }
    
    public ExceptionInfo getError() { return error; }
    public void setError(ExceptionInfo error) { this.error = error; }
    
    public Boolean getRetryRequested() { return retryRequested; }
    public void setRetryRequested(Boolean retryRequested) { this.retryRequested = retryRequested; }
    
    public Long getRetryCountdownMs() { return retryCountdownMs; }
    public void setRetryCountdownMs(Long retryCountdownMs) { this.retryCountdownMs = retryCountdownMs; }
    
    public Boolean getRejectRequested() { return rejectRequested; }
    public void setRejectRequested(Boolean rejectRequested) { this.rejectRequested = rejectRequested; }
    
    public Boolean getRequeue() { return requeue; }
    public void setRequeue(Boolean requeue) { this.requeue = requeue; }
    
    public Long getRuntimeMs() { return runtimeMs; }
    public void setRuntimeMs(Long runtimeMs) { this.runtimeMs = runtimeMs; }
    
    public Long getMemoryBytes() { return memoryBytes; }
    public void setMemoryBytes(Long memoryBytes) { this.memoryBytes = memoryBytes; }
    
    public Long getPid() { return pid; }
    public void setPid(Long pid) { this.pid = pid; }
}
