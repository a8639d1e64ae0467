package com.enterprise.taskworker.dlq;

import com.enterprise.taskworker.broker.TaskMessage;
import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A rejected request as it was last received, with the reason and last error.
 * Holds enough of the original message to publish it again.
 */
public class DeadLetterEntry {
    
    private final String requestId;
    private final String taskName;
    private final Map<String, String> headers;
    private final byte[] body;
    private final String contentType;
    private final RejectionReason reason;
    private final String failureReason;
    private final Instant addedToDlqTime;
    private final int retryCount;
    private final ExceptionInfo lastError;
    
    @JsonCreator
    public DeadLetterEntry(
            @JsonProperty("requestId") String requestId,
            @JsonProperty("taskName") String taskName,
            @JsonProperty("headers") Map<String, String> headers,
            @JsonProperty("body") byte[] body,
            @JsonProperty("contentType") String contentType,
            @JsonProperty("reason") RejectionReason reason,
            @JsonProperty("failureReason") String failureReason,
            @JsonProperty("addedToDlqTime") Instant addedToDlqTime,
            @JsonProperty("retryCount") int retryCount,
            @JsonProperty("lastError") ExceptionInfo lastError) {
        this.requestId = Objects.requireNonNull(requestId, "Request ID cannot be null");
        this.taskName = taskName;
        this.headers = headers != null ? headers : Map.of();
        this.body = body != null ? body : new byte[0];
        this.contentType = contentType;
        this.reason = Objects.requireNonNull(reason, "Rejection reason cannot be null");
        this.failureReason = Objects.requireNonNull(failureReason, "Failure reason cannot be null");
        this.addedToDlqTime = Objects.requireNonNull(addedToDlqTime, "Added to DLQ time cannot be null");
        this.retryCount = retryCount;
        this.lastError = lastError;
    }
    
    public String getRequestId() {
        return requestId;
    }
    
    public String getTaskName() {
        return taskName;
    }
    
    public Map<String, String> getHeaders() {
        return headers;
    }
    
    public byte[] getBody() {
        return body;
    }
    
    public String getContentType() {
        return contentType;
    }
    
    public RejectionReason getReason() {
        return reason;
    }
    
    /**
     * Human readable detail of the rejection
     */
    public String getFailureReason() {
        return failureReason;
    }
    
    public Instant getAddedToDlqTime() {
        return addedToDlqTime;
    }
    
    public int getRetryCount() {
        return retryCount;
    }
    
    public ExceptionInfo getLastError() {
        return lastError;
    }
    
    @JsonIgnore
    public String getErrorType() {
        return lastError != null ? lastError.getType() : "Unknown";
    }
    
    public static DeadLetterEntry create(TaskRequest request, RejectionReason reason, String failureReason,
                                         ExceptionInfo lastError) {
        return new DeadLetterEntry(
            request.getId(),
            request.getTaskName(),
            TaskMessage.fromRequest(request).getHeaders(),
            request.getBody(),
            request.getContentType(),
            reason,
            failureReason,
            Instant.now(),
            request.getRetries(),
            lastError
        );
    }
    
    /**
     * Message that replays this request from scratch: retries reset, eta and expiry dropped
     */
    public TaskMessage toReplayMessage() {
        Map<String, String> replayHeaders = new LinkedHashMap<>(headers);
        replayHeaders.put(TaskMessage.HEADER_RETRIES, "0");
        replayHeaders.remove(TaskMessage.HEADER_ETA);
        replayHeaders.remove(TaskMessage.HEADER_EXPIRES);
        return new TaskMessage(replayHeaders, body, contentType);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeadLetterEntry that = (DeadLetterEntry) o;
        return Objects.equals(requestId, that.requestId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(requestId);
    }
    
    @Override
    public String toString() {
        return "DeadLetterEntry{" +
                "requestId=" + requestId +
                ", taskName=" + taskName +
                ", reason=" + reason +
                ", failureReason='" + failureReason + '\'' +
                ", addedToDlqTime=" + addedToDlqTime +
                ", retryCount=" + retryCount +
                ", errorType='" + getErrorType() + '\'' +
                '}';
    }
}
