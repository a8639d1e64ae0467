package com.enterprise.taskworker.backend;

import com.enterprise.taskworker.core.ExceptionInfo;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * What the worker reports about a request to the result backend
 */
public class TaskResultRecord {
    
    private final String requestId;
    private final String taskName;
    private final TaskState state;
    private final Object result;
    private final ExceptionInfo error;
    private final int retries;
    private final long runtimeMs;
    private final String worker;
    private final Instant completedAt;
    
    @JsonCreator
    public TaskResultRecord(@JsonProperty("requestId") String requestId,
                            @JsonProperty("taskName") String taskName,
                            @JsonProperty("state") TaskState state,
                            @JsonProperty("result") Object result,
                            @JsonProperty("error") ExceptionInfo error,
                            @JsonProperty("retries") int retries,
                            @JsonProperty("runtimeMs") long runtimeMs,
                            @JsonProperty("worker") String worker,
                            @JsonProperty("completedAt") Instant completedAt) {
        this.requestId = requestId;
        this.taskName = taskName;
        this.state = state;
        this.result = result;
        this.error = error;
        this.retries = retries;
        this.runtimeMs = runtimeMs;
        this.worker = worker;
        this.completedAt = completedAt;
    }
    
    public static TaskResultRecord success(String requestId, String taskName, Object result, int retries,
                                           long runtimeMs, String worker) {
        return new TaskResultRecord(requestId, taskName, TaskState.SUCCESS, result, null, retries, runtimeMs,
                                    worker, Instant.now());
    }
    
    public static TaskResultRecord of(String requestId, String taskName, TaskState state, ExceptionInfo error,
                                      int retries, long runtimeMs, String worker) {
        return new TaskResultRecord(requestId, taskName, state, null, error, retries, runtimeMs, worker, Instant.now());
    }
    
    public String getRequestId() { return requestId; }
    public String getTaskName() { return taskName; }
    public TaskState getState() { return state; }
    public Object getResult() { return result; }
    public ExceptionInfo getError() { return error; }
    public int getRetries() { return retries; }
    public long getRuntimeMs() { return runtimeMs; }
    /** Hostname of the worker that produced the record */
    public String getWorker() { return worker; }
    public Instant getCompletedAt() { return completedAt; }
    
    @Override
    public String toString() {
        return "TaskResultRecord{" + requestId + " " + state + (error != null ? " " + error.getType() : "") + "}";
    }
}
