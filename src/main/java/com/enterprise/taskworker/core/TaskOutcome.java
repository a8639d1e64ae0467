package com.enterprise.taskworker.core;

import com.enterprise.taskworker.exception.TimeLimitExceededException;
import com.enterprise.taskworker.exception.WorkerLostException;

import java.time.Duration;

/**
 * Terminal outcome of one execution attempt, reported exactly once by an execution pool
 */
public final class TaskOutcome {
    
    public enum Kind {
        SUCCESS,
        FAILURE,
        TIMEOUT,
        WORKER_LOST
    }
    
    private final Kind kind;
    private final Object result;
    private final ExceptionInfo error;
    private final boolean retryRequested;
    private final Duration retryCountdown;
    private final boolean rejectRequested;
    private final boolean requeue;
    private final long runtimeMs;
    
    private TaskOutcome(Kind kind, Object result, ExceptionInfo error, boolean retryRequested,
                        Duration retryCountdown, boolean rejectRequested, boolean requeue, long runtimeMs) {
        this.kind = kind;
        this.result = result;
        this.error = error;
        this.retryRequested = retryRequested;
        this.retryCountdown = retryCountdown;
        this.rejectRequested = rejectRequested;
        this.requeue = requeue;
        this.runtimeMs = runtimeMs;
    }
    
    public static TaskOutcome success(Object result, long runtimeMs) {
        return new TaskOutcome(Kind.SUCCESS, result, null, false, null, false, false, runtimeMs);
    }
    
    public static TaskOutcome failure(ExceptionInfo error, long runtimeMs) {
        return new TaskOutcome(Kind.FAILURE, null, error, false, null, false, false, runtimeMs);
    }
    
    /**
     * Failure after which the handler asked to be retried, optionally after a given countdown
     */
    public static TaskOutcome retryRequested(ExceptionInfo error, Duration countdown, long runtimeMs) {
        return new TaskOutcome(Kind.FAILURE, null, error, true, countdown, false, false, runtimeMs);
    }
    
    /**
     * Failure after which the handler asked for its message to be rejected
     */
    public static TaskOutcome rejectRequested(ExceptionInfo error, boolean requeue, long runtimeMs) {
        return new TaskOutcome(Kind.FAILURE, null, error, false, null, true, requeue, runtimeMs);
    }
    
    public static TaskOutcome timeout(String detail, long runtimeMs) {
        ExceptionInfo error = ExceptionInfo.from(new TimeLimitExceededException(detail));
        return new TaskOutcome(Kind.TIMEOUT, null, error, false, null, false, false, runtimeMs);
    }
    
    public static TaskOutcome workerLost(String detail, long runtimeMs) {
        ExceptionInfo error = ExceptionInfo.from(new WorkerLostException(detail));
        return new TaskOutcome(Kind.WORKER_LOST, null, error, false, null, false, false, runtimeMs);
    }
    
    public Kind getKind() { return kind; }
    
    public boolean isSuccess() { return kind == Kind.SUCCESS; }
    
    public Object getResult() { return result; }
    
    public ExceptionInfo getError() { return error; }
    
    public boolean isRetryRequested() { return retryRequested; }
    
    public Duration getRetryCountdown() { return retryCountdown; }
    
    public boolean isRejectRequested() { return rejectRequested; }
    
    public boolean isRequeue() { return requeue; }
    
    public long getRuntimeMs() { return runtimeMs; }
    
    @Override
    public String toString() {
        return kind == Kind.SUCCESS ? "SUCCESS(" + result + ")" : kind + "(" + error + ")";
    }
}
