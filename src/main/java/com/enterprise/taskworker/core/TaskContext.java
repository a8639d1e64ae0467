package com.enterprise.taskworker.core;

import com.enterprise.taskworker.exception.RejectTaskException;
import com.enterprise.taskworker.exception.RetryTaskException;
import com.enterprise.taskworker.exception.SoftTimeLimitExceededException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What a handler sees of the request it is executing.
 * One instance per execution attempt.
 */
public class TaskContext {
    
    private final String requestId;
    private final String taskName;
    private final int retries;
    private final TaskArguments arguments;
    private final AtomicBoolean softTimeLimitExceeded = new AtomicBoolean(false);
    
    public TaskContext(String requestId, String taskName, int retries, TaskArguments arguments) {
        this.requestId = requestId;
        this.taskName = taskName;
        this.retries = retries;
        this.arguments = arguments;
    }
    
    public String getRequestId() { return requestId; }
    
    public String getTaskName() { return taskName; }
    
    /**
     * Number of retries before this attempt (0 on the first attempt)
     */
    public int getRetries() { return retries; }
    
    public TaskArguments getArguments() { return arguments; }
    
    public boolean isSoftTimeLimitExceeded() {
        return softTimeLimitExceeded.get();
    }
    
    /**
     * Throws {@link SoftTimeLimitExceededException} if the soft limit has been signalled
     */
    public void checkSoftTimeLimit() {
        if (softTimeLimitExceeded.get()) {
            throw new SoftTimeLimitExceededException("Soft time limit exceeded for task " + taskName + "[" + requestId + "]");
        }
    }
    
    /**
     * Marks the soft limit as exceeded. Returns false if it was already marked.
     */
    public boolean signalSoftTimeLimit() {
        return softTimeLimitExceeded.compareAndSet(false, true);
    }
    
    /**
     * Creates the exception a handler throws to be retried after {@code countdown}
     * (null countdown: the task's retry policy decides).
     */
    public RetryTaskException retry(Duration countdown, Throwable cause) {
        return new RetryTaskException(countdown, cause);
    }
    
    /**
     * Creates the exception a handler throws to reject its message
     */
    public RejectTaskException reject(String reason, boolean requeue) {
        return new RejectTaskException(reason, requeue);
    }
}
