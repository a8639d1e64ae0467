package com.enterprise.taskworker.dispatch;

import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskRequest;

import java.time.Instant;

/**
 * Dispatcher bookkeeping for one in-flight request. Only the dispatcher loop touches it.
 */
public class TrackedRequest {
    
    private TaskRequest request;
    private final TaskDefinition definition;
    private RequestState state = RequestState.RECEIVED;
    private Instant dispatchedAt;
    private Instant hardDeadline;
    private boolean revoked;
    private boolean settled;
    private boolean terminateRequested;
    private boolean holdsPrefetchCredit;
    private ExceptionInfo lastError;
    
    public TrackedRequest(TaskRequest request, TaskDefinition definition) {
        this.request = request;
        this.definition = definition;
    }
    
    public String getId() { return request.getId(); }
    
    public TaskRequest getRequest() { return request; }
    
    public TaskDefinition getDefinition() { return definition; }
    
    public RequestState getState() { return state; }
    
    public Instant getDispatchedAt() { return dispatchedAt; }
    
    /** Hard deadline of the current dispatch, or null when unlimited */
    public Instant getHardDeadline() { return hardDeadline; }
    
    public boolean isRevoked() { return revoked; }
    
    /** Whether the broker delivery has been acked or rejected */
    public boolean isSettled() { return settled; }
    
    public boolean isTerminateRequested() { return terminateRequested; }
    
    public ExceptionInfo getLastError() { return lastError; }
    
    /**
     * @throws IllegalStateException if the state machine does not allow the move
     */
    public void transitionTo(RequestState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Request " + getId() + " cannot move from " + state + " to " + target);
        }
        state = target;
    }
    
    void markDispatched(Instant now, Instant hardDeadline) {
        transitionTo(RequestState.DISPATCHED);
        this.dispatchedAt = now;
        this.hardDeadline = hardDeadline;
    }
    
    /**
     * Back to RECEIVED with the next retry count
     */
    void markRetryDue() {
        transitionTo(RequestState.RECEIVED);
        this.request = request.withRetries(request.getRetries() + 1);
        this.dispatchedAt = null;
        this.hardDeadline = null;
        this.terminateRequested = false;
    }
    
    void markRevoked() {
        this.revoked = true;
    }
    
    void markTerminateRequested() {
        this.terminateRequested = true;
    }
    
    /**
     * @throws IllegalStateException on a second settlement
     */
    void markSettled() {
        if (settled) {
            throw new IllegalStateException("Delivery of request " + getId() + " is already settled");
        }
        settled = true;
    }
    
    void setLastError(ExceptionInfo lastError) {
        this.lastError = lastError;
    }
    
    boolean holdsPrefetchCredit() {
        return holdsPrefetchCredit;
    }
    
    void setHoldsPrefetchCredit(boolean holdsPrefetchCredit) {
        this.holdsPrefetchCredit = holdsPrefetchCredit;
    }
    
    @Override
    public String toString() {
        return request + "/" + state + (request.getRetries() > 0 ? " retry " + request.getRetries() : "");
    }
}
