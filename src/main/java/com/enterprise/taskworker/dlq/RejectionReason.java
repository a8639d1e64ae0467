package com.enterprise.taskworker.dlq;

/**
 * Why the worker gave up on a request
 */
public enum RejectionReason {
    RETRIES_EXHAUSTED,
    NOT_RETRYABLE,
    TIME_LIMIT_EXCEEDED,
    HANDLER_REJECTED,
    REVOKED,
    EXPIRED,
    UNKNOWN_TASK,
    CONTENT_REFUSED,
    POOL_REFUSED,
    /** Acked early and could not be returned to the broker */
    UNDELIVERABLE;

    /**
     * Whether publishing the request again can succeed without changing the worker
     */
    public boolean isReplayable() {
        return this != UNKNOWN_TASK && this != CONTENT_REFUSED;
    }
}
