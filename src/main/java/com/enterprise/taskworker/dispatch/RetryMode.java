package com.enterprise.taskworker.dispatch;

/**
 * Where a scheduled retry waits for its delay to elapse
 */
public enum RetryMode {
    /** The entry stays tracked and keeps its delivery; a loop timer re-dispatches it. */
    INTERNAL_TIMER,
    /** A copy with an eta is published to the broker and the original delivery acked. */
    REQUEUE_TO_BROKER
}
