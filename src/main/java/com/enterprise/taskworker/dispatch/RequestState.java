package com.enterprise.taskworker.dispatch;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a tracked request inside the dispatcher
 */
public enum RequestState {
    RECEIVED,
    ELIGIBLE,
    DISPATCHED,
    ACKED,
    RETRY_SCHEDULED,
    REJECTED;
    
    private Set<RequestState> next;
    
    static {
        RECEIVED.next = EnumSet.of(ELIGIBLE, REJECTED);
        ELIGIBLE.next = EnumSet.of(DISPATCHED, REJECTED);
        DISPATCHED.next = EnumSet.of(ACKED, RETRY_SCHEDULED, REJECTED);
        RETRY_SCHEDULED.next = EnumSet.of(RECEIVED, REJECTED);
        ACKED.next = EnumSet.noneOf(RequestState.class);
        REJECTED.next = EnumSet.noneOf(RequestState.class);
    }
    
    public boolean canTransitionTo(RequestState target) {
        return next.contains(target);
    }
    
    public boolean isTerminal() {
        return next.isEmpty();
    }
}
