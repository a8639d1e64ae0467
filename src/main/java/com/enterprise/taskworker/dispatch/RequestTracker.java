package com.enterprise.taskworker.dispatch;

import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request id to tracking entry. Owned by the dispatcher loop, so not synchronized.
 */
public class RequestTracker {
    
    private final Map<String, TrackedRequest> entries = new LinkedHashMap<>();
    
    /**
     * @throws IllegalStateException if the id is already live
     */
    public TrackedRequest track(TaskRequest request, TaskDefinition definition) {
        if (entries.containsKey(request.getId())) {
            throw new IllegalStateException("Request " + request.getId() + " is already tracked");
        }
        TrackedRequest entry = new TrackedRequest(request, definition);
        entries.put(request.getId(), entry);
        return entry;
    }
    
    public Optional<TrackedRequest> get(String requestId) {
        return Optional.ofNullable(entries.get(requestId));
    }
    
    public boolean isLive(String requestId) {
        return entries.containsKey(requestId);
    }
    
    public TrackedRequest remove(String requestId) {
        return entries.remove(requestId);
    }
    
    public int size() {
        return entries.size();
    }
    
    public Collection<TrackedRequest> all() {
        return Collections.unmodifiableCollection(entries.values());
    }
    
    public List<TrackedRequest> inState(RequestState state) {
        List<TrackedRequest> result = new ArrayList<>();
        for (TrackedRequest entry : entries.values()) {
            if (entry.getState() == state) {
                result.add(entry);
            }
        }
        return result;
    }
    
    public int countInState(RequestState state) {
        int count = 0;
        for (TrackedRequest entry : entries.values()) {
            if (entry.getState() == state) {
                count++;
            }
        }
        return count;
    }
    
    public Map<RequestState, Integer> countsByState() {
        Map<RequestState, Integer> counts = new EnumMap<>(RequestState.class);
        for (TrackedRequest entry : entries.values()) {
            counts.merge(entry.getState(), 1, Integer::sum);
        }
        return counts;
    }
    
    /**
     * DISPATCHED entries whose hard deadline plus grace has passed
     */
    public List<TrackedRequest> overdue(Instant now, Duration grace) {
        List<TrackedRequest> result = new ArrayList<>();
        for (TrackedRequest entry : entries.values()) {
            if (entry.getState() == RequestState.DISPATCHED && entry.getHardDeadline() != null
                    && entry.getHardDeadline().plus(grace).isBefore(now)) {
                result.add(entry);
            }
        }
        return result;
    }
}
