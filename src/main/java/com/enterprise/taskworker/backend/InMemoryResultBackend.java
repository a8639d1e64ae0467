package com.enterprise.taskworker.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Result backend held in memory. Keeps the latest record per request and the full history.
 */
public class InMemoryResultBackend implements ResultBackend {
    
    private final Map<String, TaskResultRecord> latest = new ConcurrentHashMap<>();
    private final List<TaskResultRecord> history = Collections.synchronizedList(new ArrayList<>());
    
    @Override
    public void storeResult(String requestId, TaskResultRecord record) {
        latest.put(requestId, record);
        history.add(record);
    }
    
    @Override
    public Optional<TaskResultRecord> getResult(String requestId) {
        return Optional.ofNullable(latest.get(requestId));
    }
    
    /**
     * Every record stored for a request, oldest first
     */
    public List<TaskResultRecord> getHistory(String requestId) {
        List<TaskResultRecord> result = new ArrayList<>();
        synchronized (history) {
            for (TaskResultRecord record : history) {
                if (record.getRequestId().equals(requestId)) {
                    result.add(record);
                }
            }
        }
        return result;
    }
    
    public int size() {
        return latest.size();
    }
}
