package com.enterprise.taskworker.core;

import com.enterprise.taskworker.exception.DuplicateTaskException;
import com.enterprise.taskworker.exception.UnknownTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Task name to definition mapping. Populated before the worker starts
 * and read-only once frozen, so lookups on the dispatch path take no locks.
 */
public class TaskRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(TaskRegistry.class);
    
    private final Map<String, TaskDefinition> definitions = new ConcurrentHashMap<>();
    private volatile boolean frozen = false;
    
    /**
     * Register a handler with default options
     */
    public TaskDefinition register(String name, TaskHandler handler) throws DuplicateTaskException {
        return register(TaskDefinition.builder(name, handler).build());
    }
    
    /**
     * Register a handler, customising its definition
     */
    public TaskDefinition register(String name, TaskHandler handler,
                                   UnaryOperator<TaskDefinition.Builder> options) throws DuplicateTaskException {
        return register(options.apply(TaskDefinition.builder(name, handler)).build());
    }
    
    public TaskDefinition register(TaskDefinition definition) throws DuplicateTaskException {
        if (frozen) {
            throw new IllegalStateException("Task registry is frozen; cannot register " + definition.getName());
        }
        TaskDefinition existing = definitions.putIfAbsent(definition.getName(), definition);
        if (existing != null) {
            throw new DuplicateTaskException(definition.getName());
        }
        logger.info("Registered task: {}", definition.getName());
        return definition;
    }
    
    public TaskDefinition lookup(String name) throws UnknownTaskException {
        TaskDefinition definition = name != null ? definitions.get(name) : null;
        if (definition == null) {
            throw new UnknownTaskException(name);
        }
        return definition;
    }
    
    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }
    
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(definitions.keySet()));
    }
    
    public int size() {
        return definitions.size();
    }
    
    /**
     * Disallow further registration. Called when the worker starts consuming.
     */
    public void freeze() {
        if (!frozen) {
            frozen = true;
            logger.debug("Task registry frozen with {} tasks", definitions.size());
        }
    }
    
    public boolean isFrozen() {
        return frozen;
    }
}
