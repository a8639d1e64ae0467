package com.enterprise.taskworker.core;

import com.enterprise.taskworker.exception.DuplicateTaskException;

/**
 * Populates a task registry. Implementations need a public no-arg constructor:
 * spawned child processes instantiate them by class name to rebuild the
 * parent's registry.
 */
public interface TaskRegistryProvider {
    
    void registerTasks(TaskRegistry registry) throws DuplicateTaskException;
    
    /**
     * Instantiate a provider by class name and build a registry from it
     */
    static TaskRegistry load(String providerClassName) throws ReflectiveOperationException, DuplicateTaskException {
        Class<?> type = Class.forName(providerClassName);
        if (!TaskRegistryProvider.class.isAssignableFrom(type)) {
            throw new ClassCastException(providerClassName + " does not implement " + TaskRegistryProvider.class.getName());
        }
        TaskRegistryProvider provider = (TaskRegistryProvider) type.getDeclaredConstructor().newInstance();
        TaskRegistry registry = new TaskRegistry();
        provider.registerTasks(registry);
        registry.freeze();
        return registry;
    }
}
