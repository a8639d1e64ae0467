package com.enterprise.taskworker.core;

/**
 * Interface for task bodies.
 * Implementations must be thread-safe and must not assume which pool strategy hosts them.
 */
@FunctionalInterface
public interface TaskHandler {
    
    /**
     * Execute the task
     * @param context request id, arguments and time-limit signals of this execution
     * @return the task result; must be JSON-serializable when run by a process pool
     * @throws Exception any error, reported as a failure outcome
     */
    Object handle(TaskContext context) throws Exception;
}
