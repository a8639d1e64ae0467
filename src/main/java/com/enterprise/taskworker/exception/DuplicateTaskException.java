package com.enterprise.taskworker.exception;

/**
 * Exception thrown when a task name is registered twice
 */
public class DuplicateTaskException extends TaskWorkerException {
    
    private final String taskName;
    
    public DuplicateTaskException(String taskName) {
        super("Task already registered: " + taskName);
        this.taskName = taskName;
    }
    
    public String getTaskName() {
        return taskName;
    }
}
