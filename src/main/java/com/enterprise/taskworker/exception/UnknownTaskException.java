package com.enterprise.taskworker.exception;

/**
 * Exception thrown when no task is registered under a name
 */
public class UnknownTaskException extends TaskWorkerException {
    
    private final String taskName;
    
    public UnknownTaskException(String taskName) {
        super("No task registered under name: " + taskName);
        this.taskName = taskName;
    }
    
    public String getTaskName() {
        return taskName;
    }
}
