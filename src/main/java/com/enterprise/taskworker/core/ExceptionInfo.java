package com.enterprise.taskworker.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Captured error of a failed execution. Plain strings only, so it can travel
 * from a child process and be stored by a result backend.
 */
public class ExceptionInfo {
    
    private final String type;
    private final List<String> typeHierarchy;
    private final String message;
    private final String stackTrace;
    
    @JsonCreator
    public ExceptionInfo(@JsonProperty("type") String type,
                         @JsonProperty("typeHierarchy") List<String> typeHierarchy,
                         @JsonProperty("message") String message,
                         @JsonProperty("stackTrace") String stackTrace) {
        this.type = type;
        this.typeHierarchy = typeHierarchy != null ? Collections.unmodifiableList(typeHierarchy) : List.of(type);
        this.message = message;
        this.stackTrace = stackTrace;
    }
    
    public static ExceptionInfo from(Throwable throwable) {
        List<String> hierarchy = new ArrayList<>();
        for (Class<?> c = throwable.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(c.getName());
        }
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return new ExceptionInfo(throwable.getClass().getName(), hierarchy, throwable.getMessage(), writer.toString());
    }
    
    public String getType() { return type; }
    
    public List<String> getTypeHierarchy() { return typeHierarchy; }
    
    public String getMessage() { return message; }
    
    public String getStackTrace() { return stackTrace; }
    
    /**
     * Whether the captured exception was an instance of the given type
     */
    public boolean isInstanceOf(Class<? extends Throwable> exceptionType) {
        return typeHierarchy.contains(exceptionType.getName());
    }
    
    @Override
    public String toString() {
        return message != null ? type + ": " + message : type;
    }
}
