package com.enterprise.taskworker.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Positional and keyword arguments of a task request
 */
public class TaskArguments {
    
    private static final TaskArguments EMPTY = new TaskArguments(List.of(), Map.of());
    
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    
    @JsonCreator
    public TaskArguments(@JsonProperty("args") List<Object> args,
                         @JsonProperty("kwargs") Map<String, Object> kwargs) {
        this.args = args != null ? Collections.unmodifiableList(args) : List.of();
        this.kwargs = kwargs != null ? Collections.unmodifiableMap(kwargs) : Map.of();
    }
    
    public static TaskArguments empty() {
        return EMPTY;
    }
    
    public List<Object> getArgs() { return args; }
    
    public Map<String, Object> getKwargs() { return kwargs; }
    
    /**
     * Positional argument at index, or the keyword argument of the same name
     */
    public Object get(int index, String name) {
        if (index < args.size()) {
            return args.get(index);
        }
        return kwargs.get(name);
    }
    
    @Override
    public String toString() {
        return "args=" + args + ", kwargs=" + kwargs;
    }
}
