package com.enterprise.taskworker.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Jackson-based JSON codec: bodies look like {@code {"args": [...], "kwargs": {...}}}
 */
public class JsonPayloadCodec implements PayloadCodec {
    
    public static final String NAME = "json";
    public static final String CONTENT_TYPE = "application/json";
    
    private final ObjectMapper objectMapper;
    
    public JsonPayloadCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }
    
    @Override
    public String getName() {
        return NAME;
    }
    
    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }
    
    @Override
    public byte[] encode(TaskArguments arguments) throws IOException {
        return objectMapper.writeValueAsBytes(arguments);
    }
    
    @Override
    public TaskArguments decode(byte[] body) throws IOException {
        if (body == null || body.length == 0) {
            return TaskArguments.empty();
        }
        return objectMapper.readValue(body, TaskArguments.class);
    }
}
