package com.enterprise.taskworker.core;

import java.io.IOException;

/**
 * Encodes and decodes task message bodies
 */
public interface PayloadCodec {
    
    /**
     * Serializer name referenced by task definitions
     */
    String getName();
    
    /**
     * Content type stamped on messages produced by this codec
     */
    String getContentType();
    
    byte[] encode(TaskArguments arguments) throws IOException;
    
    TaskArguments decode(byte[] body) throws IOException;
}
