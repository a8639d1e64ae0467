package com.enterprise.taskworker.core;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of the codecs known to this worker
 */
public final class PayloadCodecs {
    
    private static final PayloadCodec JSON = new JsonPayloadCodec();
    
    private static final Map<String, PayloadCodec> BY_NAME = Map.of(JSON.getName(), JSON);
    private static final Map<String, PayloadCodec> BY_CONTENT_TYPE = Map.of(JSON.getContentType(), JSON);
    
    private PayloadCodecs() {
    }
    
    public static PayloadCodec json() {
        return JSON;
    }
    
    public static Optional<PayloadCodec> forName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
    
    public static Optional<PayloadCodec> forContentType(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CONTENT_TYPE.get(contentType));
    }
}
