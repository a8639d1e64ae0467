package com.enterprise.taskworker.exception;

/**
 * Exception thrown by a broker when the transport cannot be reached.
 * Callers are expected to reconnect with backoff; settlements are never dropped.
 */
public class BrokerUnavailableException extends TaskWorkerException {
    
    public BrokerUnavailableException(String message) {
        super(message);
    }
    
    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
