package com.enterprise.taskworker.broker;

import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.exception.MalformedMessageException;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * A message delivered by a broker, identified by its delivery tag until settled
 */
public final class BrokerMessage {
    
    private final long deliveryTag;
    private final TaskMessage message;
    private final boolean redelivered;
    
    public BrokerMessage(long deliveryTag, TaskMessage message, boolean redelivered) {
        this.deliveryTag = deliveryTag;
        this.message = message;
        this.redelivered = redelivered;
    }
    
    public long getDeliveryTag() { return deliveryTag; }
    
    public TaskMessage getMessage() { return message; }
    
    public boolean isRedelivered() { return redelivered; }
    
    /**
     * Decode headers into a request. The body stays encoded until the arguments are first read.
     */
    public TaskRequest toRequest() throws MalformedMessageException {
        String id = message.getId();
        String taskName = message.getTaskName();
        if (id == null || id.isEmpty()) {
            throw new MalformedMessageException("Message has no '" + TaskMessage.HEADER_ID + "' header");
        }
        if (taskName == null || taskName.isEmpty()) {
            throw new MalformedMessageException("Message " + id + " has no '" + TaskMessage.HEADER_TASK + "' header");
        }
        
        try {
            return TaskRequest.builder(id, taskName)
                .body(message.getBody())
                .contentType(message.getContentType())
                .deliveryTag(deliveryTag)
                .redelivered(redelivered)
                .retries(parseRetries(message.getHeader(TaskMessage.HEADER_RETRIES)))
                .eta(parseInstant(message.getHeader(TaskMessage.HEADER_ETA)))
                .expires(parseInstant(message.getHeader(TaskMessage.HEADER_EXPIRES)))
                .origin(message.getHeader(TaskMessage.HEADER_ORIGIN))
                .softTimeLimit(parseMillis(message.getHeader(TaskMessage.HEADER_SOFT_TIME_LIMIT)))
                .hardTimeLimit(parseMillis(message.getHeader(TaskMessage.HEADER_TIME_LIMIT)))
                .headers(message.getHeaders())
                .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new MalformedMessageException("Message " + id + " has an unparsable header: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Message " + id + " is invalid: " + e.getMessage(), e);
        }
    }
    
    private static int parseRetries(String value) {
        return value == null || value.isEmpty() ? 0 : Integer.parseInt(value);
    }
    
    private static Instant parseInstant(String value) {
        return value == null || value.isEmpty() ? null : Instant.parse(value);
    }
    
    private static Duration parseMillis(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        long millis = Long.parseLong(value);
        if (millis <= 0) {
            throw new NumberFormatException("time limit must be positive: " + value);
        }
        return Duration.ofMillis(millis);
    }
    
    @Override
    public String toString() {
        return "BrokerMessage{tag=" + deliveryTag + ", redelivered=" + redelivered + ", " + message + "}";
    }
}
