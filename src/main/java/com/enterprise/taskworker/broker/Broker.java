package com.enterprise.taskworker.broker;

import com.enterprise.taskworker.exception.BrokerUnavailableException;

import java.time.Duration;
import java.util.Optional;

/**
 * Message broker the worker consumes from. Every delivery must be settled
 * exactly once with {@link #ack} or {@link #reject}.
 */
public interface Broker {
    
    /**
     * Wait up to {@code timeout} for the next delivery
     */
    Optional<BrokerMessage> receive(Duration timeout) throws BrokerUnavailableException, InterruptedException;
    
    void ack(long deliveryTag) throws BrokerUnavailableException;
    
    /**
     * Reject a delivery; with {@code requeue} it becomes available again, otherwise it is dead-lettered or dropped
     */
    void reject(long deliveryTag, boolean requeue) throws BrokerUnavailableException;
    
    /**
     * Enqueue a new message. Optional; used for broker-side retries and dead-letter replay.
     */
    default void publish(TaskMessage message) throws BrokerUnavailableException {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support publishing");
    }
}
