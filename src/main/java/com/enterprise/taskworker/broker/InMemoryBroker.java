package com.enterprise.taskworker.broker;

import com.enterprise.taskworker.exception.BrokerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-queue broker held in memory. Deliveries stay unacked until settled;
 * a requeued delivery comes back with the redelivered flag set.
 * Availability can be switched off to simulate a lost connection.
 */
public class InMemoryBroker implements Broker {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryBroker.class);
    
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    
    private final Deque<Pending> ready = new ArrayDeque<>();
    private final Map<Long, TaskMessage> unacked = new LinkedHashMap<>();
    private final List<TaskMessage> acked = new ArrayList<>();
    private final List<TaskMessage> deadLettered = new ArrayList<>();
    private long nextDeliveryTag = 1;
    private volatile boolean available = true;
    
    @Override
    public void publish(TaskMessage message) throws BrokerUnavailableException {
        lock.lock();
        try {
            checkAvailable();
            ready.addLast(new Pending(message, false));
            notEmpty.signal();
            logger.debug("Published message {} for task {}", message.getId(), message.getTaskName());
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public Optional<BrokerMessage> receive(Duration timeout) throws BrokerUnavailableException, InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                checkAvailable();
                Pending next = ready.pollFirst();
                if (next != null) {
                    long tag = nextDeliveryTag++;
                    unacked.put(tag, next.message);
                    return Optional.of(new BrokerMessage(tag, next.message, next.redelivered));
                }
                if (remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void ack(long deliveryTag) throws BrokerUnavailableException {
        lock.lock();
        try {
            checkAvailable();
            TaskMessage message = unacked.remove(deliveryTag);
            if (message == null) {
                throw new IllegalStateException("Unknown or already settled delivery tag " + deliveryTag);
            }
            acked.add(message);
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void reject(long deliveryTag, boolean requeue) throws BrokerUnavailableException {
        lock.lock();
        try {
            checkAvailable();
            TaskMessage message = unacked.remove(deliveryTag);
            if (message == null) {
                throw new IllegalStateException("Unknown or already settled delivery tag " + deliveryTag);
            }
            if (requeue) {
                ready.addLast(new Pending(message, true));
                notEmpty.signal();
            } else {
                deadLettered.add(message);
            }
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Simulate losing (false) or regaining (true) the broker connection
     */
    public void setAvailable(boolean available) {
        lock.lock();
        try {
            this.available = available;
            notEmpty.signalAll();
            logger.info("Broker {}", available ? "available" : "unavailable");
        } finally {
            lock.unlock();
        }
    }
    
    public boolean isAvailable() {
        return available;
    }
    
    public int readyCount() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }
    
    public int unackedCount() {
        lock.lock();
        try {
            return unacked.size();
        } finally {
            lock.unlock();
        }
    }
    
    public List<TaskMessage> getAcked() {
        lock.lock();
        try {
            return new ArrayList<>(acked);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Messages rejected without requeue
     */
    public List<TaskMessage> getDeadLettered() {
        lock.lock();
        try {
            return new ArrayList<>(deadLettered);
        } finally {
            lock.unlock();
        }
    }
    
    private void checkAvailable() throws BrokerUnavailableException {
        if (!available) {
            throw new BrokerUnavailableException("Broker connection unavailable");
        }
    }
    
    private static final class Pending {
        private final TaskMessage message;
        private final boolean redelivered;
        
        private Pending(TaskMessage message, boolean redelivered) {
            this.message = message;
            this.redelivered = redelivered;
        }
    }
}
