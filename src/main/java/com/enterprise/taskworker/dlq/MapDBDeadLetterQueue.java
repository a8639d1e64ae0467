package com.enterprise.taskworker.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.Atomic;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Dead letter queue in a MapDB file. Entries are stored as Jackson JSON keyed by request id;
 * a summary of every entry is kept in memory so statistics, retention and per-task lookups
 * never have to decode the stored JSON.
 */
public class MapDBDeadLetterQueue implements DeadLetterQueue {

    private static final Logger logger = LoggerFactory.getLogger(MapDBDeadLetterQueue.class);

    private final DB db;
    private final HTreeMap<String, String> entries;
    private final Atomic.Long totalAdded;
    private final Atomic.Long totalRemoved;
    private final Map<String, Summary> summaries = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxCapacity;
    private final boolean enableRetentionPolicy;
    private final Duration retention;

    public MapDBDeadLetterQueue(String dbPath, int maxCapacity, boolean enableRetentionPolicy, long retentionDays) {
        this.maxCapacity = maxCapacity;
        this.enableRetentionPolicy = enableRetentionPolicy;
        this.retention = Duration.ofDays(retentionDays);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());

        this.db = DBMaker.fileDB(new File(dbPath))
            .fileChannelEnable()
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();

        this.entries = db.hashMap("deadLetters", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.totalAdded = db.atomicLong("deadLettersAdded").createOrOpen();
        this.totalRemoved = db.atomicLong("deadLettersRemoved").createOrOpen();

        for (Map.Entry<String, String> stored : entries.entrySet()) {
            decode(stored.getValue()).ifPresent(entry -> summaries.put(entry.getRequestId(), Summary.of(entry)));
        }

        logger.info("Dead letter queue {} opened with {} entries (capacity {}, retention {} days)",
                   dbPath, summaries.size(), maxCapacity, retentionDays);
    }

    @Override
    public boolean add(DeadLetterEntry entry) {
        lock.writeLock().lock();
        try {
            String requestId = entry.getRequestId();
            if (summaries.size() >= maxCapacity && !summaries.containsKey(requestId)) {
                logger.warn("Dead letter queue is full ({}), dropping {} ({}: {})",
                           maxCapacity, requestId, entry.getReason(), entry.getFailureReason());
                return false;
            }

            entries.put(requestId, objectMapper.writeValueAsString(entry));
            totalAdded.incrementAndGet();
            db.commit();
            summaries.put(requestId, Summary.of(entry));

            logger.info("Dead-lettered {} ({}): {} - {}", requestId, entry.getTaskName(), entry.getReason(),
                       entry.getFailureReason());
            return true;

        } catch (JsonProcessingException e) {
            logger.error("Could not serialize dead letter for {}", entry.getRequestId(), e);
            return false;
        } catch (RuntimeException e) {
            logger.error("Could not write dead letter for {}", entry.getRequestId(), e);
            db.rollback();
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<DeadLetterEntry> get(String requestId) {
        lock.readLock().lock();
        try {
            String json = entries.get(requestId);
            return json != null ? decode(json) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DeadLetterEntry> findByTask(String taskName) {
        lock.readLock().lock();
        try {
            List<DeadLetterEntry> found = new ArrayList<>();
            summaries.values().stream()
                .filter(summary -> taskName.equals(summary.taskName))
                .sorted(Comparator.comparing((Summary summary) -> summary.addedAt))
                .forEach(summary -> {
                    String json = entries.get(summary.requestId);
                    if (json != null) {
                        decode(json).ifPresent(found::add);
                    }
                });
            return found;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(String requestId) {
        lock.writeLock().lock();
        try {
            if (entries.remove(requestId) == null) {
                return false;
            }
            totalRemoved.incrementAndGet();
            db.commit();
            summaries.remove(requestId);
            logger.debug("Removed {} from the dead letter queue", requestId);
            return true;

        } catch (RuntimeException e) {
            logger.error("Could not remove dead letter {}", requestId, e);
            db.rollback();
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        return summaries.size();
    }

    @Override
    public boolean isAtCapacity() {
        return size() >= maxCapacity;
    }

    @Override
    public DeadLetterQueueStatistics getStatistics() {
        lock.readLock().lock();
        try {
            Map<RejectionReason, Integer> byReason = new EnumMap<>(RejectionReason.class);
            Map<String, Integer> byErrorType = new HashMap<>();
            Map<String, Integer> byTask = new HashMap<>();
            Instant oldest = null;

            for (Summary summary : summaries.values()) {
                byReason.merge(summary.reason, 1, Integer::sum);
                byErrorType.merge(summary.errorType, 1, Integer::sum);
                byTask.merge(String.valueOf(summary.taskName), 1, Integer::sum);
                if (oldest == null || summary.addedAt.isBefore(oldest)) {
                    oldest = summary.addedAt;
                }
            }
            return new DeadLetterQueueStatistics(summaries.size(), totalAdded.get(), totalRemoved.get(), oldest,
                byReason, byErrorType, byTask);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int cleanupOldEntries() {
        if (!enableRetentionPolicy) {
            return 0;
        }

        lock.writeLock().lock();
        try {
            Instant cutoff = Instant.now().minus(retention);
            List<String> expired = summaries.values().stream()
                .filter(summary -> summary.addedAt.isBefore(cutoff))
                .map(summary -> summary.requestId)
                .collect(Collectors.toList());
            if (expired.isEmpty()) {
                return 0;
            }

            for (String requestId : expired) {
                entries.remove(requestId);
            }
            totalRemoved.addAndGet(expired.size());
            db.commit();
            expired.forEach(summaries::remove);

            logger.info("Dropped {} dead letters older than {}", expired.size(), cutoff);
            return expired.size();

        } catch (RuntimeException e) {
            logger.error("Dead letter retention cleanup failed", e);
            db.rollback();
            return 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
                logger.info("Dead letter queue closed");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<DeadLetterEntry> decode(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, DeadLetterEntry.class));
        } catch (JsonProcessingException e) {
            logger.error("Skipping unreadable dead letter", e);
            return Optional.empty();
        }
    }

    private static final class Summary {
        private final String requestId;
        private final String taskName;
        private final RejectionReason reason;
        private final String errorType;
        private final Instant addedAt;

        private Summary(String requestId, String taskName, RejectionReason reason, String errorType, Instant addedAt) {
            this.requestId = requestId;
            this.taskName = taskName;
            this.reason = reason;
            this.errorType = errorType;
            this.addedAt = addedAt;
        }

        static Summary of(DeadLetterEntry entry) {
            return new Summary(entry.getRequestId(), entry.getTaskName(), entry.getReason(), entry.getErrorType(),
                entry.getAddedToDlqTime());
        }
    }
}
