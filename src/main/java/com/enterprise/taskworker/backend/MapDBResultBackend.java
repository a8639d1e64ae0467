package com.enterprise.taskworker.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Result backend stored in a MapDB file as Jackson JSON
 */
public class MapDBResultBackend implements ResultBackend {
    
    private static final Logger logger = LoggerFactory.getLogger(MapDBResultBackend.class);
    
    private final DB db;
    private final Map<String, String> results;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    
    public MapDBResultBackend(String dbPath) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        
        this.db = DBMaker.fileDB(new File(dbPath))
            .fileChannelEnable()
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();
        this.results = db.hashMap("results", Serializer.STRING, Serializer.STRING).createOrOpen();
        
        logger.info("MapDB result backend initialized at: {}", dbPath);
    }
    
    @Override
    public void storeResult(String requestId, TaskResultRecord record) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(record);
        lock.writeLock().lock();
        try {
            results.put(requestId, json);
            db.commit();
        } catch (RuntimeException e) {
            db.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public Optional<TaskResultRecord> getResult(String requestId) throws JsonProcessingException {
        String json;
        lock.readLock().lock();
        try {
            json = results.get(requestId);
        } finally {
            lock.readLock().unlock();
        }
        return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, TaskResultRecord.class));
    }
    
    public int size() {
        lock.readLock().lock();
        try {
            return results.size();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
                logger.info("MapDB result backend closed");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
}
