package com.enterprise.taskworker.dlq;

import com.enterprise.taskworker.broker.TaskMessage;
import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Dead Letter Queue functionality
 */
class DeadLetterQueueTest {
    
    @TempDir
    File tempDir;
    
    private MapDBDeadLetterQueue dlq;
    private TaskRequest testRequest;
    
    @BeforeEach
    void setUp() {
        dlq = open("test-dlq.db", 1000, 30);
        testRequest = request("req-1", "send_email", 2);
    }
    
    @AfterEach
    void tearDown() {
        dlq.close();
    }
    
    private MapDBDeadLetterQueue open(String name, int capacity, long retentionDays) {
        return new MapDBDeadLetterQueue(new File(tempDir, name).getAbsolutePath(), capacity, true, retentionDays);
    }
    
    private static TaskRequest request(String id, String taskName, int retries) {
        return TaskRequest.builder(id, taskName)
            .arguments(new TaskArguments(List.of("user@example.com"), Map.of("subject", "hi")))
            .retries(retries)
            .eta(Instant.parse("2030-01-01T00:00:00Z"))
            .build();
    }
    
    private static DeadLetterEntry entry(TaskRequest request, String reason) {
        return entry(request, RejectionReason.RETRIES_EXHAUSTED, reason);
    }
    
    private static DeadLetterEntry entry(TaskRequest request, RejectionReason reason, String detail) {
        return DeadLetterEntry.create(request, reason, detail, ExceptionInfo.from(new IOException("SMTP down")));
    }
    
    @Test
    void testAddToDeadLetterQueue() {
        assertTrue(dlq.add(entry(testRequest, "Max retries (3) exceeded")));
        assertEquals(1, dlq.size());
    }
    
    @Test
    void testGetDeadLetterEntry() {
        dlq.add(entry(testRequest, "Max retries (3) exceeded"));
        
        Optional<DeadLetterEntry> entry = dlq.get("req-1");
        
        assertTrue(entry.isPresent());
        assertEquals("req-1", entry.get().getRequestId());
        assertEquals("send_email", entry.get().getTaskName());
        assertEquals("Max retries (3) exceeded", entry.get().getFailureReason());
        assertEquals(2, entry.get().getRetryCount());
        assertEquals(IOException.class.getName(), entry.get().getErrorType());
        assertArrayEquals(testRequest.getBody(), entry.get().getBody());
        assertFalse(dlq.get("missing").isPresent());
    }
    
    @Test
    void testFindByTaskReturnsOldestFirst() throws InterruptedException {
        dlq.add(entry(request("req-a", "send_email", 0), "Failure a"));
        Thread.sleep(5);
        dlq.add(entry(request("req-x", "report", 0), "Failure x"));
        Thread.sleep(5);
        dlq.add(entry(request("req-b", "send_email", 0), "Failure b"));
        
        List<DeadLetterEntry> found = dlq.findByTask("send_email");
        
        assertEquals(2, found.size());
        assertEquals("req-a", found.get(0).getRequestId());
        assertEquals("req-b", found.get(1).getRequestId());
        assertTrue(dlq.findByTask("unknown").isEmpty());
    }
    
    @Test
    void testRemove() {
        dlq.add(entry(testRequest, "Rejected"));
        
        assertTrue(dlq.remove("req-1"));
        assertFalse(dlq.remove("req-1"));
        assertEquals(0, dlq.size());
        assertTrue(dlq.findByTask("send_email").isEmpty());
    }
    
    @Test
    void testIsAtCapacity() {
        MapDBDeadLetterQueue smallDlq = open("capacity-test.db", 2, 30);
        
        assertTrue(smallDlq.add(entry(request("a", "task", 0), "Failure 1")));
        assertFalse(smallDlq.isAtCapacity());
        assertTrue(smallDlq.add(entry(request("b", "task", 0), "Failure 2")));
        assertTrue(smallDlq.isAtCapacity());
        
        assertFalse(smallDlq.add(entry(request("c", "task", 0), "Failure 3")));
        // replacing an existing entry is allowed at capacity
        assertTrue(smallDlq.add(entry(request("a", "task", 1), "Failure 1 again")));
        smallDlq.close();
    }
    
    @Test
    void testGetStatistics() {
        dlq.add(entry(request("a", "send_email", 0), "SMTP Error"));
        dlq.add(entry(request("b", "send_email", 0), "SMTP Error"));
        dlq.add(DeadLetterEntry.create(request("c", "report", 0), RejectionReason.UNKNOWN_TASK, "Unknown task", null));
        dlq.remove("b");
        
        DeadLetterQueueStatistics stats = dlq.getStatistics();
        
        assertEquals(2, stats.getCurrentSize());
        assertEquals(3L, stats.getTotalAdded());
        assertEquals(1L, stats.getTotalRemoved());
        assertEquals(1, stats.countFor(RejectionReason.RETRIES_EXHAUSTED));
        assertEquals(1, stats.countFor(RejectionReason.UNKNOWN_TASK));
        assertEquals(0, stats.countFor(RejectionReason.REVOKED));
        assertEquals(1, stats.getErrorTypeCounts().get(IOException.class.getName()));
        assertEquals(1, stats.getErrorTypeCounts().get("Unknown"));
        assertEquals(1, stats.getTaskNameCounts().get("send_email"));
        assertNotNull(stats.getOldestEntryTime());
    }
    
    @Test
    void testCleanupOldEntries() throws InterruptedException {
        dlq.add(entry(testRequest, "Old failure"));
        assertEquals(0, dlq.cleanupOldEntries());
        assertEquals(1, dlq.size());
        
        MapDBDeadLetterQueue shortRetention = open("short-retention-test.db", 1000, 0);
        shortRetention.add(entry(testRequest, "New failure"));
        Thread.sleep(20);
        
        assertEquals(1, shortRetention.cleanupOldEntries());
        assertEquals(0, shortRetention.size());
        assertEquals(1L, shortRetention.getStatistics().getTotalRemoved());
        shortRetention.close();
    }
    
    @Test
    void testEntriesSurviveReopen() {
        dlq.add(entry(testRequest, "Persisted"));
        dlq.close();
        
        dlq = open("test-dlq.db", 1000, 30);
        
        assertEquals("Persisted", dlq.get("req-1").map(DeadLetterEntry::getFailureReason).orElse(null));
        assertEquals(RejectionReason.RETRIES_EXHAUSTED, dlq.get("req-1").get().getReason());
        assertEquals(1, dlq.findByTask("send_email").size());
    }
    
    @Test
    void testTotalsSurviveReopen() {
        dlq.add(entry(request("a", "task", 0), RejectionReason.REVOKED, "Revoked"));
        dlq.add(entry(request("b", "task", 0), RejectionReason.TIME_LIMIT_EXCEEDED, "Time limit exceeded"));
        dlq.remove("a");
        dlq.close();
        
        dlq = open("test-dlq.db", 1000, 30);
        DeadLetterQueueStatistics stats = dlq.getStatistics();
        
        assertEquals(1, stats.getCurrentSize());
        assertEquals(2L, stats.getTotalAdded());
        assertEquals(1L, stats.getTotalRemoved());
        assertEquals(1, stats.countFor(RejectionReason.TIME_LIMIT_EXCEEDED));
        assertEquals(0, stats.countFor(RejectionReason.REVOKED));
    }
    
    @Test
    void testReplayMessageResetsRetries() {
        TaskMessage replay = entry(testRequest, "Max retries").toReplayMessage();
        
        assertEquals("req-1", replay.getId());
        assertEquals("send_email", replay.getTaskName());
        assertEquals("0", replay.getHeader(TaskMessage.HEADER_RETRIES));
        assertNull(replay.getHeader(TaskMessage.HEADER_ETA));
        assertArrayEquals(testRequest.getBody(), replay.getBody());
    }
    
    @Test
    void testDeadLetterEntryEquality() {
        DeadLetterEntry entry1 = entry(testRequest, "Failure 1");
        DeadLetterEntry entry2 = entry(testRequest.withRetries(3), "Failure 2");
        
        assertEquals(entry1, entry2); // same request id
        assertEquals(entry1.hashCode(), entry2.hashCode());
    }
    
    @Test
    void testClose() {
        dlq.add(entry(testRequest, "Test failure"));
        
        assertDoesNotThrow(() -> dlq.close());
        assertDoesNotThrow(() -> dlq.close());
    }
}
