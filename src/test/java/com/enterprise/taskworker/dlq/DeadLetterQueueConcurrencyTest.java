package com.enterprise.taskworker.dlq;

import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Thread safety of the MapDB dead letter queue: the dispatcher's result writer adds
 * while replay and cleanup remove from other threads.
 */
@Timeout(value = 2, unit = TimeUnit.MINUTES)
class DeadLetterQueueConcurrencyTest {

    private static final int THREAD_COUNT = 8;
    private static final int OPERATIONS_PER_THREAD = 50;

    @TempDir
    File tempDir;

    private MapDBDeadLetterQueue dlq;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        dlq = new MapDBDeadLetterQueue(new File(tempDir, "dlq-concurrency.db").getAbsolutePath(), 10000, true, 30);
        executorService = Executors.newFixedThreadPool(THREAD_COUNT);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executorService.shutdownNow();
        executorService.awaitTermination(10, TimeUnit.SECONDS);
        dlq.close();
    }

    private static DeadLetterEntry entry(int threadId, int index) {
        TaskRequest request = TaskRequest.builder("req-" + threadId + "-" + index, "task-" + (index % 3))
            .retries(index % 4)
            .build();
        return DeadLetterEntry.create(request, RejectionReason.NOT_RETRYABLE, "Concurrent test failure",
            ExceptionInfo.from(new IllegalStateException("boom " + index)));
    }

    @Test
    void testConcurrentAddOperations() throws InterruptedException {
        AtomicInteger successCount = new AtomicInteger(0);
        CountDownLatch latch = new CountDownLatch(THREAD_COUNT);

        for (int i = 0; i < THREAD_COUNT; i++) {
            final int threadId = i;
            executorService.submit(() -> {
                try {
                    for (int j = 0; j < OPERATIONS_PER_THREAD; j++) {
                        if (dlq.add(entry(threadId, j))) {
                            successCount.incrementAndGet();
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(60, TimeUnit.SECONDS));

        DeadLetterQueueStatistics stats = dlq.getStatistics();
        assertEquals(THREAD_COUNT * OPERATIONS_PER_THREAD, successCount.get());
        assertEquals(successCount.get(), stats.getCurrentSize());
        assertEquals((long) successCount.get(), stats.getTotalAdded());
        assertEquals(3, stats.getTaskNameCounts().size());
    }

    @Test
    void testConcurrentAddAndRemove() throws InterruptedException {
        for (int j = 0; j < OPERATIONS_PER_THREAD; j++) {
            assertTrue(dlq.add(entry(0, j)));
        }

        AtomicInteger removed = new AtomicInteger(0);
        CountDownLatch latch = new CountDownLatch(THREAD_COUNT);

        for (int i = 0; i < THREAD_COUNT; i++) {
            final int threadId = i;
            executorService.submit(() -> {
                try {
                    for (int j = 0; j < OPERATIONS_PER_THREAD; j++) {
                        if (threadId % 2 == 0) {
                            // every remover races for the same ids
                            if (dlq.remove("req-0-" + j)) {
                                removed.incrementAndGet();
                            }
                        } else {
                            dlq.add(entry(threadId, j));
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(60, TimeUnit.SECONDS));

        int adders = THREAD_COUNT / 2;
        assertEquals(OPERATIONS_PER_THREAD, removed.get());
        assertEquals(adders * OPERATIONS_PER_THREAD, dlq.size());
        assertTrue(dlq.get("req-0-0").isEmpty());
        assertEquals(dlq.size(), dlq.findByTask("task-0").size() + dlq.findByTask("task-1").size()
            + dlq.findByTask("task-2").size());
    }
}
