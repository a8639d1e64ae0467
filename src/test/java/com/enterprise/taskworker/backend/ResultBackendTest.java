package com.enterprise.taskworker.backend;

import com.enterprise.taskworker.core.ExceptionInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResultBackendTest {

    @TempDir
    File tempDir;

    @Test
    void testInMemoryKeepsLatestAndHistory() {
        InMemoryResultBackend backend = new InMemoryResultBackend();

        backend.storeResult("r-1", TaskResultRecord.of("r-1", "flaky", TaskState.RETRY,
            ExceptionInfo.from(new IllegalStateException("first")), 0, 0, "host"));
        backend.storeResult("r-1", TaskResultRecord.success("r-1", "flaky", "ok", 1, 12, "host"));

        assertEquals(TaskState.SUCCESS, backend.getResult("r-1").get().getState());
        assertEquals(2, backend.getHistory("r-1").size());
        assertEquals(TaskState.RETRY, backend.getHistory("r-1").get(0).getState());
        assertEquals(1, backend.size());
        assertFalse(backend.getResult("other").isPresent());
    }

    @Test
    void testMapDBPersistsRecords() throws Exception {
        String path = new File(tempDir, "results.db").getAbsolutePath();
        MapDBResultBackend backend = new MapDBResultBackend(path);

        backend.storeResult("r-1", TaskResultRecord.success("r-1", "send_email",
            Map.of("status", "sent", "attempts", 2), 1, 250, "worker-a"));
        backend.storeResult("r-2", TaskResultRecord.of("r-2", "send_email", TaskState.FAILURE,
            ExceptionInfo.from(new java.io.IOException("SMTP down")), 5, 0, "worker-a"));
        backend.close();

        MapDBResultBackend reopened = new MapDBResultBackend(path);
        try {
            TaskResultRecord success = reopened.getResult("r-1").get();
            assertEquals(TaskState.SUCCESS, success.getState());
            assertEquals("sent", ((Map<?, ?>) success.getResult()).get("status"));
            assertEquals(250, success.getRuntimeMs());
            assertNotNull(success.getCompletedAt());

            TaskResultRecord failure = reopened.getResult("r-2").get();
            assertEquals(TaskState.FAILURE, failure.getState());
            assertTrue(failure.getError().isInstanceOf(java.io.IOException.class));
            assertEquals(5, failure.getRetries());

            assertEquals(2, reopened.size());
            assertEquals(Optional.empty(), reopened.getResult("missing"));
        } finally {
            reopened.close();
        }
    }

    @Test
    void testDisabledBackendStoresNothing() throws Exception {
        ResultBackend backend = ResultBackend.disabled();

        backend.storeResult("r-1", TaskResultRecord.success("r-1", "add", 3, 0, 1, "host"));

        assertTrue(backend.getResult("r-1").isEmpty());
        assertTrue(TaskState.SUCCESS.isReady());
        assertFalse(TaskState.RETRY.isReady());
    }
}
