package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRequest;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HandlerInvokerTest {

    private final TaskRequest request = TaskRequest.builder("r-1", "task").retries(1).build();

    @Test
    void testContextIsHandedOutBeforeRunning() {
        AtomicReference<TaskContext> seen = new AtomicReference<>();

        TaskOutcome outcome = HandlerInvoker.invoke(context -> context.getRetries(), request, seen::set);

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getResult());
        assertEquals("r-1", seen.get().getRequestId());
    }

    @Test
    void testRetryRequestUsesCause() {
        TaskOutcome outcome = HandlerInvoker.invoke(
            context -> { throw context.retry(Duration.ofSeconds(2), new IOException("later")); },
            request, context -> { });

        assertTrue(outcome.isRetryRequested());
        assertEquals(IOException.class.getName(), outcome.getError().getType());
        assertEquals(Duration.ofSeconds(2), outcome.getRetryCountdown());
    }

    @Test
    void testCheckedExceptionBecomesFailure() {
        TaskOutcome outcome = HandlerInvoker.invoke(
            context -> { throw new IOException("disk full"); }, request, context -> { });

        assertEquals(TaskOutcome.Kind.FAILURE, outcome.getKind());
        assertFalse(outcome.isRetryRequested());
        assertEquals("disk full", outcome.getError().getMessage());
    }

    @Test
    void testVirtualMachineErrorPropagates() {
        assertThrows(InternalError.class, () -> HandlerInvoker.invoke(
            context -> { throw new InternalError("crash"); }, request, context -> { }));
    }
}
