package com.enterprise.taskworker.examples;

import com.enterprise.taskworker.core.RetryPolicy;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.pool.HandlerInvoker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExampleTasksTest {

    private TaskRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        registry = new TaskRegistry();
        new ExampleTasks().registerTasks(registry);
    }

    private TaskOutcome run(String taskName, List<Object> args, Map<String, Object> kwargs) throws Exception {
        TaskRequest request = TaskRequest.builder("req-" + taskName, taskName)
            .arguments(new TaskArguments(args, kwargs))
            .build();
        return HandlerInvoker.invoke(registry.lookup(taskName).getHandler(), request, context -> { });
    }

    @Test
    void testArithmeticTasks() throws Exception {
        assertEquals(42L, ((Number) run(ExampleTasks.ADD, List.of(20, 22), Map.of()).getResult()).longValue());
        assertEquals(42L, ((Number) run(ExampleTasks.MULTIPLY, List.of(), Map.of("x", 6, "y", 7)).getResult()).longValue());

        TaskOutcome badInput = run(ExampleTasks.ADD, List.of("one", 2), Map.of());
        assertEquals(TaskOutcome.Kind.FAILURE, badInput.getKind());
        assertTrue(badInput.getError().isInstanceOf(IllegalArgumentException.class));
    }

    @Test
    void testRaiseErrorUsesMessage() throws Exception {
        TaskOutcome outcome = run(ExampleTasks.RAISE_ERROR, List.of("expected"), Map.of());

        assertEquals(TaskOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals("expected", outcome.getError().getMessage());
        assertEquals(Integer.valueOf(2), registry.lookup(ExampleTasks.RAISE_ERROR).getRetryPolicy().getMaxRetries());
    }

    @Test
    void testSendEmailRejectsMissingFields() throws Exception {
        TaskOutcome outcome = run(ExampleTasks.SEND_EMAIL, List.of("user@example.com"), Map.of());

        assertTrue(outcome.isRejectRequested());
        assertFalse(outcome.isRequeue());
    }

    @Test
    void testSendEmailSendsOrFailsWithIoError() throws Exception {
        TaskOutcome outcome = run(ExampleTasks.SEND_EMAIL, List.of(),
            Map.of("recipient", "user@example.com", "subject", "Welcome", "body", "Hello"));

        if (outcome.isSuccess()) {
            Map<?, ?> result = (Map<?, ?>) outcome.getResult();
            assertEquals("sent", result.get("status"));
            assertEquals("user@example.com", result.get("recipient"));
        } else {
            assertTrue(outcome.getError().isInstanceOf(IOException.class));
            assertTrue(registry.lookup(ExampleTasks.SEND_EMAIL).getRetryPolicy().isRetryable(outcome.getError()));
        }
        assertNotNull(registry.lookup(ExampleTasks.SEND_EMAIL).getRateLimit());
    }

    @Test
    void testRegistryIsComplete() throws Exception {
        for (String name : List.of(ExampleTasks.ADD, ExampleTasks.MULTIPLY, ExampleTasks.IDENTITY, ExampleTasks.SLEEP,
                                   ExampleTasks.RAISE_ERROR, ExampleTasks.HALT_PROCESS, ExampleTasks.SEND_EMAIL)) {
            assertTrue(registry.contains(name), name);
        }
        assertEquals(RetryPolicy.Predefined.noRetry().getMaxRetries(),
                     registry.lookup(ExampleTasks.SLEEP).getRetryPolicy().getMaxRetries());
    }
}
