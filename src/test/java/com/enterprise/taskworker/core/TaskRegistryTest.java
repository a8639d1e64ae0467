package com.enterprise.taskworker.core;

import com.enterprise.taskworker.examples.ExampleTasks;
import com.enterprise.taskworker.exception.DuplicateTaskException;
import com.enterprise.taskworker.exception.UnknownTaskException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskRegistryTest {

    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry();
    }

    @Test
    void testRegisterWithDefaults() throws Exception {
        TaskDefinition definition = registry.register("add", context -> 1);

        assertEquals("add", definition.getName());
        assertEquals(TaskDefinition.DEFAULT_QUEUE, definition.getQueue());
        assertEquals(TaskDefinition.DEFAULT_QUEUE, definition.getRoutingKey());
        assertEquals("json", definition.getSerializer());
        assertEquals(AckMode.LATE, definition.getAckMode());
        assertEquals(3, definition.getRetryPolicy().getMaxRetries());
        assertNull(definition.getRateLimit());
        assertSame(definition, registry.lookup("add"));
    }

    @Test
    void testRegisterWithOptions() throws Exception {
        TaskDefinition definition = registry.register("report", context -> null, builder -> builder
            .queue("reports")
            .ackMode(AckMode.EARLY)
            .rateLimit("5/m")
            .softTimeLimit(Duration.ofSeconds(5))
            .hardTimeLimit(Duration.ofSeconds(10))
            .ignoreResult(true));

        assertEquals("reports", definition.getRoutingKey());
        assertEquals(AckMode.EARLY, definition.getAckMode());
        assertEquals(new RateLimit(5, Duration.ofMinutes(1)), definition.getRateLimit());
        assertTrue(definition.isIgnoreResult());
    }

    @Test
    void testDuplicateRegistrationFails() throws Exception {
        registry.register("add", context -> 1);

        DuplicateTaskException e = assertThrows(DuplicateTaskException.class,
            () -> registry.register("add", context -> 2));
        assertTrue(e.getMessage().contains("add"));
        assertEquals(1, registry.size());
    }

    @Test
    void testUnknownLookupFails() {
        assertThrows(UnknownTaskException.class, () -> registry.lookup("missing"));
        assertThrows(UnknownTaskException.class, () -> registry.lookup(null));
        assertFalse(registry.contains("missing"));
    }

    @Test
    void testFrozenRegistryRejectsRegistration() throws Exception {
        registry.register("add", context -> 1);
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register("mul", context -> 2));
        assertNotNull(registry.lookup("add"));
    }

    @Test
    void testNamesAreSorted() throws Exception {
        registry.register("b", context -> null);
        registry.register("a", context -> null);

        assertEquals(List.of("a", "b"), List.copyOf(registry.names()));
        assertThrows(UnsupportedOperationException.class, () -> registry.names().add("c"));
    }

    @Test
    void testInvalidDefinitionsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> TaskDefinition.builder("t", context -> null)
                .softTimeLimit(Duration.ofSeconds(10))
                .hardTimeLimit(Duration.ofSeconds(5))
                .build());
        assertThrows(IllegalArgumentException.class,
            () -> TaskDefinition.builder("t", context -> null).serializer("pickle").build());
        assertThrows(IllegalArgumentException.class,
            () -> TaskDefinition.builder(" ", context -> null).build());
    }

    @Test
    void testLoadFromProvider() throws Exception {
        TaskRegistry loaded = TaskRegistryProvider.load(ExampleTasks.class.getName());

        assertTrue(loaded.isFrozen());
        assertTrue(loaded.contains(ExampleTasks.ADD));
        assertTrue(loaded.contains(ExampleTasks.SEND_EMAIL));
    }

    @Test
    void testLoadRejectsNonProvider() {
        assertThrows(ClassCastException.class, () -> TaskRegistryProvider.load(String.class.getName()));
        assertThrows(ClassNotFoundException.class, () -> TaskRegistryProvider.load("com.example.Missing"));
    }
}
