package com.enterprise.taskworker.core;

import com.enterprise.taskworker.exception.MalformedMessageException;
import com.enterprise.taskworker.exception.SoftTimeLimitExceededException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskRequestTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Test
    void testEtaAndExpiry() {
        TaskRequest plain = TaskRequest.builder("r-1", "add").build();
        assertTrue(plain.isDue(NOW));
        assertFalse(plain.isExpired(NOW));

        TaskRequest later = plain.withEta(NOW.plusSeconds(10));
        assertFalse(later.isDue(NOW));
        assertTrue(later.isDue(NOW.plusSeconds(10)));

        TaskRequest expiring = TaskRequest.builder("r-2", "add").expires(NOW).build();
        assertTrue(expiring.isExpired(NOW));
        assertFalse(expiring.isExpired(NOW.minusMillis(1)));
    }

    @Test
    void testWithRetriesKeepsEverythingElse() {
        TaskRequest request = TaskRequest.builder("r-1", "add")
            .arguments(new TaskArguments(List.of(1, 2), Map.of()))
            .deliveryTag(7)
            .hardTimeLimit(Duration.ofSeconds(30))
            .build();

        TaskRequest retried = request.withRetries(2);

        assertEquals(2, retried.getRetries());
        assertEquals(0, request.getRetries());
        assertEquals(7, retried.getDeliveryTag());
        assertEquals(Duration.ofSeconds(30), retried.getHardTimeLimit());
        assertArrayEquals(request.getBody(), retried.getBody());
    }

    @Test
    void testArgumentsAreDecodedLazily() throws Exception {
        TaskRequest request = TaskRequest.builder("r-1", "send_email")
            .arguments(new TaskArguments(List.of("user@example.com"), Map.of("subject", "Hello")))
            .build();

        TaskArguments arguments = request.getArguments();

        assertEquals("user@example.com", arguments.get(0, "to"));
        assertEquals("Hello", arguments.get(1, "subject"));
        assertNull(arguments.get(2, "body"));
        assertSame(arguments, request.getArguments());
    }

    @Test
    void testUndecodableBody() {
        TaskRequest garbage = TaskRequest.builder("r-1", "add")
            .body("{not json".getBytes(StandardCharsets.UTF_8))
            .contentType(JsonPayloadCodec.CONTENT_TYPE)
            .build();
        TaskRequest unknownType = TaskRequest.builder("r-2", "add")
            .body(new byte[] {1})
            .contentType("application/x-msgpack")
            .build();

        assertThrows(MalformedMessageException.class, garbage::getArguments);
        assertThrows(MalformedMessageException.class, unknownType::getArguments);
        assertTrue(PayloadCodecs.forName("json").isPresent());
    }

    @Test
    void testEmptyBodyMeansNoArguments() throws Exception {
        TaskArguments arguments = TaskRequest.builder("r-1", "noop").build().getArguments();

        assertTrue(arguments.getArgs().isEmpty());
        assertTrue(arguments.getKwargs().isEmpty());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> TaskRequest.builder(null, "add").build());
        assertThrows(IllegalArgumentException.class, () -> TaskRequest.builder("r-1", "add").retries(-1).build());
    }

    @Test
    void testContextSoftLimitSignal() {
        TaskContext context = new TaskContext("r-1", "sleep", 0, TaskArguments.empty());

        assertDoesNotThrow(context::checkSoftTimeLimit);
        assertTrue(context.signalSoftTimeLimit());
        assertFalse(context.signalSoftTimeLimit());
        assertTrue(context.isSoftTimeLimitExceeded());
        assertThrows(SoftTimeLimitExceededException.class, context::checkSoftTimeLimit);
    }
}
