package com.enterprise.taskworker.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NamedThreadFactoryTest {

    @Test
    void testThreadsAreNumberedWithPrefix() {
        NamedThreadFactory factory = new NamedThreadFactory("green-0-", true);

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("green-0-1", first.getName());
        assertEquals("green-0-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void testSmallStackThreadRuns() throws InterruptedException {
        NamedThreadFactory factory = new NamedThreadFactory("small-", false, 256 * 1024);
        CountDownLatch ran = new CountDownLatch(1);

        Thread thread = factory.newThread(ran::countDown);
        assertFalse(thread.isDaemon());
        thread.start();

        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }
}
