package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobCapacity")
class JobCapacityTest {

    private static JobCapacity capacityOf(int limit) {
        ClipperProperties properties = new ClipperProperties();
        properties.getAdmission().setQueueCapacity(limit);
        return new JobCapacity(properties);
    }

    @Test
    @DisplayName("should grant exactly N slots")
    void shouldGrantExactlyN() {
        JobCapacity capacity = capacityOf(20);

        for (int i = 0; i < 20; i++) {
            assertTrue(capacity.tryAcquire(), "slot " + i);
        }
        assertFalse(capacity.tryAcquire());
        assertEquals(20, capacity.getUsed());
    }

    @Test
    @DisplayName("released slots should be reusable")
    void releasedSlotsAreReusable() {
        JobCapacity capacity = capacityOf(1);

        assertTrue(capacity.tryAcquire());
        assertFalse(capacity.tryAcquire());
        capacity.release();
        assertTrue(capacity.tryAcquire());
    }

    @Test
    @DisplayName("concurrent acquirers should never exceed the limit")
    void concurrentAcquirersNeverExceedLimit() throws InterruptedException {
        JobCapacity capacity = capacityOf(5);
        int threads = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                    if (capacity.tryAcquire()) {
                        granted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(5, granted.get());
        assertEquals(5, capacity.getUsed());
    }

    @Test
    @DisplayName("extra releases should not go below zero")
    void extraReleasesClampAtZero() {
        JobCapacity capacity = capacityOf(2);
        capacity.release();
        assertEquals(0, capacity.getUsed());
        assertTrue(capacity.tryAcquire());
        assertTrue(capacity.tryAcquire());
        assertFalse(capacity.tryAcquire());
    }
}
