package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.AdmissionException;
import com.github.stormino.clipper.model.AdmissionErrorKind;
import com.github.stormino.clipper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClientRateLimiter")
class ClientRateLimiterTest {

    private MutableClock clock;
    private ClipperProperties properties;
    private ClientRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new ClipperProperties();
        limiter = new ClientRateLimiter(properties, clock);
    }

    @Nested
    @DisplayName("job window")
    class JobWindowTests {

        @Test
        @DisplayName("should allow exactly K jobs per window and reject the next")
        void shouldAllowExactlyK() {
            for (int i = 0; i < 3; i++) {
                assertNotNull(limiter.reserve("alice"));
                clock.advance(Duration.ofSeconds(1));
            }

            AdmissionException ex = assertThrows(AdmissionException.class, () -> limiter.reserve("alice"));
            assertEquals(AdmissionErrorKind.RATE_LIMITED, ex.getKind());
            // Oldest entry at t=0 leaves the hour window at t=3600; now is t=3
            assertEquals(Duration.ofSeconds(3597), ex.getRetryAfter());
        }

        @Test
        @DisplayName("should admit again once the oldest entry leaves the window")
        void shouldAdmitAfterWindowSlides() {
            for (int i = 0; i < 3; i++) {
                limiter.reserve("alice");
            }
            clock.advance(Duration.ofSeconds(3599));
            assertThrows(AdmissionException.class, () -> limiter.reserve("alice"));

            clock.advance(Duration.ofSeconds(1));
            assertNotNull(limiter.reserve("alice"));
        }

        @Test
        @DisplayName("clients should be limited independently")
        void clientsAreIndependent() {
            for (int i = 0; i < 3; i++) {
                limiter.reserve("alice");
            }
            assertNotNull(limiter.reserve("bob"));
        }
    }

    @Nested
    @DisplayName("submission window")
    class SubmissionWindowTests {

        @Test
        @DisplayName("should enforce the short window when it is the tighter one")
        void shouldEnforceShortWindow() {
            properties.getRateLimit().setJobsPerWindow(100);
            limiter = new ClientRateLimiter(properties, clock);

            for (int i = 0; i < 10; i++) {
                limiter.reserve("alice");
            }
            AdmissionException ex = assertThrows(AdmissionException.class, () -> limiter.reserve("alice"));
            assertEquals(Duration.ofSeconds(60), ex.getRetryAfter());

            clock.advance(Duration.ofSeconds(60));
            assertNotNull(limiter.reserve("alice"));
        }
    }

    @Nested
    @DisplayName("rollback")
    class RollbackTests {

        @Test
        @DisplayName("rolled back reservations should not count")
        void rollbackFreesTheSlot() {
            for (int i = 0; i < 3; i++) {
                ClientRateLimiter.Reservation reservation = limiter.reserve("alice");
                limiter.rollback(reservation);
            }
            for (int i = 0; i < 3; i++) {
                limiter.reserve("alice");
            }
            assertThrows(AdmissionException.class, () -> limiter.reserve("alice"));
        }

        @Test
        @DisplayName("rejected submissions should not consume the window")
        void rejectionsDoNotCount() {
            for (int i = 0; i < 3; i++) {
                limiter.reserve("alice");
            }
            for (int i = 0; i < 20; i++) {
                assertThrows(AdmissionException.class, () -> limiter.reserve("alice"));
            }
            clock.advance(Duration.ofSeconds(3600));
            assertNotNull(limiter.reserve("alice"));
        }
    }

    @Nested
    @DisplayName("lookup window")
    class LookupWindowTests {

        @Test
        @DisplayName("lookups should not consume the submission windows")
        void lookupsAreCountedSeparately() {
            for (int i = 0; i < 15; i++) {
                limiter.acquireLookup("alice");
            }
            AdmissionException ex = assertThrows(AdmissionException.class, () -> limiter.acquireLookup("alice"));
            assertEquals(AdmissionErrorKind.RATE_LIMITED, ex.getKind());

            assertNotNull(limiter.reserve("alice"));
        }

        @Test
        @DisplayName("should allow lookups again once the window slides")
        void lookupWindowSlides() {
            for (int i = 0; i < 15; i++) {
                limiter.acquireLookup("alice");
            }
            clock.advance(Duration.ofSeconds(60));

            assertDoesNotThrow(() -> limiter.acquireLookup("alice"));
        }
    }

    @Test
    @DisplayName("concurrent submissions from one client should never exceed K")
    void concurrentSubmissionsNeverExceedLimit() throws InterruptedException {
        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger limited = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                    limiter.reserve("alice");
                    admitted.incrementAndGet();
                } catch (AdmissionException e) {
                    limited.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(3, admitted.get());
        assertEquals(threads - 3, limited.get());
    }

    @Test
    @DisplayName("idle clients should be forgotten once their windows drain")
    void idleClientsAreEvicted() {
        limiter.reserve("alice");
        limiter.reserve("bob");
        assertEquals(2, limiter.getTrackedClientCount());

        clock.advance(Duration.ofSeconds(3600));
        assertEquals(2, limiter.evictIdle());
        assertEquals(0, limiter.getTrackedClientCount());
    }
}
