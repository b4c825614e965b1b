package com.github.stormino.clipper.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Job")
class JobTest {

    private static Job newJob() {
        return Job.builder()
                .url("https://www.tiktok.com/@user/video/1")
                .platform(Platform.TIKTOK)
                .startSeconds(12.5)
                .endSeconds(30)
                .qualityLabel("720p")
                .rightsConfirmed(true)
                .clientId("client")
                .build();
    }

    @Test
    @DisplayName("should start QUEUED with a 32 character id")
    void shouldStartQueued() {
        Job job = newJob();

        assertEquals(JobStatus.QUEUED, job.getStatus());
        assertEquals(32, job.getId().length());
        assertEquals(17.5, job.getClipDurationSeconds(), 1e-9);
        assertNotNull(job.getSubmittedAt());
        assertFalse(job.isTerminal());
        assertNull(job.getProgress());
    }

    @Nested
    @DisplayName("claim")
    class ClaimTests {

        @Test
        @DisplayName("only one of many concurrent claimers should win")
        void onlyOneClaimerWins() throws InterruptedException {
            Job job = newJob();
            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger winners = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        if (job.claim()) {
                            winners.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(1, winners.get());
        }

        @Test
        @DisplayName("a job cannot be claimed twice")
        void cannotClaimTwice() {
            Job job = newJob();
            assertTrue(job.claim());
            assertFalse(job.claim());
            assertTrue(job.isOwnedByCurrentThread());
        }
    }

    @Nested
    @DisplayName("owner-only mutation")
    class MutationTests {

        @Test
        @DisplayName("unclaimed job rejects mutation")
        void unclaimedJobRejectsMutation() {
            Job job = newJob();
            assertThrows(IllegalStateException.class, () -> job.updateProgress(10));
            assertThrows(IllegalStateException.class, () -> job.resolveStreamSelector(StreamSelector.sourceDefault()));
        }

        @Test
        @DisplayName("progress should be clamped and never decrease")
        void progressShouldBeMonotonic() {
            Job job = newJob();
            job.claim();

            job.updateProgress(40);
            job.updateProgress(20);
            assertEquals(40, job.getProgress());

            job.updateProgress(250);
            assertEquals(100, job.getProgress());
        }

        @Test
        @DisplayName("stream selector can be resolved only once")
        void selectorResolvedOnce() {
            Job job = newJob();
            job.claim();

            job.resolveStreamSelector(StreamSelector.of("mp4"));
            assertThrows(IllegalStateException.class, () -> job.resolveStreamSelector(StreamSelector.sourceDefault()));
            assertEquals("mp4", job.getStreamSelector().getToken());
        }

        @Test
        @DisplayName("transition history is a snapshot")
        void transitionHistoryIsSnapshot() {
            Job job = newJob();
            assertThrows(UnsupportedOperationException.class, () -> job.getTransitions().clear());
        }
    }
}
