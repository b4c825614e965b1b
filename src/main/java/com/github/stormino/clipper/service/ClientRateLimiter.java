package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.AdmissionException;
import com.github.stormino.clipper.model.AdmissionErrorKind;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding-window rate limiter per client.
 * <p>
 * Two windows are enforced together: submissions per short window and job
 * creations per long window. A reservation is taken in both at once, under the
 * client's map entry, so concurrent submissions from one client can never
 * overshoot either limit. Metadata lookups are counted in a third window of
 * their own.
 */
@Slf4j
@Component
public class ClientRateLimiter {

    private final ClipperProperties.RateLimit limits;
    private final Clock clock;

    private final ConcurrentMap<String, ClientWindows> windows = new ConcurrentHashMap<>();

    public ClientRateLimiter(ClipperProperties properties, Clock clock) {
        this.limits = properties.getRateLimit();
        this.clock = clock;
    }

    /**
     * Count one submission against the client's windows.
     *
     * @return Reservation to roll back if admission fails later
     * @throws AdmissionException with {@link AdmissionErrorKind#RATE_LIMITED} when a window is full
     */
    public Reservation reserve(@NonNull String clientId) {
        Instant now = clock.instant();
        Duration[] denied = new Duration[1];

        windows.compute(clientId, (id, existing) -> {
            ClientWindows client = existing != null ? existing : new ClientWindows();
            client.prune(now, limits);

            Duration wait = Duration.ZERO;
            if (client.submissions.size() >= limits.getSubmissionsPerWindow()) {
                wait = max(wait, Duration.between(now, client.submissions.peekFirst().plus(limits.getSubmissionWindow())));
            }
            if (client.jobs.size() >= limits.getJobsPerWindow()) {
                wait = max(wait, Duration.between(now, client.jobs.peekFirst().plus(limits.getJobWindow())));
            }
            if (client.submissions.size() >= limits.getSubmissionsPerWindow()
                    || client.jobs.size() >= limits.getJobsPerWindow()) {
                denied[0] = wait;
                return client.isEmpty() ? null : client;
            }

            client.submissions.addLast(now);
            client.jobs.addLast(now);
            return client;
        });

        if (denied[0] != null) {
            Duration retryAfter = roundUp(denied[0]);
            log.warn("Rate limit exceeded for client {}, retry in {}s", clientId, retryAfter.toSeconds());
            throw new AdmissionException(AdmissionErrorKind.RATE_LIMITED,
                    "Too many requests. Please try again later.", retryAfter);
        }
        return new Reservation(clientId, now);
    }

    /**
     * Count one metadata lookup against the client's lookup window.
     *
     * @throws AdmissionException with {@link AdmissionErrorKind#RATE_LIMITED} when the window is full
     */
    public void acquireLookup(@NonNull String clientId) {
        Instant now = clock.instant();
        Duration[] denied = new Duration[1];

        windows.compute(clientId, (id, existing) -> {
            ClientWindows client = existing != null ? existing : new ClientWindows();
            client.prune(now, limits);

            if (client.lookups.size() >= limits.getLookupsPerWindow()) {
                denied[0] = Duration.between(now, client.lookups.peekFirst().plus(limits.getLookupWindow()));
                return client.isEmpty() ? null : client;
            }
            client.lookups.addLast(now);
            return client;
        });

        if (denied[0] != null) {
            Duration retryAfter = roundUp(denied[0]);
            log.warn("Metadata lookup limit exceeded for client {}, retry in {}s", clientId, retryAfter.toSeconds());
            throw new AdmissionException(AdmissionErrorKind.RATE_LIMITED,
                    "Too many metadata requests. Please try again later.", retryAfter);
        }
    }

    /**
     * Undo a reservation whose submission was rejected after all.
     */
    public void rollback(@NonNull Reservation reservation) {
        windows.computeIfPresent(reservation.getClientId(), (id, client) -> {
            client.submissions.removeLastOccurrence(reservation.getAt());
            client.jobs.removeLastOccurrence(reservation.getAt());
            return client.isEmpty() ? null : client;
        });
    }

    /**
     * Forget clients whose windows have fully drained.
     *
     * @return Number of clients forgotten
     */
    public int evictIdle() {
        Instant now = clock.instant();
        int before = windows.size();
        for (String clientId : windows.keySet()) {
            windows.computeIfPresent(clientId, (id, client) -> {
                client.prune(now, limits);
                return client.isEmpty() ? null : client;
            });
        }
        return Math.max(0, before - windows.size());
    }

    public int getTrackedClientCount() {
        return windows.size();
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    // Retry-After is sent in whole seconds; never advertise zero
    private static Duration roundUp(Duration wait) {
        long seconds = wait.getSeconds() + (wait.getNano() > 0 ? 1 : 0);
        return Duration.ofSeconds(Math.max(1, seconds));
    }

    @Value
    public static class Reservation {
        String clientId;
        Instant at;
    }

    /**
     * Timestamps of accepted submissions, oldest first. Guarded by the map entry.
     */
    private static final class ClientWindows {
        private final Deque<Instant> submissions = new ArrayDeque<>();
        private final Deque<Instant> jobs = new ArrayDeque<>();
        private final Deque<Instant> lookups = new ArrayDeque<>();

        void prune(Instant now, ClipperProperties.RateLimit limits) {
            pruneOlderThan(submissions, now.minus(limits.getSubmissionWindow()));
            pruneOlderThan(jobs, now.minus(limits.getJobWindow()));
            pruneOlderThan(lookups, now.minus(limits.getLookupWindow()));
        }

        boolean isEmpty() {
            return submissions.isEmpty() && jobs.isEmpty() && lookups.isEmpty();
        }

        private static void pruneOlderThan(Deque<Instant> window, Instant cutoff) {
            while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
                window.removeFirst();
            }
        }
    }
}
