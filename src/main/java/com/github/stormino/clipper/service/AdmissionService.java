package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.AdmissionException;
import com.github.stormino.clipper.model.AdmissionErrorKind;
import com.github.stormino.clipper.model.ClipRequest;
import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.Platform;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a submission becomes a job.
 * <p>
 * Checks run in a fixed order and the first failure wins. A rejected
 * submission leaves no trace: no job, no queue entry, no rate-limit entry and
 * no capacity slot.
 */
@Slf4j
@Service
public class AdmissionService {

    private final ClipperProperties.Admission admission;
    private final ClientRateLimiter rateLimiter;
    private final JobCapacity capacity;
    private final JobRegistry registry;
    private final JobQueue queue;
    private final ClipMetrics metrics;
    private final Clock clock;

    public AdmissionService(ClipperProperties properties, ClientRateLimiter rateLimiter, JobCapacity capacity,
                            JobRegistry registry, JobQueue queue, ClipMetrics metrics, Clock clock) {
        this.admission = properties.getAdmission();
        this.rateLimiter = rateLimiter;
        this.capacity = capacity;
        this.registry = registry;
        this.queue = queue;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Admit a submission.
     *
     * @param request Submission
     * @param clientId Identity the rate limits apply to
     * @return The new QUEUED job, already enqueued
     * @throws AdmissionException if any check fails
     */
    public Job admit(@NonNull ClipRequest request, @NonNull String clientId) {
        try {
            return doAdmit(request, clientId);
        } catch (AdmissionException e) {
            metrics.recordRejected(e.getKind());
            log.info("Rejected submission from {}: {} ({})", clientId, e.getKind(), e.getMessage());
            throw e;
        }
    }

    private Job doAdmit(ClipRequest request, String clientId) {
        double start = request.getStart() != null ? request.getStart() : Double.NaN;
        double end = request.getEnd() != null ? request.getEnd() : Double.NaN;

        // NaN fails both comparisons
        if (!(start >= 0) || !(end > start) || Double.isInfinite(end)) {
            throw new AdmissionException(AdmissionErrorKind.INVALID_TIME_RANGE,
                    "Start must be zero or greater and end must be after start.");
        }

        if (end - start > admission.getMaxClipDurationSeconds()) {
            throw new AdmissionException(AdmissionErrorKind.DURATION_EXCEEDED,
                    String.format("Clip duration cannot exceed %d seconds.", admission.getMaxClipDurationSeconds()));
        }

        Platform platform = resolvePlatform(request.getUrl());

        if (!request.isRightsConfirmed()) {
            throw new AdmissionException(AdmissionErrorKind.RIGHTS_NOT_CONFIRMED,
                    "You must confirm you have the rights to download and use this content.");
        }

        ClientRateLimiter.Reservation reservation = rateLimiter.reserve(clientId);

        if (!capacity.tryAcquire()) {
            rateLimiter.rollback(reservation);
            throw new AdmissionException(AdmissionErrorKind.QUEUE_FULL,
                    "Server is busy. Please try again in a few minutes.", admission.getQueueFullRetryAfter());
        }

        Job job;
        try {
            job = Job.builder()
                    .url(request.getUrl().trim())
                    .platform(platform)
                    .startSeconds(start)
                    .endSeconds(end)
                    .qualityLabel(request.getQualityLabel())
                    .rightsConfirmed(true)
                    .clientId(clientId)
                    .submittedAt(clock.instant())
                    .build();
            registry.register(job);
        } catch (RuntimeException e) {
            capacity.release();
            rateLimiter.rollback(reservation);
            throw e;
        }

        try {
            queue.enqueue(job);
        } catch (RuntimeException e) {
            registry.remove(job.getId());
            capacity.release();
            rateLimiter.rollback(reservation);
            throw e;
        }

        metrics.recordAdmitted();
        log.info("Admitted job {} for client {}: {} [{}s - {}s] quality={}", job.getId(), clientId,
                platform.getDisplayName(), start, end, request.getQualityLabel());
        return job;
    }

    private Platform resolvePlatform(String url) {
        Optional<Platform> platform = Platform.fromUrl(url);
        Set<Platform> supported = admission.getSupportedPlatforms();
        if (platform.isEmpty() || !supported.contains(platform.get())) {
            throw new AdmissionException(AdmissionErrorKind.UNSUPPORTED_PLATFORM,
                    "URL must be from a supported platform.");
        }
        return platform.get();
    }

}
