package com.github.stormino.clipper.service;

import com.github.stormino.clipper.model.AdmissionErrorKind;
import com.github.stormino.clipper.model.Artifact;
import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the clip pipeline, exposed in Prometheus format.
 */
@Slf4j
@Component
public class ClipMetrics implements ArtifactListener {

    static final String ADMITTED = "clip_jobs_admitted_total";
    static final String INFLIGHT = "clip_jobs_inflight";
    static final String QUEUE_DEPTH = "clip_queue_depth";
    static final String LATENCY = "clip_job_latency";
    static final String FAILED = "clip_job_fail_total";
    static final String REJECTED = "clip_admission_rejected_total";
    static final String ERROR_RATIO = "clip_job_error_ratio";
    static final String ARTIFACTS_STORED = "clip_artifacts_stored";
    static final String ARTIFACTS_EXPIRED = "clip_artifacts_expired_total";

    private static final Duration[] LATENCY_BUCKETS = {
            Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofMillis(2500), Duration.ofSeconds(5),
            Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(120),
            Duration.ofSeconds(300)
    };

    private final MeterRegistry registry;

    private final AtomicInteger inflight = new AtomicInteger(0);
    private final AtomicLong terminalJobs = new AtomicLong(0);
    private final AtomicLong erroredJobs = new AtomicLong(0);

    private final Counter admitted;
    private final Counter artifactsExpired;

    public ClipMetrics(MeterRegistry registry, JobQueue queue, ArtifactStore artifactStore) {
        this.registry = registry;

        this.admitted = Counter.builder(ADMITTED)
                .description("Jobs accepted at admission")
                .register(registry);
        this.artifactsExpired = Counter.builder(ARTIFACTS_EXPIRED)
                .description("Clips deleted unretrieved after their TTL")
                .register(registry);

        Gauge.builder(INFLIGHT, inflight, AtomicInteger::get)
                .description("Jobs currently owned by a worker")
                .register(registry);
        Gauge.builder(QUEUE_DEPTH, queue, JobQueue::depth)
                .description("Jobs waiting for a worker")
                .register(registry);
        Gauge.builder(ARTIFACTS_STORED, artifactStore, ArtifactStore::size)
                .description("Clips awaiting retrieval")
                .register(registry);
        Gauge.builder(ERROR_RATIO, this, ClipMetrics::getErrorRatio)
                .description("Share of finished jobs that ended in error")
                .register(registry);

        artifactStore.addListener(this);
    }

    public void recordAdmitted() {
        admitted.increment();
    }

    public void recordRejected(AdmissionErrorKind kind) {
        Counter.builder(REJECTED)
                .tag("reason", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordStarted() {
        inflight.incrementAndGet();
    }

    /**
     * Record a job that just reached DONE or ERROR.
     */
    public void recordFinished(Job job) {
        JobStatus status = job.getStatus();
        if (job.getStartedAt() != null) {
            inflight.decrementAndGet();
        }

        if (job.getCompletedAt() != null) {
            Timer.builder(LATENCY)
                    .description("Submission to terminal state")
                    .tag("status", status.getWireName())
                    .serviceLevelObjectives(LATENCY_BUCKETS)
                    .register(registry)
                    .record(Duration.between(job.getSubmittedAt(), job.getCompletedAt()));
        }

        terminalJobs.incrementAndGet();
        if (status == JobStatus.ERROR) {
            erroredJobs.incrementAndGet();
            String reason = job.getErrorKind() != null
                    ? job.getErrorKind().name().toLowerCase(Locale.ROOT)
                    : "unknown";
            Counter.builder(FAILED)
                    .tag("reason", reason)
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void onArtifactExpired(Artifact artifact) {
        artifactsExpired.increment();
    }

    public int getInflight() {
        return inflight.get();
    }

    public double getErrorRatio() {
        long terminal = terminalJobs.get();
        return terminal == 0 ? 0.0 : (double) erroredJobs.get() / terminal;
    }
}
