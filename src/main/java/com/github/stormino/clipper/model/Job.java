package com.github.stormino.clipper.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A clip extraction job.
 * <p>
 * Inputs are fixed at admission. Execution state is written only by the thread
 * that claimed the job; every other thread only reads it. Fields read across
 * threads are volatile, so status readers may lag a transition but never see a
 * torn one.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class Job {

    @ToString.Include
    private final String id;
    private final String url;
    @ToString.Include
    private final Platform platform;
    private final double startSeconds;
    private final double endSeconds;
    private final String qualityLabel;
    private final boolean rightsConfirmed;
    private final String clientId;
    private final Instant submittedAt;

    private volatile StreamSelector streamSelector;

    @ToString.Include
    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile Integer progress;

    private volatile ErrorKind errorKind;
    private volatile String errorReason;
    private volatile String errorMessage;

    private volatile String retrievalHandle;

    private volatile Instant startedAt;
    private volatile Instant completedAt;

    @Getter(AccessLevel.NONE)
    private final List<StatusTransition> transitions = new CopyOnWriteArrayList<>();

    @Getter(AccessLevel.NONE)
    private final AtomicReference<Thread> owner = new AtomicReference<>();

    @Builder
    private Job(String id, @NonNull String url, @NonNull Platform platform,
                double startSeconds, double endSeconds, String qualityLabel,
                boolean rightsConfirmed, @NonNull String clientId, Instant submittedAt) {
        this.id = id != null ? id : UUID.randomUUID().toString().replace("-", "");
        this.url = url;
        this.platform = platform;
        this.startSeconds = startSeconds;
        this.endSeconds = endSeconds;
        this.qualityLabel = qualityLabel;
        this.rightsConfirmed = rightsConfirmed;
        this.clientId = clientId;
        this.submittedAt = submittedAt != null ? submittedAt : Instant.now();
        this.transitions.add(new StatusTransition(null, JobStatus.QUEUED, this.submittedAt));
    }

    public double getClipDurationSeconds() {
        return endSeconds - startSeconds;
    }

    public boolean isTerminal() {
        return status == JobStatus.DONE || status == JobStatus.ERROR;
    }

    public List<StatusTransition> getTransitions() {
        return List.copyOf(transitions);
    }

    /**
     * Take exclusive ownership of this job for the calling thread.
     *
     * @return true if the caller now owns the job, false if it was already claimed
     */
    public boolean claim() {
        return owner.compareAndSet(null, Thread.currentThread());
    }

    public boolean isOwnedByCurrentThread() {
        return owner.get() == Thread.currentThread();
    }

    // Mutators below are reserved for the owning worker.

    public void resolveStreamSelector(@NonNull StreamSelector selector) {
        assertOwner();
        if (streamSelector != null) {
            throw new IllegalStateException("Stream selector already resolved for job " + id);
        }
        this.streamSelector = selector;
    }

    public void updateProgress(int percent) {
        assertOwner();
        int clamped = Math.max(0, Math.min(100, percent));
        Integer current = progress;
        if (current == null || clamped > current) {
            progress = clamped;
        }
    }

    public void recordTransition(@NonNull JobStatus target, @NonNull Instant at) {
        assertOwner();
        JobStatus previous = status;
        if (target == JobStatus.WORKING) {
            startedAt = at;
        } else if (target == JobStatus.DONE || target == JobStatus.ERROR) {
            completedAt = at;
        }
        transitions.add(new StatusTransition(previous, target, at));
        status = target;
    }

    public void recordFailure(@NonNull ErrorKind kind, String reason, String message) {
        assertOwner();
        this.errorKind = kind;
        this.errorReason = reason;
        this.errorMessage = message;
    }

    public void recordRetrievalHandle(@NonNull String handle) {
        assertOwner();
        this.retrievalHandle = handle;
    }

    private void assertOwner() {
        if (owner.get() != Thread.currentThread()) {
            throw new IllegalStateException("Job " + id + " can only be modified by its owning worker");
        }
    }
}
