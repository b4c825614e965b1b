package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.ArtifactStorageException;
import com.github.stormino.clipper.exception.FetchException;
import com.github.stormino.clipper.exception.StageTimeoutException;
import com.github.stormino.clipper.exception.TranscodeException;
import com.github.stormino.clipper.model.ErrorKind;
import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.JobStatus;
import com.github.stormino.clipper.model.StreamSelector;
import com.github.stormino.clipper.service.fetch.FetchRequest;
import com.github.stormino.clipper.service.fetch.FetchedMedia;
import com.github.stormino.clipper.service.fetch.MediaFetcher;
import com.github.stormino.clipper.service.format.FormatResolver;
import com.github.stormino.clipper.service.process.ProcessRunner;
import com.github.stormino.clipper.service.state.JobStateMachine;
import com.github.stormino.clipper.service.transcode.TranscodeRequest;
import com.github.stormino.clipper.service.transcode.Transcoder;
import com.github.stormino.clipper.util.JobWorkspace;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs one job from claim to terminal state on the calling worker thread.
 * <p>
 * Fetch and transcode each get the smaller of their own limit and what is left
 * of the job budget. A watchdog fires at the job deadline, kills the job's
 * process and interrupts the worker, so a job can never hold a worker past its
 * budget. Workspace files are deleted whatever the outcome.
 */
@Slf4j
@Service
public class JobExecutor {

    static final String CLIP_FILENAME = "clip.mp4";

    // Share of job progress covered by each stage
    private static final int FETCH_PROGRESS_END = 60;
    private static final int TRANSCODE_PROGRESS_END = 95;

    private final JobStateMachine stateMachine;
    private final FormatResolver formatResolver;
    private final MediaFetcher fetcher;
    private final Transcoder transcoder;
    private final ArtifactStore artifactStore;
    private final ProcessRunner processRunner;
    private final JobCapacity capacity;
    private final JobStatusService statusService;
    private final ClipMetrics metrics;
    private final TaskScheduler watchdogScheduler;
    private final ClipperProperties.Worker settings;
    private final Path workRoot;

    public JobExecutor(JobStateMachine stateMachine, FormatResolver formatResolver, MediaFetcher fetcher,
                       Transcoder transcoder, ArtifactStore artifactStore, ProcessRunner processRunner,
                       JobCapacity capacity, JobStatusService statusService, ClipMetrics metrics,
                       @Qualifier("jobWatchdogScheduler") TaskScheduler watchdogScheduler,
                       ClipperProperties properties) {
        this.stateMachine = stateMachine;
        this.formatResolver = formatResolver;
        this.fetcher = fetcher;
        this.transcoder = transcoder;
        this.artifactStore = artifactStore;
        this.processRunner = processRunner;
        this.capacity = capacity;
        this.statusService = statusService;
        this.metrics = metrics;
        this.watchdogScheduler = watchdogScheduler;
        this.settings = properties.getWorker();
        this.workRoot = Paths.get(settings.getWorkPath());
    }

    /**
     * Execute a dequeued job on the current thread.
     * Returns once the job is DONE or ERROR; never throws for a job failure.
     */
    public void execute(@NonNull Job job) {
        if (!job.claim()) {
            log.warn("Job {} already claimed by another worker, skipping", job.getId());
            return;
        }

        long deadlineNanos = System.nanoTime() + settings.getJobTimeout().toNanos();
        Watchdog watchdog = new Watchdog(job.getId(), Thread.currentThread());
        ScheduledFuture<?> watchdogFuture = null;
        JobWorkspace workspace = null;

        try {
            moveTo(job, JobStatus.WORKING);
            metrics.recordStarted();
            log.info("Worker {} started job {}", Thread.currentThread().getName(), job.getId());

            watchdogFuture = watchdogScheduler.schedule(watchdog, Instant.now().plus(settings.getJobTimeout()));

            workspace = JobWorkspace.create(workRoot, job.getId());

            StreamSelector selector = formatResolver.resolve(job.getPlatform(), job.getQualityLabel());
            job.resolveStreamSelector(selector);
            log.debug("Job {} resolved quality {} to {}", job.getId(), job.getQualityLabel(), selector);

            FetchedMedia media = fetcher.fetch(FetchRequest.builder()
                    .jobId(job.getId())
                    .url(job.getUrl())
                    .selector(selector)
                    .targetDirectory(workspace.getDirectory())
                    .timeout(stageBudget(settings.getFetchTimeout(), deadlineNanos))
                    .progressListener(percent -> reportProgress(job, scale(percent, 0, FETCH_PROGRESS_END)))
                    .build());

            Path clip = transcoder.transcode(TranscodeRequest.builder()
                    .jobId(job.getId())
                    .inputFile(media.getFile())
                    .outputFile(workspace.resolve(CLIP_FILENAME))
                    .startSeconds(job.getStartSeconds())
                    .durationSeconds(job.getClipDurationSeconds())
                    .timeout(stageBudget(settings.getTranscodeTimeout(), deadlineNanos))
                    .progressListener(percent -> reportProgress(job,
                            scale(percent, FETCH_PROGRESS_END, TRANSCODE_PROGRESS_END)))
                    .build());

            remainingBudget(deadlineNanos);
            String handle = artifactStore.store(job.getId(), clip);
            job.recordRetrievalHandle(handle);
            job.updateProgress(100);
            moveTo(job, JobStatus.DONE);
            log.info("Job {} done", job.getId());

        } catch (InterruptedException e) {
            fail(job, watchdog.hasFired()
                    ? timeout()
                    : new Failure(ErrorKind.WORKER_FAILURE, "shutdown", "The server shut down while processing the clip."));
        } catch (IOException e) {
            log.error("Cannot create workspace for job {}: {}", job.getId(), e.getMessage(), e);
            fail(job, new Failure(ErrorKind.WORKER_FAILURE, "workspace", "Failed to process video due to an internal error."));
        } catch (RuntimeException e) {
            fail(job, watchdog.hasFired() ? timeout() : classify(job, e));
        } finally {
            watchdog.disarm();
            if (watchdogFuture != null) {
                watchdogFuture.cancel(false);
            }
            // A watchdog that fired after the last blocking call leaves the flag set
            Thread.interrupted();

            if (workspace != null) {
                workspace.close();
            }
            if (!job.isTerminal()) {
                fail(job, new Failure(ErrorKind.WORKER_FAILURE, "crashed", "Failed to process video due to an internal error."));
            }
            capacity.release();
            metrics.recordFinished(job);
        }
    }

    /**
     * Fail a job that was dequeued but will never run, e.g. on shutdown.
     *
     * @return true if the job was failed by this call
     */
    public boolean abandon(@NonNull Job job, @NonNull String reason) {
        if (!job.claim()) {
            return false;
        }
        try {
            fail(job, new Failure(ErrorKind.WORKER_FAILURE, reason, "The server shut down before processing the clip."));
        } finally {
            capacity.release();
            metrics.recordFinished(job);
        }
        return true;
    }

    private Failure classify(Job job, RuntimeException e) {
        if (e instanceof StageTimeoutException) {
            StageTimeoutException timeout = (StageTimeoutException) e;
            log.warn("Job {} timed out in {}: {}", job.getId(), timeout.getStage(), e.getMessage());
            return new Failure(ErrorKind.TIMEOUT, timeout.getStage(),
                    "Processing took too long. Try a shorter clip or lower quality.");
        }
        if (e instanceof FetchException) {
            FetchException fetch = (FetchException) e;
            String reason = fetch.getFailure().name().toLowerCase(Locale.ROOT);
            if (fetch.getFailure().isPlatformSide()) {
                log.warn("[platform] Fetch failed for job {} ({}): {}", job.getId(), reason, e.getMessage());
            } else {
                log.error("Fetch failed for job {} ({}): {}", job.getId(), reason, e.getMessage(), e);
            }
            return new Failure(ErrorKind.FETCH_ERROR, reason, e.getMessage());
        }
        if (e instanceof TranscodeException) {
            TranscodeException transcode = (TranscodeException) e;
            log.error("Transcode failed for job {} ({}): {}", job.getId(), transcode.getFailure(), e.getMessage());
            return new Failure(ErrorKind.TRANSCODE_ERROR, transcode.getFailure().name().toLowerCase(Locale.ROOT),
                    e.getMessage());
        }
        if (e instanceof ArtifactStorageException) {
            return new Failure(ErrorKind.STORAGE_ERROR, "store", "Failed to save the clip. Please try again.");
        }
        log.error("Unexpected failure in job {}: {}", job.getId(), e.getMessage(), e);
        return new Failure(ErrorKind.WORKER_FAILURE, "unexpected", "Failed to process video due to an internal error.");
    }

    private Failure timeout() {
        return new Failure(ErrorKind.TIMEOUT, "job", "Processing took too long. Try a shorter clip or lower quality.");
    }

    private void fail(Job job, Failure failure) {
        if (job.isTerminal()) {
            return;
        }
        job.recordFailure(failure.getKind(), failure.getReason(), failure.getMessage());
        moveTo(job, JobStatus.ERROR);
        log.info("Job {} failed: {} ({})", job.getId(), failure.getKind(), failure.getReason());
    }

    private void moveTo(Job job, JobStatus status) {
        stateMachine.transition(job, status);
        statusService.publish(job);
    }

    private void reportProgress(Job job, int percent) {
        Integer before = job.getProgress();
        job.updateProgress(percent);
        if (!Objects.equals(before, job.getProgress())) {
            statusService.publish(job);
        }
    }

    /**
     * Time a stage may take: its own limit capped by what is left of the job budget.
     *
     * @throws StageTimeoutException if the job budget is already spent
     */
    private Duration stageBudget(Duration stageTimeout, long deadlineNanos) {
        Duration left = remainingBudget(deadlineNanos);
        return left.compareTo(stageTimeout) < 0 ? left : stageTimeout;
    }

    private Duration remainingBudget(long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new StageTimeoutException("job", settings.getJobTimeout());
        }
        return Duration.ofNanos(remaining);
    }

    private static int scale(int percent, int from, int to) {
        int clamped = Math.max(0, Math.min(100, percent));
        return from + (to - from) * clamped / 100;
    }

    @Value
    private static class Failure {
        ErrorKind kind;
        String reason;
        String message;
    }

    /**
     * Fires once at the job deadline unless disarmed first.
     */
    private final class Watchdog implements Runnable {
        private final String jobId;
        private final Thread worker;
        private boolean armed = true;
        private volatile boolean fired = false;

        Watchdog(String jobId, Thread worker) {
            this.jobId = jobId;
            this.worker = worker;
        }

        @Override
        public synchronized void run() {
            if (!armed) {
                return;
            }
            fired = true;
            log.warn("Job {} exceeded its {}s budget, stopping it", jobId, settings.getJobTimeout().toSeconds());
            worker.interrupt();
            processRunner.cancel(jobId);
        }

        synchronized void disarm() {
            armed = false;
        }

        boolean hasFired() {
            return fired;
        }
    }
}
