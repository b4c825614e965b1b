package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.model.Job;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers pulling jobs off the queue.
 * Each worker runs one job at a time for the job's whole lifetime and goes
 * straight back to the queue afterwards.
 */
@Slf4j
@Service
public class WorkerPool {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final JobQueue queue;
    private final JobExecutor executor;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final int poolSize;

    private final AtomicInteger busyWorkers = new AtomicInteger(0);
    private volatile boolean running = false;

    public WorkerPool(JobQueue queue, JobExecutor executor,
                      @Qualifier("workerExecutor") ThreadPoolTaskExecutor workerExecutor,
                      ClipperProperties properties) {
        this.queue = queue;
        this.executor = executor;
        this.workerExecutor = workerExecutor;
        this.poolSize = properties.getWorker().getPoolSize();
    }

    @PostConstruct
    public void start() {
        running = true;
        for (int i = 0; i < poolSize; i++) {
            workerExecutor.execute(this::workerLoop);
        }
        log.info("Started {} clip workers", poolSize);
    }

    @PreDestroy
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping clip workers");

        // Interrupts workers; running jobs end in ERROR and their processes are killed
        workerExecutor.shutdown();

        List<Job> abandoned = queue.drain();
        for (Job job : abandoned) {
            executor.abandon(job, "shutdown");
        }
        if (!abandoned.isEmpty()) {
            log.warn("Failed {} queued jobs on shutdown", abandoned.size());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getBusyWorkers() {
        return busyWorkers.get();
    }

    void workerLoop() {
        log.debug("Worker {} ready", Thread.currentThread().getName());
        while (running) {
            Optional<Job> next;
            try {
                next = queue.poll(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next.isEmpty()) {
                continue;
            }

            Job job = next.get();
            if (!running) {
                executor.abandon(job, "shutdown");
                break;
            }

            busyWorkers.incrementAndGet();
            try {
                executor.execute(job);
            } catch (RuntimeException e) {
                // execute() settles the job itself; keep the worker alive regardless
                log.error("Worker {} failed on job {}: {}", Thread.currentThread().getName(), job.getId(),
                        e.getMessage(), e);
            } finally {
                busyWorkers.decrementAndGet();
            }
        }
        log.debug("Worker {} stopped", Thread.currentThread().getName());
    }
}
