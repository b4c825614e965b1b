package com.github.stormino.clipper.service;

import com.github.stormino.clipper.model.Job;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * FIFO of admitted jobs awaiting a worker.
 * Each entry is handed to exactly one consumer and never redelivered.
 * Bounding is done at admission, so the queue itself is unbounded.
 */
@Slf4j
@Component
public class JobQueue {

    private final BlockingQueue<Job> queue = new LinkedBlockingQueue<>();

    public void enqueue(@NonNull Job job) {
        queue.add(job);
        log.debug("Enqueued job {} (depth {})", job.getId(), queue.size());
    }

    /**
     * Block until a job is available.
     */
    public Job dequeue() throws InterruptedException {
        return queue.take();
    }

    public Optional<Job> poll(@NonNull Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int depth() {
        return queue.size();
    }

    /**
     * Remove every waiting job, oldest first.
     */
    public List<Job> drain() {
        List<Job> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }
}
