package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts queued plus in-flight jobs against the configured ceiling.
 * A slot is taken at admission and released when the job reaches a terminal state.
 */
@Slf4j
@Component
public class JobCapacity {

    private final int limit;
    private final AtomicInteger used = new AtomicInteger(0);

    public JobCapacity(ClipperProperties properties) {
        this.limit = properties.getAdmission().getQueueCapacity();
    }

    /**
     * Take a slot if one is free.
     *
     * @return true if a slot was taken
     */
    public boolean tryAcquire() {
        while (true) {
            int current = used.get();
            if (current >= limit) {
                return false;
            }
            if (used.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        int remaining = used.decrementAndGet();
        if (remaining < 0) {
            // Never expected; keep the counter usable
            used.compareAndSet(remaining, 0);
            log.error("Job capacity released more often than acquired");
        }
    }

    public int getUsed() {
        return used.get();
    }

    public int getLimit() {
        return limit;
    }
}
