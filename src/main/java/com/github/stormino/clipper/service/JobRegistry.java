package com.github.stormino.clipper.service;

import com.github.stormino.clipper.model.Job;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live job records by id. A job is removed once its artifact is retrieved or
 * expires, or once an ERROR job outlives the retention window.
 */
@Slf4j
@Component
public class JobRegistry {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    public void register(@NonNull Job job) {
        if (jobs.putIfAbsent(job.getId(), job) != null) {
            throw new IllegalStateException("Duplicate job id " + job.getId());
        }
    }

    public Optional<Job> find(@NonNull String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public boolean remove(@NonNull String jobId) {
        boolean removed = jobs.remove(jobId) != null;
        if (removed) {
            log.debug("Removed job record {}", jobId);
        }
        return removed;
    }

    public List<Job> getAllJobs() {
        return new ArrayList<>(jobs.values());
    }

    public int size() {
        return jobs.size();
    }
}
