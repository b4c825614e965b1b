package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.JobStatus;
import com.github.stormino.clipper.util.JobWorkspace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Periodic cleanup: overdue clips, stale ERROR jobs, leftover files and idle
 * rate-limit entries.
 */
@Slf4j
@Service
public class RetentionSweeper {

    private final ArtifactStore artifactStore;
    private final JobRegistry registry;
    private final ClientRateLimiter rateLimiter;
    private final Clock clock;
    private final Duration retention;
    private final Duration orphanAge;
    private final Path workRoot;

    public RetentionSweeper(ArtifactStore artifactStore, JobRegistry registry, ClientRateLimiter rateLimiter,
                            ClipperProperties properties, Clock clock) {
        this.artifactStore = artifactStore;
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.retention = properties.getArtifacts().getTtl();
        // Nothing legitimately stays in a workspace longer than one job
        this.orphanAge = properties.getWorker().getJobTimeout();
        this.workRoot = Paths.get(properties.getWorker().getWorkPath());
    }

    @Scheduled(fixedDelayString = "${clipper.artifacts.sweep-interval-ms:30000}",
            initialDelayString = "${clipper.artifacts.sweep-interval-ms:30000}")
    public void sweep() {
        int expiredArtifacts = artifactStore.expireOverdue();
        int expiredJobs = expireErrorJobs();
        int orphans = deleteOrphans();
        int idleClients = rateLimiter.evictIdle();

        if (expiredArtifacts + expiredJobs + orphans > 0) {
            log.info("Retention sweep: {} clips expired, {} failed jobs dropped, {} orphaned files deleted",
                    expiredArtifacts, expiredJobs, orphans);
        }
        log.debug("Forgot {} idle clients", idleClients);
    }

    /**
     * Drop ERROR jobs whose retention window has passed.
     */
    int expireErrorJobs() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (Job job : registry.getAllJobs()) {
            if (job.getStatus() == JobStatus.ERROR
                    && job.getCompletedAt() != null
                    && job.getCompletedAt().isBefore(cutoff)
                    && registry.remove(job.getId())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Delete workspaces and clip files no live job or artifact owns.
     */
    int deleteOrphans() {
        Instant cutoff = clock.instant().minus(orphanAge);

        Set<String> activeJobs = registry.getAllJobs().stream()
                .filter(job -> !job.isTerminal())
                .map(Job::getId)
                .collect(Collectors.toSet());
        Set<Path> liveClips = artifactStore.liveFiles();
        Set<Path> handedOut = artifactStore.handedOutFiles();

        int deleted = 0;
        for (Path workspace : list(workRoot)) {
            if (Files.isDirectory(workspace)
                    && !activeJobs.contains(workspace.getFileName().toString())
                    && olderThan(workspace, cutoff)
                    && JobWorkspace.deleteRecursively(workspace)) {
                deleted++;
            }
        }
        for (Path clip : list(artifactStore.getStorageDirectory())) {
            if (Files.isRegularFile(clip) && !liveClips.contains(clip) && olderThan(clip, cutoff) && delete(clip)) {
                deleted++;
            }
        }
        // Handed-out clips are deleted once streamed. Unclosed ones get the full retention window.
        Instant streamingCutoff = clock.instant().minus(retention);
        for (Path clip : list(artifactStore.getHandoffDirectory())) {
            Instant clipCutoff = handedOut.contains(clip) ? streamingCutoff : cutoff;
            if (Files.isRegularFile(clip) && olderThan(clip, clipCutoff) && delete(clip)) {
                deleted++;
            }
        }
        return deleted;
    }

    private static List<Path> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private static boolean olderThan(Path path, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", path, e.getMessage());
            return false;
        }
    }

    private static boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete orphaned file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
