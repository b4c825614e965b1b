package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.ArtifactStorageException;
import com.github.stormino.clipper.model.Artifact;
import com.github.stormino.clipper.model.RetrievedArtifact;
import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Holds finished clips until their single retrieval or their TTL, whichever comes first.
 * <p>
 * A handle is removed from the index atomically before its file is touched, so
 * two concurrent retrievals of one handle can never both succeed and a retrieval
 * racing expiry either gets the clip or nothing.
 */
@Slf4j
@Service
public class ArtifactStore {

    static final String CONTENT_TYPE = "video/mp4";
    private static final int HANDLE_BYTES = 32;

    private final Path storageDirectory;
    private final Path handoffDirectory;
    private final Duration ttl;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();
    private final ConcurrentHashMap<String, Artifact> artifacts = new ConcurrentHashMap<>();
    private final Set<Path> handedOut = ConcurrentHashMap.newKeySet();
    private final List<ArtifactListener> listeners = new CopyOnWriteArrayList<>();

    public ArtifactStore(ClipperProperties properties, Clock clock) {
        this.storageDirectory = Paths.get(properties.getArtifacts().getStoragePath());
        this.handoffDirectory = storageDirectory.resolve("retrieved");
        this.ttl = properties.getArtifacts().getTtl();
        this.clock = clock;
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(storageDirectory);
        Files.createDirectories(handoffDirectory);
        log.info("Artifact store at {} (TTL {}s)", storageDirectory, ttl.toSeconds());
    }

    public void addListener(@NonNull ArtifactListener listener) {
        listeners.add(listener);
    }

    /**
     * Take ownership of a finished clip.
     *
     * @param jobId Job the clip belongs to
     * @param clip File to move into the store
     * @return Retrieval handle, an unguessable URL-safe token
     * @throws ArtifactStorageException if the file cannot be moved into the store
     */
    public String store(@NonNull String jobId, @NonNull Path clip) {
        String handle = newHandle();
        Path target = storageDirectory.resolve(jobId + ".mp4");
        try {
            Files.move(clip, target, StandardCopyOption.REPLACE_EXISTING);
            long size = Files.size(target);

            Instant now = clock.instant();
            Artifact artifact = Artifact.builder()
                    .handle(handle)
                    .jobId(jobId)
                    .file(target)
                    .sizeBytes(size)
                    .contentType(CONTENT_TYPE)
                    .filename("clip-" + jobId + ".mp4")
                    .createdAt(now)
                    .expiresAt(now.plus(ttl))
                    .build();
            artifacts.put(handle, artifact);

            log.info("Stored clip for job {} ({} bytes, expires {})", jobId, size, artifact.getExpiresAt());
            return handle;
        } catch (IOException e) {
            deleteQuietly(target);
            log.error("Failed to store clip for job {}: {}", jobId, e.getMessage(), e);
            throw new ArtifactStorageException("Failed to store clip: " + e.getMessage(), e, jobId);
        }
    }

    /**
     * Hand out a clip. Succeeds at most once per handle.
     *
     * @param handle Retrieval handle
     * @return The clip, owned by the caller, or empty if the handle is unknown, used or expired
     * @throws ArtifactStorageException if the clip exists but cannot be handed out
     */
    public Optional<RetrievedArtifact> retrieve(@NonNull String handle) {
        Artifact artifact = artifacts.remove(handle);
        if (artifact == null) {
            return Optional.empty();
        }

        if (artifact.isExpired(clock.instant())) {
            discard(artifact);
            return Optional.empty();
        }

        // Handed-out files stay off the sweeper's list until the caller closes them.
        // The move keeps the clip's mtime, so the handoff age restarts here.
        Path handoff = handoffDirectory.resolve(handle + ".mp4");
        handedOut.add(handoff);
        try {
            Files.move(artifact.getFile(), handoff, StandardCopyOption.REPLACE_EXISTING);
            Files.setLastModifiedTime(handoff, FileTime.from(clock.instant()));
        } catch (IOException e) {
            handedOut.remove(handoff);
            deleteQuietly(handoff);
            discard(artifact);
            throw new ArtifactStorageException("Failed to read clip: " + e.getMessage(), e, artifact.getJobId());
        }

        log.info("Clip for job {} retrieved", artifact.getJobId());
        notifyListeners(artifact, true);
        return Optional.of(new RetrievedArtifact(artifact.getJobId(), artifact.getFilename(),
                artifact.getContentType(), artifact.getSizeBytes(), handoff, handedOut::remove));
    }

    /**
     * Invalidate a handle now and delete its file.
     *
     * @return true if the handle was live
     */
    public boolean expire(@NonNull String handle) {
        Artifact artifact = artifacts.remove(handle);
        if (artifact == null) {
            return false;
        }
        discard(artifact);
        return true;
    }

    /**
     * Expire every artifact whose TTL has passed.
     *
     * @return Number of artifacts expired
     */
    public int expireOverdue() {
        Instant now = clock.instant();
        int expired = 0;
        for (Artifact artifact : new ArrayList<>(artifacts.values())) {
            if (artifact.isExpired(now) && artifacts.remove(artifact.getHandle(), artifact)) {
                discard(artifact);
                expired++;
            }
        }
        return expired;
    }

    public Optional<Artifact> find(@NonNull String handle) {
        return Optional.ofNullable(artifacts.get(handle));
    }

    public Set<Path> liveFiles() {
        return artifacts.values().stream()
                .map(Artifact::getFile)
                .collect(Collectors.toSet());
    }

    /**
     * Files retrieved but not yet closed by their caller.
     */
    public Set<Path> handedOutFiles() {
        return Set.copyOf(handedOut);
    }

    public int size() {
        return artifacts.size();
    }

    public Path getStorageDirectory() {
        return storageDirectory;
    }

    public Path getHandoffDirectory() {
        return handoffDirectory;
    }

    private void discard(Artifact artifact) {
        deleteQuietly(artifact.getFile());
        log.info("Clip for job {} expired", artifact.getJobId());
        notifyListeners(artifact, false);
    }

    private void notifyListeners(Artifact artifact, boolean retrieved) {
        for (ArtifactListener listener : listeners) {
            try {
                if (retrieved) {
                    listener.onArtifactRetrieved(artifact);
                } else {
                    listener.onArtifactExpired(artifact);
                }
            } catch (RuntimeException e) {
                log.error("Artifact listener failed for job {}: {}", artifact.getJobId(), e.getMessage(), e);
            }
        }
    }

    private String newHandle() {
        byte[] bytes = new byte[HANDLE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete clip file {}: {}", file, e.getMessage());
        }
    }
}
