package com.github.stormino.clipper.model;

import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Content handed out by the single successful retrieval of an artifact.
 * The caller owns the file; closing deletes it.
 */
@Slf4j
@Getter
@ToString(exclude = "onClose")
public class RetrievedArtifact implements Closeable {
    private final String jobId;
    private final String filename;
    private final String contentType;
    private final long sizeBytes;
    private final Path file;
    private final Consumer<Path> onClose;

    public RetrievedArtifact(String jobId, String filename, String contentType, long sizeBytes, Path file) {
        this(jobId, filename, contentType, sizeBytes, file, path -> { });
    }

    public RetrievedArtifact(String jobId, String filename, String contentType, long sizeBytes, Path file,
                             Consumer<Path> onClose) {
        this.jobId = jobId;
        this.filename = filename;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.file = file;
        this.onClose = onClose;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete retrieved clip {}: {}", file, e.getMessage());
        } finally {
            onClose.accept(file);
        }
    }
}
