package com.github.stormino.clipper.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A finished clip held by the artifact store.
 */
@Value
@Builder
public class Artifact {

    String handle;
    String jobId;
    Path file;
    long sizeBytes;
    String contentType;
    String filename;
    Instant createdAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
