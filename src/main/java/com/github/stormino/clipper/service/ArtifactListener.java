package com.github.stormino.clipper.service;

import com.github.stormino.clipper.model.Artifact;

/**
 * Notified when an artifact leaves the store.
 */
public interface ArtifactListener {

    /**
     * The artifact was handed out by its single successful retrieval.
     */
    default void onArtifactRetrieved(Artifact artifact) {
    }

    /**
     * The artifact reached its TTL, or was expired explicitly, and its file is gone.
     */
    default void onArtifactExpired(Artifact artifact) {
    }
}
