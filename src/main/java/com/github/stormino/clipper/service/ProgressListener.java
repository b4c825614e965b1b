package com.github.stormino.clipper.service;

/**
 * Receives best-effort stage progress on the thread that owns the job.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> { };

    /**
     * @param percent Stage progress, 0-100
     */
    void onProgress(int percent);
}
