package com.github.stormino.clipper.model;

/**
 * Classification of a job that ended in {@link JobStatus#ERROR}.
 */
public enum ErrorKind {

    /**
     * Network failure or platform-side restriction while fetching the source.
     */
    FETCH_ERROR,

    /**
     * The transcoder failed on an otherwise valid input.
     */
    TRANSCODE_ERROR,

    /**
     * A stage timeout or the overall job budget was exceeded.
     */
    TIMEOUT,

    /**
     * The finished clip could not be handed to the artifact store.
     */
    STORAGE_ERROR,

    /**
     * The worker failed unexpectedly or was shut down while owning the job.
     */
    WORKER_FAILURE
}
