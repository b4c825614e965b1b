package com.github.stormino.clipper.exception;

/**
 * Exception thrown when a finished clip cannot be placed in the artifact store.
 */
public class ArtifactStorageException extends ClipException {

    private final String jobId;

    public ArtifactStorageException(String message, Throwable cause, String jobId) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
