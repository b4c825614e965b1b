package com.github.stormino.clipper.exception;

import com.github.stormino.clipper.model.FetchFailure;

/**
 * Exception thrown when the source media cannot be fetched.
 */
public class FetchException extends ClipException {

    private final FetchFailure failure;
    private final String url;
    private final Integer exitCode;

    public FetchException(String message, FetchFailure failure, String url) {
        super(message);
        this.failure = failure;
        this.url = url;
        this.exitCode = null;
    }

    public FetchException(String message, FetchFailure failure, String url, Integer exitCode) {
        super(message);
        this.failure = failure;
        this.url = url;
        this.exitCode = exitCode;
    }

    public FetchException(String message, Throwable cause, FetchFailure failure, String url) {
        super(message, cause);
        this.failure = failure;
        this.url = url;
        this.exitCode = null;
    }

    public FetchFailure getFailure() {
        return failure;
    }

    public String getUrl() {
        return url;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
