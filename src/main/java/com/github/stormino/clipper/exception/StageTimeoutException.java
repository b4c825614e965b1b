package com.github.stormino.clipper.exception;

import java.time.Duration;

/**
 * Exception thrown when an external process exceeds its time budget and was killed.
 */
public class StageTimeoutException extends ClipException {

    private final String stage;
    private final Duration timeout;

    public StageTimeoutException(String stage, Duration timeout) {
        super(String.format("%s exceeded its %ds time limit", stage, timeout.toSeconds()));
        this.stage = stage;
        this.timeout = timeout;
    }

    public String getStage() {
        return stage;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
