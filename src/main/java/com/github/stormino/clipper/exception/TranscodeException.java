package com.github.stormino.clipper.exception;

import com.github.stormino.clipper.model.TranscodeFailure;

/**
 * Exception thrown when trimming or encoding the clip fails.
 */
public class TranscodeException extends ClipException {

    private final TranscodeFailure failure;
    private final String inputFile;
    private final Integer exitCode;

    public TranscodeException(String message, TranscodeFailure failure, String inputFile) {
        super(message);
        this.failure = failure;
        this.inputFile = inputFile;
        this.exitCode = null;
    }

    public TranscodeException(String message, TranscodeFailure failure, String inputFile, Integer exitCode) {
        super(message);
        this.failure = failure;
        this.inputFile = inputFile;
        this.exitCode = exitCode;
    }

    public TranscodeException(String message, Throwable cause, TranscodeFailure failure, String inputFile) {
        super(message, cause);
        this.failure = failure;
        this.inputFile = inputFile;
        this.exitCode = null;
    }

    public TranscodeFailure getFailure() {
        return failure;
    }

    public String getInputFile() {
        return inputFile;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
