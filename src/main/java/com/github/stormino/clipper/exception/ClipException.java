package com.github.stormino.clipper.exception;

/**
 * Base exception for all clip pipeline errors.
 */
public class ClipException extends RuntimeException {

    public ClipException(String message) {
        super(message);
    }

    public ClipException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClipException(Throwable cause) {
        super(cause);
    }
}
