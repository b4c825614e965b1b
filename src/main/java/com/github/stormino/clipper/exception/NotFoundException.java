package com.github.stormino.clipper.exception;

/**
 * Exception thrown when a job or clip is unknown, already used or expired.
 */
public class NotFoundException extends ClipException {

    public NotFoundException(String message) {
        super(message);
    }
}
