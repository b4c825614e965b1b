package com.github.stormino.clipper.exception;

import com.github.stormino.clipper.model.AdmissionErrorKind;

import java.time.Duration;

/**
 * Exception thrown when a submission is rejected at admission.
 * No job exists for a rejected submission.
 */
public class AdmissionException extends ClipException {

    private final AdmissionErrorKind kind;
    private final Duration retryAfter;

    public AdmissionException(AdmissionErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.retryAfter = null;
    }

    public AdmissionException(AdmissionErrorKind kind, String message, Duration retryAfter) {
        super(message);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public AdmissionErrorKind getKind() {
        return kind;
    }

    /**
     * @return Suggested wait before resubmitting, or null when waiting will not help
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
