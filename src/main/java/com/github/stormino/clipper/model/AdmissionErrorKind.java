package com.github.stormino.clipper.model;

/**
 * Reasons a submission is refused before a job exists.
 */
public enum AdmissionErrorKind {
    INVALID_TIME_RANGE(true),
    DURATION_EXCEEDED(true),
    UNSUPPORTED_PLATFORM(true),
    RIGHTS_NOT_CONFIRMED(true),
    RATE_LIMITED(false),
    QUEUE_FULL(false);

    private final boolean validation;

    AdmissionErrorKind(boolean validation) {
        this.validation = validation;
    }

    /**
     * Validation rejections are final for the given input; the others clear with time.
     */
    public boolean isValidation() {
        return validation;
    }
}
