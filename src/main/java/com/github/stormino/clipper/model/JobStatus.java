package com.github.stormino.clipper.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    QUEUED("Queued"),
    WORKING("Working"),
    DONE("Done"),
    ERROR("Error");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
