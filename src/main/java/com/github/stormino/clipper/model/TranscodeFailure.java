package com.github.stormino.clipper.model;

public enum TranscodeFailure {
    CORRUPT_INPUT,
    UNSUPPORTED_CODEC,
    RESOURCE_EXHAUSTION,
    TOOL_FAILURE
}
