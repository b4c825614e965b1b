package com.github.stormino.clipper.model;

import lombok.Value;

import java.time.Instant;

@Value
public class StatusTransition {
    JobStatus from;
    JobStatus to;
    Instant at;
}
