package com.github.stormino.clipper.model;

import lombok.Value;

@Value
public class JobCreatedResponse {
    String jobId;
}
