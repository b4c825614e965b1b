package com.github.stormino.clipper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Error body returned for rejected requests.
 * {@code retryAfter} is in whole seconds and only present when waiting helps.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String errorKind;
    String message;
    Long retryAfter;
}
