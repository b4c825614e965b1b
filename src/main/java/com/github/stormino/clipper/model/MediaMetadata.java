package com.github.stormino.clipper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Source video details reported by the fetch tool without downloading.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MediaMetadata {
    String title;
    Double durationSeconds;
    String thumbnailUrl;
    Platform platform;
    List<String> qualityLabels;
}
