package com.github.stormino.clipper.service.transcode;

import com.github.stormino.clipper.service.ProgressListener;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

@Value
@Builder
public class TranscodeRequest {

    @NonNull
    String jobId;

    @NonNull
    Path inputFile;

    @NonNull
    Path outputFile;

    double startSeconds;

    double durationSeconds;

    @NonNull
    Duration timeout;

    @Builder.Default
    ProgressListener progressListener = ProgressListener.NONE;
}
