package com.github.stormino.clipper.service.fetch;

import com.github.stormino.clipper.model.StreamSelector;
import com.github.stormino.clipper.service.ProgressListener;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

@Value
@Builder
public class FetchRequest {

    @NonNull
    String jobId;

    @NonNull
    String url;

    @NonNull
    StreamSelector selector;

    /**
     * Directory the source file is written into. Owned by the job.
     */
    @NonNull
    Path targetDirectory;

    @NonNull
    Duration timeout;

    @Builder.Default
    ProgressListener progressListener = ProgressListener.NONE;
}
