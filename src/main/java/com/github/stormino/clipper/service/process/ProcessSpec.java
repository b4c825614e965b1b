package com.github.stormino.clipper.service.process;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Everything needed to launch one external process for a job.
 */
@Value
@Builder
public class ProcessSpec {

    @NonNull
    String jobId;

    /**
     * Short stage name for logs, e.g. "fetch".
     */
    @NonNull
    String stage;

    @NonNull
    List<String> command;

    Path workingDirectory;

    @NonNull
    Duration timeout;

    /**
     * Receives each output line on the output-draining thread. Must not touch job state.
     */
    @Builder.Default
    Consumer<String> lineListener = line -> { };

    /**
     * Invoked periodically on the calling thread while the process runs.
     */
    @Builder.Default
    Runnable heartbeat = () -> { };
}
