package com.github.stormino.clipper.service.process;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of an external process run.
 */
@Value
@Builder
public class ProcessResult {

    /**
     * Exit code, or null when the process was killed on timeout.
     */
    Integer exitCode;

    boolean timedOut;

    /**
     * Last lines of the combined stdout/stderr, oldest first.
     */
    @Builder.Default
    List<String> outputTail = List.of();

    Duration elapsed;

    public boolean isSuccess() {
        return !timedOut && exitCode != null && exitCode == 0;
    }

    /**
     * Tail joined into one string, for log messages and failure classification.
     */
    public String outputText() {
        return String.join("\n", outputTail);
    }

    public static ProcessResult completed(int exitCode, List<String> outputTail, Duration elapsed) {
        return ProcessResult.builder()
                .exitCode(exitCode)
                .timedOut(false)
                .outputTail(outputTail)
                .elapsed(elapsed)
                .build();
    }

    public static ProcessResult timedOut(List<String> outputTail, Duration elapsed) {
        return ProcessResult.builder()
                .timedOut(true)
                .outputTail(outputTail)
                .elapsed(elapsed)
                .build();
    }
}
