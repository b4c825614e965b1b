package com.github.stormino.clipper.service.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.clipper.exception.FetchException;
import com.github.stormino.clipper.exception.StageTimeoutException;
import com.github.stormino.clipper.model.FetchFailure;
import com.github.stormino.clipper.model.MediaMetadata;
import com.github.stormino.clipper.model.Platform;
import com.github.stormino.clipper.service.format.FormatResolver;
import com.github.stormino.clipper.service.process.ProcessResult;
import com.github.stormino.clipper.service.process.ProcessRunner;
import com.github.stormino.clipper.service.process.ProcessSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Fetches source media with yt-dlp.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YtDlpMediaFetcher implements MediaFetcher {

    private static final String FETCH_STAGE = "fetch";
    private static final String PROBE_STAGE = "probe";

    private final ProcessRunner processRunner;
    private final YtDlpCommandBuilder commandBuilder;
    private final FormatResolver formatResolver;
    private final ObjectMapper objectMapper;

    @Override
    public FetchedMedia fetch(FetchRequest request) throws InterruptedException {
        List<String> command = commandBuilder.buildDownloadCommand(
                request.getUrl(), request.getSelector(), request.getTargetDirectory());

        YtDlpProgressParser parser = new YtDlpProgressParser();
        ProcessSpec spec = ProcessSpec.builder()
                .jobId(request.getJobId())
                .stage(FETCH_STAGE)
                .command(command)
                .workingDirectory(request.getTargetDirectory())
                .timeout(request.getTimeout())
                .lineListener(parser::parseLine)
                .heartbeat(() -> request.getProgressListener().onProgress(parser.getPercent()))
                .build();

        ProcessResult result = runTool(spec, request.getUrl());

        if (result.isTimedOut()) {
            throw new StageTimeoutException(FETCH_STAGE, request.getTimeout());
        }
        if (!result.isSuccess()) {
            throw failure(result, request.getUrl());
        }

        Path file = findSourceFile(request.getTargetDirectory())
                .orElseThrow(() -> new FetchException(
                        "yt-dlp exited successfully but produced no media file",
                        FetchFailure.TOOL_FAILURE, request.getUrl()));

        try {
            long size = Files.size(file);
            if (size == 0) {
                throw new FetchException("Downloaded media file is empty",
                        FetchFailure.UNSUPPORTED_CONTENT, request.getUrl());
            }
            log.info("Fetched {} for job {} in {}s", file.getFileName(), request.getJobId(),
                    result.getElapsed().toSeconds());
            return new FetchedMedia(file, size);
        } catch (IOException e) {
            throw new FetchException("Cannot read downloaded media: " + e.getMessage(), e,
                    FetchFailure.TOOL_FAILURE, request.getUrl());
        }
    }

    @Override
    public MediaMetadata probe(String url, Platform platform, Duration timeout) throws InterruptedException {
        ProcessSpec spec = ProcessSpec.builder()
                .jobId(PROBE_STAGE + "-" + UUID.randomUUID())
                .stage(PROBE_STAGE)
                .command(commandBuilder.buildProbeCommand(url))
                .timeout(timeout)
                .build();

        ProcessResult result = runTool(spec, url);

        if (result.isTimedOut()) {
            throw new StageTimeoutException(PROBE_STAGE, timeout);
        }
        if (!result.isSuccess()) {
            throw failure(result, url);
        }

        // The JSON document is a single line; warnings, if any, precede it
        String json = null;
        List<String> lines = result.getOutputTail();
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).startsWith("{")) {
                json = lines.get(i);
                break;
            }
        }
        if (json == null) {
            throw new FetchException("yt-dlp returned no metadata", FetchFailure.TOOL_FAILURE, url);
        }

        try {
            return toMetadata(objectMapper.readTree(json), platform);
        } catch (IOException e) {
            throw new FetchException("Unreadable metadata from yt-dlp: " + e.getMessage(), e,
                    FetchFailure.TOOL_FAILURE, url);
        }
    }

    private ProcessResult runTool(ProcessSpec spec, String url) throws InterruptedException {
        try {
            return processRunner.run(spec);
        } catch (IOException e) {
            log.error("Cannot start yt-dlp for {}: {}", spec.getJobId(), e.getMessage());
            throw new FetchException("Cannot start yt-dlp: " + e.getMessage(), e, FetchFailure.TOOL_FAILURE, url);
        }
    }

    private FetchException failure(ProcessResult result, String url) {
        FetchFailure failure = FetchFailureClassifier.classify(result.outputText());
        String detail = FetchFailureClassifier.lastErrorLine(result.getOutputTail());
        String message = FetchFailureClassifier.describe(failure);
        if (detail != null) {
            message = message + " (" + detail + ")";
        }
        return new FetchException(message, failure, url, result.getExitCode());
    }

    private MediaMetadata toMetadata(JsonNode root, Platform platform) {
        TreeSet<Integer> heights = new TreeSet<>();
        JsonNode formats = root.path("formats");
        if (formats.isArray()) {
            for (JsonNode format : formats) {
                JsonNode height = format.path("height");
                if (height.isInt() && !"none".equals(format.path("vcodec").asText())) {
                    heights.add(height.asInt());
                }
            }
        }

        // Offer only labels the resolver can turn into a concrete stream
        List<String> labels = new ArrayList<>();
        for (String label : formatResolver.supportedLabels(platform)) {
            int labelHeight = Integer.parseInt(label.substring(0, label.length() - 1));
            if (heights.contains(labelHeight)) {
                labels.add(label);
            }
        }

        JsonNode duration = root.path("duration");
        return MediaMetadata.builder()
                .title(root.path("title").asText(null))
                .durationSeconds(duration.isNumber() ? duration.asDouble() : null)
                .thumbnailUrl(root.path("thumbnail").asText(null))
                .platform(platform)
                .qualityLabels(labels)
                .build();
    }

    private static Optional<Path> findSourceFile(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(YtDlpCommandBuilder.SOURCE_BASENAME + "."))
                    .findFirst();
        } catch (IOException e) {
            log.warn("Cannot list fetch directory {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
    }
}
