package com.github.stormino.clipper.service.transcode;

import com.github.stormino.clipper.config.ClipperProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builder for constructing ffmpeg command-line arguments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegCommandBuilder {

    static final String VIDEO_CODEC = "libx264";
    static final String VIDEO_PRESET = "veryfast";
    static final String VIDEO_CRF = "18";
    static final String AUDIO_CODEC = "aac";
    static final String AUDIO_BITRATE = "128k";

    private final ClipperProperties properties;

    /**
     * Build ffmpeg command for cutting and re-encoding a clip.
     * <p>
     * Seeking before the input is fast; re-encoding keeps the cut frame-accurate
     * instead of snapping to the previous keyframe.
     *
     * @param inputFile Fetched source file
     * @param outputFile MP4 file to write
     * @param startSeconds Clip start in the source
     * @param durationSeconds Clip length
     * @return ffmpeg command arguments
     */
    public List<String> buildTrimCommand(@NonNull Path inputFile, @NonNull Path outputFile,
                                         double startSeconds, double durationSeconds) {
        List<String> command = new ArrayList<>();
        command.add(properties.getTools().getFfmpegPath());
        command.add("-hide_banner");
        command.add("-nostdin");
        command.add("-loglevel");
        command.add("info");
        command.add("-stats");
        command.add("-ss");
        command.add(formatSeconds(startSeconds));
        command.add("-i");
        command.add(inputFile.toString());
        command.add("-t");
        command.add(formatSeconds(durationSeconds));
        command.add("-c:v");
        command.add(VIDEO_CODEC);
        command.add("-preset");
        command.add(VIDEO_PRESET);
        command.add("-crf");
        command.add(VIDEO_CRF);
        command.add("-c:a");
        command.add(AUDIO_CODEC);
        command.add("-b:a");
        command.add(AUDIO_BITRATE);
        command.add("-avoid_negative_ts");
        command.add("make_zero");
        command.add("-movflags");
        command.add("+faststart");
        command.add("-y");
        command.add(outputFile.toString());

        log.debug("Built trim command: {}", String.join(" ", command));
        return command;
    }

    static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
