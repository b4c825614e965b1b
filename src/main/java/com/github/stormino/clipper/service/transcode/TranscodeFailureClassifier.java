package com.github.stormino.clipper.service.transcode;

import com.github.stormino.clipper.model.TranscodeFailure;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;

/**
 * Classifies ffmpeg failures from its output.
 */
@UtilityClass
public class TranscodeFailureClassifier {

    private static final List<String> RESOURCE_MARKERS = List.of(
            "no space left on device",
            "cannot allocate memory",
            "out of memory",
            "resource temporarily unavailable",
            "disk quota exceeded");

    private static final List<String> CODEC_MARKERS = List.of(
            "unknown encoder",
            "unknown decoder",
            "decoder not found",
            "encoder not found",
            "codec not currently supported",
            "could not find codec parameters",
            "unsupported codec",
            "not supported by the bitstream filter");

    private static final List<String> CORRUPT_MARKERS = List.of(
            "invalid data found when processing input",
            "moov atom not found",
            "error while decoding",
            "corrupt",
            "truncated",
            "end of file",
            "output file is empty",
            "does not contain any stream");

    public static TranscodeFailure classify(String output) {
        if (output == null || output.isBlank()) {
            return TranscodeFailure.TOOL_FAILURE;
        }
        String text = output.toLowerCase(Locale.ROOT);

        if (containsAny(text, RESOURCE_MARKERS)) {
            return TranscodeFailure.RESOURCE_EXHAUSTION;
        }
        if (containsAny(text, CODEC_MARKERS)) {
            return TranscodeFailure.UNSUPPORTED_CODEC;
        }
        if (containsAny(text, CORRUPT_MARKERS)) {
            return TranscodeFailure.CORRUPT_INPUT;
        }
        return TranscodeFailure.TOOL_FAILURE;
    }

    public static String describe(TranscodeFailure failure) {
        switch (failure) {
            case CORRUPT_INPUT:
                return "The downloaded video could not be decoded.";
            case UNSUPPORTED_CODEC:
                return "The video uses a format that cannot be processed.";
            case RESOURCE_EXHAUSTION:
                return "The server ran out of resources while processing the clip. Please try again later.";
            case TOOL_FAILURE:
            default:
                return "Failed to process video.";
        }
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
