package com.github.stormino.clipper.service.fetch;

import com.github.stormino.clipper.model.FetchFailure;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;

/**
 * Classifies yt-dlp failures from its output.
 * Patterns are checked in order; the first group with a match wins.
 */
@UtilityClass
public class FetchFailureClassifier {

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "http error 429",
            "too many requests",
            "rate-limit",
            "rate limit",
            "confirm you're not a bot",
            "confirm you’re not a bot");

    private static final List<String> RESTRICTION_MARKERS = List.of(
            "sign in to confirm your age",
            "age-restricted",
            "age restricted",
            "inappropriate for some users",
            "not available in your country",
            "geo restriction",
            "geo-restricted",
            "private video",
            "members-only",
            "login required",
            "requires authentication",
            "http error 403");

    private static final List<String> UNSUPPORTED_MARKERS = List.of(
            "unsupported url",
            "requested format is not available",
            "no video formats found",
            "video unavailable",
            "this video is unavailable",
            "is not a valid url",
            "http error 404",
            "has been removed");

    private static final List<String> NETWORK_MARKERS = List.of(
            "unable to download webpage",
            "unable to download video data",
            "connection reset",
            "connection refused",
            "timed out",
            "name or service not known",
            "temporary failure in name resolution",
            "network is unreachable",
            "nodename nor servname",
            "http error 5",
            "ssl",
            "urlopen error");

    /**
     * Classify a failed run.
     *
     * @param output Combined tool output
     * @return Failure class; {@link FetchFailure#TOOL_FAILURE} when the tool reported no error of its own
     */
    public static FetchFailure classify(String output) {
        if (output == null || output.isBlank()) {
            return FetchFailure.TOOL_FAILURE;
        }
        String text = output.toLowerCase(Locale.ROOT);

        if (containsAny(text, RATE_LIMIT_MARKERS)) {
            return FetchFailure.PLATFORM_RATE_LIMITED;
        }
        if (containsAny(text, RESTRICTION_MARKERS)) {
            return FetchFailure.ACCESS_RESTRICTED;
        }
        if (containsAny(text, UNSUPPORTED_MARKERS)) {
            return FetchFailure.UNSUPPORTED_CONTENT;
        }
        if (containsAny(text, NETWORK_MARKERS)) {
            return FetchFailure.NETWORK_ERROR;
        }
        // yt-dlp reported an error we do not recognise: still a refusal from the source side
        if (text.contains("error:")) {
            return FetchFailure.UNSUPPORTED_CONTENT;
        }
        return FetchFailure.TOOL_FAILURE;
    }

    /**
     * Message shown to the client for a failure class.
     */
    public static String describe(FetchFailure failure) {
        switch (failure) {
            case NETWORK_ERROR:
                return "The source video could not be reached. Please check the URL and try again.";
            case PLATFORM_RATE_LIMITED:
                return "The video platform is limiting downloads right now. Please try again later.";
            case UNSUPPORTED_CONTENT:
                return "The source video is unavailable or cannot be downloaded.";
            case ACCESS_RESTRICTED:
                return "The source video is private, age-restricted or not available in this region.";
            case TOOL_FAILURE:
            default:
                return "Failed to download video due to an internal error.";
        }
    }

    /**
     * Last line the tool flagged as an error, if any.
     */
    public static String lastErrorLine(List<String> outputTail) {
        for (int i = outputTail.size() - 1; i >= 0; i--) {
            String line = outputTail.get(i);
            if (line.startsWith("ERROR:")) {
                return line.length() > 300 ? line.substring(0, 300) : line;
            }
        }
        return null;
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
