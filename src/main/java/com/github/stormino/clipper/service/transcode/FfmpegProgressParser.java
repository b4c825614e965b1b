package com.github.stormino.clipper.service.transcode;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for FFmpeg {@code -stats} output.
 * Progress is the encoded time relative to the known clip length.
 */
public class FfmpegProgressParser {

    private static final Pattern FFMPEG_TIME_PATTERN = Pattern.compile("time=(\\d{2,}):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

    private final double clipDurationSeconds;
    private final AtomicInteger percent = new AtomicInteger(0);

    public FfmpegProgressParser(double clipDurationSeconds) {
        this.clipDurationSeconds = clipDurationSeconds;
    }

    public void parseLine(String line) {
        if (line == null || line.isBlank() || clipDurationSeconds <= 0) {
            return;
        }
        Matcher timeMatcher = FFMPEG_TIME_PATTERN.matcher(line);
        if (timeMatcher.find()) {
            double currentTime = parseTime(timeMatcher.group(1), timeMatcher.group(2), timeMatcher.group(3));
            int value = (int) Math.min(100.0, (currentTime / clipDurationSeconds) * 100.0);
            percent.accumulateAndGet(value, Math::max);
        }
    }

    public int getPercent() {
        return percent.get();
    }

    private static double parseTime(String hours, String minutes, String seconds) {
        return Integer.parseInt(hours) * 3600 +
               Integer.parseInt(minutes) * 60 +
               Double.parseDouble(seconds);
    }
}
