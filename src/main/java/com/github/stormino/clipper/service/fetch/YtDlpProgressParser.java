package com.github.stormino.clipper.service.fetch;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks download percentage from yt-dlp {@code --newline} output.
 * Written by the output-draining thread, read by the job's worker.
 */
public class YtDlpProgressParser {

    // [download]  45.3% of   10.00MiB at    1.00MiB/s ETA 00:05
    private static final Pattern DOWNLOAD_PERCENT_PATTERN =
            Pattern.compile("^\\[download\\]\\s+(\\d{1,3}(?:\\.\\d+)?)%");

    private final AtomicInteger percent = new AtomicInteger(0);

    public void parseLine(String line) {
        if (line == null) {
            return;
        }
        Matcher matcher = DOWNLOAD_PERCENT_PATTERN.matcher(line.trim());
        if (matcher.find()) {
            int value = (int) Math.min(100.0, Double.parseDouble(matcher.group(1)));
            // Separate video and audio downloads each count up from zero; keep the high-water mark
            percent.accumulateAndGet(value, Math::max);
        }
    }

    public int getPercent() {
        return percent.get();
    }
}
