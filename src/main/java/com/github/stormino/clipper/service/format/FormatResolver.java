package com.github.stormino.clipper.service.format;

import com.github.stormino.clipper.model.Platform;
import com.github.stormino.clipper.model.StreamSelector;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a (platform, quality label) pair to the stream to fetch.
 * <p>
 * Pure lookup over a maintained table; never queries the platform. A label
 * without an entry resolves to {@link StreamSelector#sourceDefault()} so quality
 * selection can never fail a job.
 */
@Slf4j
@Component
public class FormatResolver {

    private final Map<Platform, Map<String, String>> table;

    public FormatResolver() {
        Map<Platform, Map<String, String>> tokens = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            tokens.put(platform, Collections.unmodifiableMap(tableFor(platform)));
        }
        this.table = Collections.unmodifiableMap(tokens);
    }

    /**
     * Stream tokens per quality label. A platform without a table fails bean
     * creation at startup.
     */
    private static Map<String, String> tableFor(Platform platform) {
        Map<String, String> labels = new LinkedHashMap<>();
        switch (platform) {
            case YOUTUBE:
                // MP4 video-only itags, merged with the best audio at fetch time
                labels.put("144p", "160");
                labels.put("240p", "133");
                labels.put("360p", "134");
                labels.put("480p", "135");
                labels.put("720p", "136");
                labels.put("1080p", "137");
                labels.put("1440p", "271");
                labels.put("2160p", "313");
                break;
            case FACEBOOK:
                labels.put("360p", "dash_sd_src");
                labels.put("480p", "dash_sd_src");
                labels.put("720p", "dash_hd_src");
                labels.put("1080p", "dash_hd_src");
                break;
            case INSTAGRAM:
            case TIKTOK:
                labels.put("360p", "mp4");
                labels.put("480p", "mp4");
                labels.put("720p", "mp4");
                labels.put("1080p", "mp4");
                break;
            default:
                throw new IllegalStateException("No format table for platform " + platform);
        }
        return labels;
    }

    /**
     * Resolve a quality label for a platform.
     *
     * @param platform Source platform
     * @param qualityLabel Label such as "720p"; null or blank means no preference
     * @return Concrete selector, or the source-default sentinel on a miss
     */
    public StreamSelector resolve(@NonNull Platform platform, String qualityLabel) {
        if (qualityLabel == null || qualityLabel.isBlank()) {
            return StreamSelector.sourceDefault();
        }

        String token = table.get(platform).get(normalize(qualityLabel));
        if (token == null) {
            log.debug("No {} stream for quality '{}', using source default", platform, qualityLabel);
            return StreamSelector.sourceDefault();
        }
        return StreamSelector.of(token);
    }

    /**
     * Quality labels with a concrete stream on the platform, lowest first.
     */
    public List<String> supportedLabels(@NonNull Platform platform) {
        return new ArrayList<>(table.get(platform).keySet());
    }

    private static String normalize(String qualityLabel) {
        return qualityLabel.trim().toLowerCase(Locale.ROOT);
    }
}
