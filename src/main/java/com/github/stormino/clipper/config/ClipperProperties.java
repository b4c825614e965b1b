package com.github.stormino.clipper.config;

import com.github.stormino.clipper.model.Platform;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "clipper")
public class ClipperProperties {

    @Valid
    private Admission admission = new Admission();
    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Worker worker = new Worker();
    @Valid
    private Artifacts artifacts = new Artifacts();
    @Valid
    private Tools tools = new Tools();

    @Data
    public static class Admission {
        @Min(1)
        private int maxClipDurationSeconds = 180;

        /**
         * Ceiling on queued plus in-flight jobs.
         */
        @Min(1)
        private int queueCapacity = 20;

        /**
         * Retry-After hint sent with QUEUE_FULL rejections.
         */
        @Min(1)
        private long queueFullRetryAfterSeconds = 30;

        @NotEmpty
        private Set<Platform> supportedPlatforms = EnumSet.allOf(Platform.class);

        public Duration getQueueFullRetryAfter() {
            return Duration.ofSeconds(queueFullRetryAfterSeconds);
        }
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int submissionsPerWindow = 10;

        @Min(1)
        private long submissionWindowSeconds = 60;

        @Min(1)
        private int jobsPerWindow = 3;

        @Min(1)
        private long jobWindowSeconds = 3600;

        /**
         * Metadata lookups allowed per client and lookup window.
         */
        @Min(1)
        private int lookupsPerWindow = 15;

        @Min(1)
        private long lookupWindowSeconds = 60;

        public Duration getSubmissionWindow() {
            return Duration.ofSeconds(submissionWindowSeconds);
        }

        public Duration getJobWindow() {
            return Duration.ofSeconds(jobWindowSeconds);
        }

        public Duration getLookupWindow() {
            return Duration.ofSeconds(lookupWindowSeconds);
        }
    }

    @Data
    public static class Worker {
        @Min(1)
        private int poolSize = 4;

        @Min(1)
        private long fetchTimeoutSeconds = 120;

        @Min(1)
        private long transcodeTimeoutSeconds = 120;

        /**
         * Wall-clock budget for a whole job, fetch and transcode included.
         */
        @Min(1)
        private long jobTimeoutSeconds = 300;

        @NotBlank
        private String workPath = "/tmp/clipper/work";

        public Duration getFetchTimeout() {
            return Duration.ofSeconds(fetchTimeoutSeconds);
        }

        public Duration getTranscodeTimeout() {
            return Duration.ofSeconds(transcodeTimeoutSeconds);
        }

        public Duration getJobTimeout() {
            return Duration.ofSeconds(jobTimeoutSeconds);
        }
    }

    @Data
    public static class Artifacts {
        @NotBlank
        private String storagePath = "/tmp/clipper/clips";

        @Min(1)
        private long ttlSeconds = 3600;

        @Min(100)
        private long sweepIntervalMs = 30_000;

        /**
         * Prefix the retrieval handle is appended to when building download URLs.
         */
        @NotBlank
        private String downloadUrlPrefix = "/clips/";

        public Duration getTtl() {
            return Duration.ofSeconds(ttlSeconds);
        }
    }

    @Data
    public static class Tools {
        @NotBlank
        private String ytDlpPath = "yt-dlp";

        @NotBlank
        private String ffmpegPath = "ffmpeg";

        private boolean forceIpv4 = true;

        /**
         * Netscape cookie file passed to yt-dlp when present.
         */
        private String cookieFile;

        @Min(1)
        private long metadataTimeoutSeconds = 30;

        /**
         * How long a successful metadata lookup is served from cache.
         */
        @Min(1)
        private long metadataCacheTtlSeconds = 3600;

        @Min(1)
        private long metadataCacheMaxEntries = 500;

        public Duration getMetadataTimeout() {
            return Duration.ofSeconds(metadataTimeoutSeconds);
        }

        public Duration getMetadataCacheTtl() {
            return Duration.ofSeconds(metadataCacheTtlSeconds);
        }
    }
}
