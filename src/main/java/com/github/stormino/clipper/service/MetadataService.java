package com.github.stormino.clipper.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.AdmissionException;
import com.github.stormino.clipper.exception.ClipException;
import com.github.stormino.clipper.model.AdmissionErrorKind;
import com.github.stormino.clipper.model.MediaMetadata;
import com.github.stormino.clipper.model.Platform;
import com.github.stormino.clipper.service.fetch.MediaFetcher;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Looks up title, duration and available qualities of a source video before a clip is requested.
 * <p>
 * Every lookup is charged to the client's lookup window. Successful results are cached per URL,
 * so repeated lookups of one video start a single yt-dlp process.
 */
@Slf4j
@Service
public class MetadataService {

    private final MediaFetcher fetcher;
    private final ClipperProperties properties;
    private final ClientRateLimiter rateLimiter;
    private final Cache<String, MediaMetadata> cache;

    public MetadataService(MediaFetcher fetcher, ClipperProperties properties,
                           ClientRateLimiter rateLimiter, Clock clock) {
        this.fetcher = fetcher;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getTools().getMetadataCacheTtl())
                .maximumSize(properties.getTools().getMetadataCacheMaxEntries())
                .ticker(() -> toNanos(clock.instant()))
                .build();
    }

    public MediaMetadata probe(@NonNull String url, @NonNull String clientId) {
        String key = url.trim();
        Platform platform = Platform.fromUrl(key)
                .filter(p -> properties.getAdmission().getSupportedPlatforms().contains(p))
                .orElseThrow(() -> new AdmissionException(AdmissionErrorKind.UNSUPPORTED_PLATFORM,
                        "URL must be from a supported platform."));

        rateLimiter.acquireLookup(clientId);

        MediaMetadata cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Metadata cache hit for {}", key);
            return cached;
        }

        try {
            MediaMetadata metadata = fetcher.probe(key, platform, properties.getTools().getMetadataTimeout());
            cache.put(key, metadata);
            log.debug("Probed {} video: {}", platform.getDisplayName(), metadata.getTitle());
            return metadata;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClipException("Metadata lookup interrupted", e);
        }
    }

    long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
