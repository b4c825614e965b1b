package com.github.stormino.clipper.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Video platforms a clip can be cut from.
 * Detection is host based: the URL must be http(s) and its host must be one of
 * the platform domains or a subdomain of one.
 */
public enum Platform {
    YOUTUBE("YouTube", List.of("youtube.com", "youtu.be", "youtube-nocookie.com")),
    FACEBOOK("Facebook", List.of("facebook.com", "fb.watch")),
    INSTAGRAM("Instagram", List.of("instagram.com")),
    TIKTOK("TikTok", List.of("tiktok.com"));

    private final String displayName;
    private final List<String> domains;

    Platform(String displayName, List<String> domains) {
        this.displayName = displayName;
        this.domains = domains;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getDomains() {
        return domains;
    }

    /**
     * Detect the platform hosting the given URL.
     *
     * @param url Source URL as submitted by the client
     * @return Platform, or empty if the URL is malformed or the host is not recognised
     */
    public static Optional<Platform> fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }

        String host;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return Optional.empty();
            }
            host = uri.getHost();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }

        if (host == null) {
            return Optional.empty();
        }
        String normalizedHost = host.toLowerCase(Locale.ROOT);

        for (Platform platform : values()) {
            for (String domain : platform.domains) {
                if (normalizedHost.equals(domain) || normalizedHost.endsWith("." + domain)) {
                    return Optional.of(platform);
                }
            }
        }
        return Optional.empty();
    }
}
