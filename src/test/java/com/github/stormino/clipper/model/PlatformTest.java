package com.github.stormino.clipper.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Platform")
class PlatformTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "https://www.youtube.com/watch?v=dQw4w9WgXcQ, YOUTUBE",
            "https://youtube.com/shorts/abc, YOUTUBE",
            "https://m.youtube.com/watch?v=abc, YOUTUBE",
            "https://youtu.be/dQw4w9WgXcQ, YOUTUBE",
            "http://www.youtube-nocookie.com/embed/abc, YOUTUBE",
            "https://www.facebook.com/watch/?v=123, FACEBOOK",
            "https://fb.watch/abc/, FACEBOOK",
            "https://www.instagram.com/reel/abc/, INSTAGRAM",
            "https://www.tiktok.com/@user/video/123, TIKTOK",
            "HTTPS://WWW.TIKTOK.COM/@user/video/123, TIKTOK"
    })
    @DisplayName("should detect platform from host")
    void shouldDetectPlatformFromHost(String url, Platform expected) {
        assertEquals(Optional.of(expected), Platform.fromUrl(url));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "   ",
            "not a url",
            "ftp://youtube.com/video",
            "https://vimeo.com/123",
            "https://notyoutube.com/watch?v=abc",
            "https://youtube.com.evil.example/watch",
            "javascript:alert(1)",
            "https:///path-only"
    })
    @DisplayName("should reject unsupported or malformed URLs")
    void shouldRejectUnsupportedOrMalformedUrls(String url) {
        assertTrue(Platform.fromUrl(url).isEmpty());
    }

    @Test
    @DisplayName("every platform should have a display name and at least one domain")
    void everyPlatformShouldHaveDomains() {
        for (Platform platform : Platform.values()) {
            assertNotNull(platform.getDisplayName());
            assertFalse(platform.getDomains().isEmpty(), platform + " has no domains");
        }
    }
}
