package com.github.stormino.clipper.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Platform-specific token naming the source stream to fetch,
 * or the sentinel meaning "let the source pick its default".
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StreamSelector {

    /**
     * Format expression used when no concrete stream was resolved.
     */
    public static final String DEFAULT_FORMAT_EXPRESSION = "best[height<=720]/best";

    private static final StreamSelector SOURCE_DEFAULT = new StreamSelector(null);

    private final String token;

    public static StreamSelector of(@NonNull String token) {
        if (token.isBlank()) {
            throw new IllegalArgumentException("Stream selector token must not be blank");
        }
        return new StreamSelector(token);
    }

    public static StreamSelector sourceDefault() {
        return SOURCE_DEFAULT;
    }

    public boolean isSourceDefault() {
        return token == null;
    }

    /**
     * Render the selector as a yt-dlp format expression.
     * A concrete token prefers that stream merged with the best audio, then the
     * stream alone, then the default expression.
     */
    public String toFormatExpression() {
        if (isSourceDefault()) {
            return DEFAULT_FORMAT_EXPRESSION;
        }
        return token + "+bestaudio/" + token + "/" + DEFAULT_FORMAT_EXPRESSION;
    }
}
