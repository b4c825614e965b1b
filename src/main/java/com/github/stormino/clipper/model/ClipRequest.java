package com.github.stormino.clipper.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /jobs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClipRequest {

    @NotBlank
    @Size(max = 2048)
    private String url;

    /**
     * Trim start in seconds.
     */
    @NotNull
    private Double start;

    /**
     * Trim end in seconds, exclusive of {@link #start}.
     */
    @NotNull
    private Double end;

    /**
     * Human quality label such as "720p". Optional.
     */
    @Size(max = 32)
    private String qualityLabel;

    private boolean rightsConfirmed;

    /**
     * Caller identity used for rate limiting. Falls back to the request's
     * network origin when absent.
     */
    @Size(max = 128)
    private String clientId;
}
