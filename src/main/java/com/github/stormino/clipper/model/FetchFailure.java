package com.github.stormino.clipper.model;

public enum FetchFailure {
    NETWORK_ERROR(true),
    PLATFORM_RATE_LIMITED(true),
    UNSUPPORTED_CONTENT(true),
    ACCESS_RESTRICTED(true),
    TOOL_FAILURE(false);

    private final boolean platformSide;

    FetchFailure(boolean platformSide) {
        this.platformSide = platformSide;
    }

    /**
     * Whether the failure originates outside this service (the network or the
     * hosting platform) rather than in its own infrastructure.
     */
    public boolean isPlatformSide() {
        return platformSide;
    }
}
