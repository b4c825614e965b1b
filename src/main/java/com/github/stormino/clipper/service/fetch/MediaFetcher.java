package com.github.stormino.clipper.service.fetch;

import com.github.stormino.clipper.exception.FetchException;
import com.github.stormino.clipper.exception.StageTimeoutException;
import com.github.stormino.clipper.model.MediaMetadata;
import com.github.stormino.clipper.model.Platform;

import java.time.Duration;

/**
 * External capability that downloads source media from a hosting platform.
 */
public interface MediaFetcher {

    /**
     * Download the selected stream into the request's target directory.
     *
     * @return The downloaded file
     * @throws FetchException on network, platform or tool failure
     * @throws StageTimeoutException if the download exceeded the request timeout
     * @throws InterruptedException if the calling worker was interrupted
     */
    FetchedMedia fetch(FetchRequest request) throws InterruptedException;

    /**
     * Read source details without downloading media.
     *
     * @throws FetchException on network, platform or tool failure
     * @throws StageTimeoutException if the probe exceeded the timeout
     * @throws InterruptedException if the calling thread was interrupted
     */
    MediaMetadata probe(String url, Platform platform, Duration timeout) throws InterruptedException;
}
