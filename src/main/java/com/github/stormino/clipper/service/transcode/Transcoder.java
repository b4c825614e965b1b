package com.github.stormino.clipper.service.transcode;

import java.nio.file.Path;

/**
 * Trims a fetched source into the delivered clip.
 */
public interface Transcoder {

    /**
     * Cut {@code [start, start + duration)} out of the input and encode it as MP4.
     *
     * @param request Input, output and time range
     * @return The written output file
     * @throws com.github.stormino.clipper.exception.TranscodeException if the transcoder fails
     * @throws com.github.stormino.clipper.exception.StageTimeoutException if the time limit is exceeded
     * @throws InterruptedException if the calling worker is interrupted
     */
    Path transcode(TranscodeRequest request) throws InterruptedException;
}
