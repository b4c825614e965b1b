package com.github.stormino.clipper.service.fetch;

import lombok.Value;

import java.nio.file.Path;

@Value
public class FetchedMedia {
    Path file;
    long sizeBytes;
}
