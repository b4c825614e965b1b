package com.github.stormino.clipper.support;

import com.github.stormino.clipper.config.ClipperProperties;

import java.nio.file.Path;

/**
 * Properties with file system locations under a test directory.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static ClipperProperties under(Path root) {
        ClipperProperties properties = new ClipperProperties();
        properties.getWorker().setWorkPath(root.resolve("work").toString());
        properties.getArtifacts().setStoragePath(root.resolve("clips").toString());
        return properties;
    }
}
