package com.github.stormino.clipper.util;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Scratch directory owned by one job, deleted with everything in it on close.
 * Use with try-with-resources so partial output never outlives the job.
 */
@Slf4j
public class JobWorkspace implements Closeable {

    private final Path directory;
    private volatile boolean closed = false;

    private JobWorkspace(Path directory) {
        this.directory = directory;
    }

    /**
     * Create the workspace directory {@code root/jobId}.
     *
     * @throws IOException if the directory cannot be created
     */
    public static JobWorkspace create(Path root, String jobId) throws IOException {
        Path directory = root.resolve(jobId);
        Files.createDirectories(directory);
        log.debug("Created workspace {}", directory);
        return new JobWorkspace(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        deleteRecursively(directory);
    }

    /**
     * Recursively delete a directory and its contents.
     *
     * @return true if the directory no longer exists
     */
    public static boolean deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return true;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            log.warn("Failed to delete: {}", path, e);
                        }
                    });
        } catch (IOException e) {
            log.warn("Failed to delete workspace: {}", directory, e);
        }
        boolean deleted = !Files.exists(directory);
        if (deleted) {
            log.debug("Deleted workspace {}", directory);
        }
        return deleted;
    }
}
