package com.sensor.readings.reshaper.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sensor.readings.reshaper.dto.ObjectKey;

/**
 * Per-file working state: the key being processed, its target keys and the local scratch files.
 *
 * <p>Scratch file names are unique per task so concurrent workers never share a path. Closing the
 * task deletes every scratch file it handed out.
 */
public final class TransformTask implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TransformTask.class);

    private final ObjectKey key;
    private final Path scratchDir;
    private final String taskId = UUID.randomUUID().toString();
    private final List<Path> artifacts = new ArrayList<>();

    private TransformTask(ObjectKey key, Path scratchDir) {
        this.key = key;
        this.scratchDir = scratchDir;
    }

    /**
     * Starts a task, creating the scratch directory if needed.
     */
    public static TransformTask open(ObjectKey key, Path scratchDir) {
        try {
            Files.createDirectories(scratchDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create scratch directory " + scratchDir, e);
        }
        return new TransformTask(key, scratchDir);
    }

    public ObjectKey key() {
        return key;
    }

    public String archiveKey() {
        return key.archiveKey();
    }

    public String wideKey() {
        return key.wideKey();
    }

    /** Path for the object as downloaded. */
    public Path rawArtifact() {
        return artifact("raw");
    }

    /** Path for the decompressed CSV. */
    public Path decodedArtifact() {
        return artifact("long.csv");
    }

    /** Path for the wide CSV. */
    public Path wideArtifact() {
        return artifact("wide.csv");
    }

    List<Path> artifacts() {
        return List.copyOf(artifacts);
    }

    private Path artifact(String suffix) {
        Path path = scratchDir.resolve(taskId + "." + suffix);
        if (!artifacts.contains(path)) {
            artifacts.add(path);
        }
        return path;
    }

    @Override
    public void close() {
        for (Path artifact : artifacts) {
            try {
                Files.deleteIfExists(artifact);
            } catch (IOException e) {
                logger.warn("Failed to delete scratch file {} of {}: {}", artifact, key, e.getMessage());
            }
        }
    }
}
