package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.domain.SpeakerId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Artifacts produced by one flush plus every temporary file written for them.
 *
 * <p>Closing the batch deletes all files in {@link #cleanup()}. Use it in try-with-resources so
 * release happens on every exit path, including an early return on an empty batch.
 */
public final class ConvertedBatch implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ConvertedBatch.class);

    private final Map<SpeakerId, Path> artifacts;
    private final List<Path> cleanup;
    private boolean closed;

    ConvertedBatch(Map<SpeakerId, Path> artifacts, List<Path> cleanup) {
        this.artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
        this.cleanup = List.copyOf(cleanup);
    }

    /** Speaker to artifact path, only for speakers whose conversion succeeded. */
    public Map<SpeakerId, Path> artifacts() {
        return artifacts;
    }

    /** Every raw and converted file belonging to this batch. */
    public List<Path> cleanup() {
        return cleanup;
    }

    public boolean isEmpty() {
        return artifacts.isEmpty();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        deleteAll(cleanup);
    }

    static void deleteAll(List<Path> files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warn("Failed to delete temporary audio file {}: {}", file, e.getMessage());
            }
        }
    }
}
