package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.domain.SpeakerId;

import java.io.ByteArrayOutputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session speaker to PCM buffer map.
 *
 * <p>{@link #append} is called on the transport's thread and only holds the lock for the
 * buffer append. {@link #flush} swaps the whole map under the same lock, so a chunk lands
 * either in the returned snapshot or in the next one, never in both and never in neither.
 * Chunks for a speaker keep their arrival order.
 */
public final class AudioAccumulator {

    private final Lock lock = new ReentrantLock();
    private Map<SpeakerId, ByteArrayOutputStream> buffers = new HashMap<>();

    /**
     * Appends a chunk for a speaker. Empty chunks are ignored.
     */
    public void append(SpeakerId speaker, byte[] chunk) {
        Objects.requireNonNull(speaker, "speaker must not be null");
        if (chunk == null || chunk.length == 0) {
            return;
        }
        lock.lock();
        try {
            buffers.computeIfAbsent(speaker, k -> new ByteArrayOutputStream()).writeBytes(chunk);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically takes everything buffered so far and resets the accumulator.
     *
     * @return speakers with at least one byte of audio; empty map when nothing was buffered
     */
    public Map<SpeakerId, byte[]> flush() {
        Map<SpeakerId, ByteArrayOutputStream> taken;
        lock.lock();
        try {
            taken = buffers;
            buffers = new HashMap<>();
        } finally {
            lock.unlock();
        }
        if (taken.isEmpty()) {
            return Map.of();
        }
        Map<SpeakerId, byte[]> result = new LinkedHashMap<>();
        taken.forEach((speaker, buffer) -> {
            if (buffer.size() > 0) {
                result.put(speaker, buffer.toByteArray());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /** Total bytes currently buffered across all speakers. */
    public long bufferedBytes() {
        lock.lock();
        try {
            long total = 0;
            for (ByteArrayOutputStream buffer : buffers.values()) {
                total += buffer.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }
}
