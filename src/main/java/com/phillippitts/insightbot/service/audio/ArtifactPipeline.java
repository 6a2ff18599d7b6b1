package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.exception.AudioConversionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a flushed speaker to PCM map into per-speaker artifacts.
 *
 * <p>Each speaker is written to {@code <sessionStamp>_<speaker>_<flushStamp>.pcm} in the
 * temp directory and converted independently. A speaker whose write or conversion fails is
 * logged and dropped; the others are unaffected. Every file written, including the expected
 * output of a failed conversion, is listed in the batch's cleanup list.
 */
@Component
public class ArtifactPipeline {

    private static final Logger LOG = LogManager.getLogger(ArtifactPipeline.class);
    private static final DateTimeFormatter FLUSH_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final AudioConverter converter;
    private final Path tempDir;
    private final Clock clock;

    public ArtifactPipeline(AudioConverter converter, SessionProperties props, Clock clock) {
        this.converter = Objects.requireNonNull(converter);
        this.tempDir = Objects.requireNonNull(props).getTempDir();
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Writes and converts every speaker's audio.
     *
     * @param sessionStamp prefix identifying the capture session
     * @param raw          flushed audio, speakers with empty buffers already removed
     * @return batch with the successful artifacts; never {@code null}
     */
    public ConvertedBatch convert(String sessionStamp, Map<SpeakerId, byte[]> raw) {
        Objects.requireNonNull(sessionStamp, "sessionStamp must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
        Map<SpeakerId, Path> artifacts = new LinkedHashMap<>();
        List<Path> cleanup = new ArrayList<>();
        if (raw.isEmpty()) {
            return new ConvertedBatch(artifacts, cleanup);
        }
        try {
            Files.createDirectories(tempDir);
        } catch (IOException e) {
            LOG.error("Cannot create temp audio directory {}: {}", tempDir, e.getMessage());
            return new ConvertedBatch(artifacts, cleanup);
        }

        String flushStamp = LocalDateTime.now(clock).format(FLUSH_STAMP);
        for (Map.Entry<SpeakerId, byte[]> entry : raw.entrySet()) {
            SpeakerId speaker = entry.getKey();
            Path rawFile = tempDir.resolve(sessionStamp + "_" + fileSafe(speaker.value()) + "_" + flushStamp + ".pcm");
            Path target = converter.targetFor(rawFile);
            cleanup.add(rawFile);
            if (!target.equals(rawFile)) {
                cleanup.add(target);
            }
            try {
                Files.write(rawFile, entry.getValue());
                Path artifact = converter.convert(rawFile);
                artifacts.put(speaker, artifact);
                if (!cleanup.contains(artifact)) {
                    cleanup.add(artifact);
                }
            } catch (IOException e) {
                LOG.warn("Dropping speaker {}: failed to write raw audio: {}", speaker, e.getMessage());
            } catch (AudioConversionException e) {
                LOG.warn("Dropping speaker {}: conversion failed: {}", speaker, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Dropping speaker {}: unexpected conversion error", speaker, e);
            }
        }
        LOG.debug("Converted {}/{} speakers", artifacts.size(), raw.size());
        return new ConvertedBatch(artifacts, cleanup);
    }

    static String fileSafe(String value) {
        return value.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
