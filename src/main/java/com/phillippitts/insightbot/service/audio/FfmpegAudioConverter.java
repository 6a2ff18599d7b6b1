package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.config.audio.AudioConversionProperties;
import com.phillippitts.insightbot.exception.AudioConversionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Encodes raw PCM to MP3 by running ffmpeg.
 */
@Component
@ConditionalOnProperty(prefix = "audio.conversion", name = "format", havingValue = "mp3")
public class FfmpegAudioConverter implements AudioConverter {

    private static final Logger LOG = LogManager.getLogger(FfmpegAudioConverter.class);

    private final AudioConversionProperties props;
    private final ProcessFactory processFactory;

    @Autowired
    public FfmpegAudioConverter(AudioConversionProperties props) {
        this(props, new DefaultProcessFactory());
    }

    // Package-private for tests
    FfmpegAudioConverter(AudioConversionProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props);
        this.processFactory = Objects.requireNonNull(processFactory);
    }

    @Override
    public String extension() {
        return "mp3";
    }

    @Override
    public Path convert(Path rawFile) {
        Path target = targetFor(rawFile);
        List<String> command = buildCommand(rawFile, target);
        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            throw new AudioConversionException("Failed to start ffmpeg: " + e.getMessage(), e);
        }
        try {
            boolean finished = process.waitFor(props.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new AudioConversionException(
                        "ffmpeg timed out after " + props.getTimeoutSeconds() + "s for " + rawFile.getFileName());
            }
            int exit = process.exitValue();
            if (exit != 0) {
                throw new AudioConversionException("ffmpeg exited with code " + exit + " for " + rawFile.getFileName());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new AudioConversionException("Interrupted while waiting for ffmpeg", e);
        }
        if (!Files.isRegularFile(target)) {
            throw new AudioConversionException("ffmpeg produced no output for " + rawFile.getFileName());
        }
        LOG.debug("Converted {} to {}", rawFile.getFileName(), target.getFileName());
        return target;
    }

    List<String> buildCommand(Path rawFile, Path target) {
        return List.of(
                props.getFfmpegPath(),
                "-hide_banner", "-loglevel", "error", "-y",
                "-f", PcmFormat.FFMPEG_FORMAT,
                "-ar", String.valueOf(PcmFormat.SAMPLE_RATE),
                "-ac", String.valueOf(PcmFormat.CHANNELS),
                "-i", rawFile.toString(),
                target.toString());
    }
}
