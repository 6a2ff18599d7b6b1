package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.exception.AudioConversionException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Default converter: wraps raw PCM in a WAV container without leaving the JVM.
 */
@Component
@ConditionalOnProperty(prefix = "audio.conversion", name = "format", havingValue = "wav", matchIfMissing = true)
public class WavAudioConverter implements AudioConverter {

    @Override
    public String extension() {
        return "wav";
    }

    @Override
    public Path convert(Path rawFile) {
        Path target = targetFor(rawFile);
        try {
            byte[] pcm = Files.readAllBytes(rawFile);
            if (pcm.length % PcmFormat.BLOCK_ALIGN != 0) {
                throw new AudioConversionException("Raw audio is not frame aligned: " + pcm.length + " bytes");
            }
            WavWriter.write(pcm, target);
            return target;
        } catch (IOException e) {
            throw new AudioConversionException("Failed to write WAV " + target.getFileName(), e);
        }
    }
}
