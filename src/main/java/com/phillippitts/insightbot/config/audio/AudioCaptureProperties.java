package com.phillippitts.insightbot.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the local microphone transport.
 *
 * Captured format: 48 kHz, 16-bit PCM, stereo, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Speaker id attributed to audio read from the local line. */
    private final String speakerId;

    /** Display name registered for the local speaker. */
    private final String speakerName;

    @ConstructorBinding
    public AudioCaptureProperties(@NotNull Integer chunkMillis,
                                  String speakerId,
                                  String speakerName) {
        this.chunkMillis = chunkMillis;
        this.speakerId = (speakerId == null || speakerId.isBlank()) ? "local" : speakerId;
        this.speakerName = (speakerName == null || speakerName.isBlank()) ? null : speakerName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public String getSpeakerId() { return speakerId; }
    public String getSpeakerName() { return speakerName; }
}
