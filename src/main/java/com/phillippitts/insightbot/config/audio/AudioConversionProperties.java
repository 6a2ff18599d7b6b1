package com.phillippitts.insightbot.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for per-speaker audio conversion.
 *
 * <p>{@code wav} wraps the raw PCM in a WAV container in-process; {@code mp3} runs ffmpeg.
 */
@Validated
@ConfigurationProperties(prefix = "audio.conversion")
public class AudioConversionProperties {

    @Pattern(regexp = "wav|mp3", message = "audio.conversion.format must be wav or mp3")
    private final String format;

    /** ffmpeg executable, resolved through PATH when not absolute. */
    private final String ffmpegPath;

    @Min(1)
    @Max(3600)
    private final int timeoutSeconds;

    @ConstructorBinding
    public AudioConversionProperties(String format,
                                     String ffmpegPath,
                                     @NotNull Integer timeoutSeconds) {
        this.format = (format == null || format.isBlank()) ? "wav" : format;
        this.ffmpegPath = (ffmpegPath == null || ffmpegPath.isBlank()) ? "ffmpeg" : ffmpegPath;
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getFormat() { return format; }
    public String getFfmpegPath() { return ffmpegPath; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
}
