package com.phillippitts.insightbot.service.audio;

/**
 * Raw PCM format delivered by voice transports and buffered per speaker.
 *
 * <p>Format: 48 kHz, 16-bit signed PCM, stereo, little-endian.
 */
public final class PcmFormat {

    public static final int SAMPLE_RATE = 48_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 2;
    public static final boolean SIGNED = true;
    public static final boolean BIG_ENDIAN = false;

    public static final int BLOCK_ALIGN = CHANNELS * BITS_PER_SAMPLE / 8;
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;

    /** ffmpeg input format name for this layout. */
    public static final String FFMPEG_FORMAT = "s16le";

    private PcmFormat() {}

    /** Equivalent Java Sound format, for capture lines. */
    public static javax.sound.sampled.AudioFormat toJavaSound() {
        return new javax.sound.sampled.AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }

    /** Number of bytes covering the given duration, rounded down to whole frames. */
    public static int bytesFor(int millis) {
        int bytes = (int) ((long) millis * BYTE_RATE / 1000L);
        return bytes - (bytes % BLOCK_ALIGN);
    }
}
