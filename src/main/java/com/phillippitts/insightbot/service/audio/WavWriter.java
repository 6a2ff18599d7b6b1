package com.phillippitts.insightbot.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.insightbot.service.audio.PcmFormat.BITS_PER_SAMPLE;
import static com.phillippitts.insightbot.service.audio.PcmFormat.BLOCK_ALIGN;
import static com.phillippitts.insightbot.service.audio.PcmFormat.BYTE_RATE;
import static com.phillippitts.insightbot.service.audio.PcmFormat.CHANNELS;
import static com.phillippitts.insightbot.service.audio.PcmFormat.SAMPLE_RATE;

/**
 * Writes minimal PCM WAV files in the transport's {@link PcmFormat}.
 */
public final class WavWriter {

    /** Size of the canonical RIFF/WAVE header written before the samples. */
    public static final int HEADER_SIZE = 44;

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given raw PCM payload.
     *
     * @param pcm     raw PCM16LE stereo audio at 48 kHz
     * @param wavPath output file path (will be created or overwritten)
     * @throws IOException if the file cannot be written
     */
    public static void write(byte[] pcm, Path wavPath) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            int dataSize = pcm.length;

            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1); // PCM
            writeLEShort(os, (short) CHANNELS);
            writeLEInt(os, SAMPLE_RATE);
            writeLEInt(os, BYTE_RATE);
            writeLEShort(os, (short) BLOCK_ALIGN);
            writeLEShort(os, (short) BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);

            os.write(pcm);
            os.flush();
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
