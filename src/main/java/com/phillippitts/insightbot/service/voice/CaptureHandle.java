package com.phillippitts.insightbot.service.voice;

/**
 * A live connection to a voice channel.
 *
 * <p>{@link #stopRecording()} and {@link #disconnect()} are idempotent and safe to call in
 * any order during teardown.
 */
public interface CaptureHandle {

    boolean isConnected();

    boolean isRecording();

    /**
     * Starts delivering audio to {@code sink}.
     *
     * @throws com.phillippitts.insightbot.exception.TransportException if recording cannot start
     */
    void startRecording(AudioSink sink);

    void stopRecording();

    void disconnect();
}
