package com.phillippitts.insightbot.service.voice;

/**
 * Voice transport entry point.
 */
public interface VoiceGateway {

    /**
     * Connects to a voice channel.
     *
     * @param channel transport-specific channel name
     * @return connected handle, not yet recording
     * @throws com.phillippitts.insightbot.exception.TransportException if the channel cannot be joined
     */
    CaptureHandle connect(String channel);
}
