package com.phillippitts.insightbot.service.voice;

import com.phillippitts.insightbot.domain.SpeakerId;

/**
 * Receives PCM chunks from a voice transport, on the transport's own thread.
 */
@FunctionalInterface
public interface AudioSink {

    void onAudio(SpeakerId speaker, byte[] chunk);
}
