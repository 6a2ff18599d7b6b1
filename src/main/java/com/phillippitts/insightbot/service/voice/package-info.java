/**
 * Voice transport capability used by sessions.
 *
 * <p>A {@link com.phillippitts.insightbot.service.voice.VoiceGateway} connects to a channel and
 * returns a {@link com.phillippitts.insightbot.service.voice.CaptureHandle}; once recording, the
 * handle pushes per-speaker PCM into an {@link com.phillippitts.insightbot.service.voice.AudioSink}.
 */
package com.phillippitts.insightbot.service.voice;
