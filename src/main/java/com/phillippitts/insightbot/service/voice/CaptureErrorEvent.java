package com.phillippitts.insightbot.service.voice;

import java.time.Instant;

/**
 * Published when a capture line fails (permissions, device errors, etc.).
 *
 * Payload contains a short reason, the channel and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(String reason, String channel, Instant at) { }
