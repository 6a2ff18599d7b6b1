package com.phillippitts.insightbot.service.publish;

/**
 * Reference to a message posted to a text channel.
 */
public record MessageHandle(String channelId, long messageId) { }
