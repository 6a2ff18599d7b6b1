package com.phillippitts.insightbot.exception;

/**
 * Thrown when the voice transport cannot be acquired or fails to start recording.
 * This is the only failure surfaced to the caller of a session start.
 */
public class TransportException extends InsightBotException {

    private final String channel;

    public TransportException(String message, String channel) {
        super(message + " (channel: " + channel + ")");
        this.channel = channel;
    }

    public TransportException(String message, String channel, Throwable cause) {
        super(message + " (channel: " + channel + ")", cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
