package com.phillippitts.insightbot.exception;

/**
 * Thrown when no session loop thread is available to host a new capture session.
 */
public class SessionCapacityException extends InsightBotException {

    public SessionCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
