package com.phillippitts.insightbot.exception;

/**
 * Thrown when one speaker's raw audio cannot be converted into an artifact.
 */
public class AudioConversionException extends InsightBotException {

    public AudioConversionException(String message) {
        super(message);
    }

    public AudioConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
