package com.phillippitts.insightbot.exception;

/**
 * Thrown when a guild setting value is rejected at the point where it is set.
 */
public class InvalidSettingException extends InsightBotException {

    private final String setting;

    public InvalidSettingException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
