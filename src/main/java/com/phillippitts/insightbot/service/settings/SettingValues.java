package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.exception.InvalidSettingException;

/**
 * Boundary validation shared by settings store implementations.
 */
final class SettingValues {

    private SettingValues() {}

    /**
     * Normalizes a raw setting value into what gets stored.
     *
     * @return the value to persist; {@code null} clears an API key
     */
    static Object normalize(SettingKey key, String value) {
        return switch (key) {
            case MODE -> {
                try {
                    yield AnalysisMode.parse(value).value();
                } catch (IllegalArgumentException e) {
                    throw new InvalidSettingException("mode", "Mode must be one of: debate, summary");
                }
            }
            case INTERVAL -> parseInterval(value);
            case API_KEY -> value == null || value.isBlank() ? null : value.trim();
        };
    }

    private static Integer parseInterval(String value) {
        int seconds;
        try {
            seconds = Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSettingException("interval", "Interval must be a whole number of seconds");
        }
        if (seconds < GuildSettings.MIN_INTERVAL_SECONDS || seconds > GuildSettings.MAX_INTERVAL_SECONDS) {
            throw new InvalidSettingException("interval", "Interval must be between "
                    + GuildSettings.MIN_INTERVAL_SECONDS + " and " + GuildSettings.MAX_INTERVAL_SECONDS + " seconds");
        }
        return seconds;
    }
}
