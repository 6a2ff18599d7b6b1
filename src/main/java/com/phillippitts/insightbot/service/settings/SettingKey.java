package com.phillippitts.insightbot.service.settings;

/**
 * Settable guild settings and the column each one is stored in.
 */
public enum SettingKey {
    API_KEY("api_key"),
    MODE("analysis_mode"),
    INTERVAL("recording_interval");

    private final String column;

    SettingKey(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
