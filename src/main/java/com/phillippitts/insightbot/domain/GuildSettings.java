package com.phillippitts.insightbot.domain;

import java.util.Objects;

/**
 * Per-guild settings snapshot.
 *
 * @param mode            analysis mode
 * @param intervalSeconds periodic analysis interval
 * @param apiKey          guild-provided analysis credential, {@code null} when not configured
 */
public record GuildSettings(AnalysisMode mode, int intervalSeconds, String apiKey) {

    public static final AnalysisMode DEFAULT_MODE = AnalysisMode.DEBATE;
    public static final int DEFAULT_INTERVAL_SECONDS = 300;
    public static final int MIN_INTERVAL_SECONDS = 60;
    public static final int MAX_INTERVAL_SECONDS = 3600;

    public GuildSettings {
        Objects.requireNonNull(mode, "mode must not be null");
        if (apiKey != null && apiKey.isBlank()) {
            apiKey = null;
        }
    }

    /** Settings returned for guilds that never stored anything. */
    public static GuildSettings defaults() {
        return new GuildSettings(DEFAULT_MODE, DEFAULT_INTERVAL_SECONDS, null);
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    @Override
    public String toString() {
        return "GuildSettings[mode=" + mode.value() + ", intervalSeconds=" + intervalSeconds
                + ", apiKey=" + (apiKey == null ? "unset" : "set") + "]";
    }
}
