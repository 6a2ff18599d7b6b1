package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.GuildSettings;

/**
 * Per-guild settings persistence.
 */
public interface GuildSettingsStore {

    /**
     * Returns the stored settings, or {@link GuildSettings#defaults()} for a guild with no row.
     */
    GuildSettings get(GuildId guildId);

    /**
     * Validates and stores one setting.
     *
     * <p>{@link SettingKey#INTERVAL} must be an integer in
     * [{@value GuildSettings#MIN_INTERVAL_SECONDS}, {@value GuildSettings#MAX_INTERVAL_SECONDS}];
     * {@link SettingKey#MODE} must name an {@link com.phillippitts.insightbot.domain.AnalysisMode};
     * a blank {@link SettingKey#API_KEY} clears the key.
     *
     * @throws com.phillippitts.insightbot.exception.InvalidSettingException if the value is rejected
     */
    void set(GuildId guildId, SettingKey key, String value);
}
