package com.phillippitts.insightbot.presentation.dto;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.util.LogSanitizer;

/**
 * Guild settings as returned to clients. The API key is masked.
 */
public record SettingsResponse(String guildId,
                               String mode,
                               int intervalSeconds,
                               boolean apiKeyConfigured,
                               String apiKey) {

    public static SettingsResponse from(GuildId guildId, GuildSettings settings) {
        return new SettingsResponse(
                guildId.value(),
                settings.mode().value(),
                settings.intervalSeconds(),
                settings.hasApiKey(),
                settings.hasApiKey() ? LogSanitizer.mask(settings.apiKey()) : null);
    }
}
