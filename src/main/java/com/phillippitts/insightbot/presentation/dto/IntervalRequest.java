package com.phillippitts.insightbot.presentation.dto;

import com.phillippitts.insightbot.domain.GuildSettings;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** Body of {@code PUT /guilds/{guildId}/settings/interval}. */
public record IntervalRequest(
        @NotNull
        @Min(GuildSettings.MIN_INTERVAL_SECONDS)
        @Max(GuildSettings.MAX_INTERVAL_SECONDS)
        Integer seconds) { }
