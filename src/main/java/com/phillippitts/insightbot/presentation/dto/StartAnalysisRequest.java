package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /guilds/{guildId}/analysis}.
 *
 * @param voiceChannel channel to join and record
 * @param textChannel  channel receiving notices and reports
 */
public record StartAnalysisRequest(@NotBlank String voiceChannel, @NotBlank String textChannel) { }
