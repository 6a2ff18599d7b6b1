package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT /guilds/{guildId}/settings/mode}: {@code debate} or {@code summary}. */
public record ModeRequest(@NotBlank String mode) { }
