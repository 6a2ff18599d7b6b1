package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code PUT /guilds/{guildId}/speakers/{speakerId}}. */
public record SpeakerNameRequest(@NotBlank @Size(max = 100) String displayName) { }
