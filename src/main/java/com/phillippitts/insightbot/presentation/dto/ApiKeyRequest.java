package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT /guilds/{guildId}/settings/api-key}. */
public record ApiKeyRequest(@NotBlank String apiKey) {

    @Override
    public String toString() {
        return "ApiKeyRequest[apiKey=****]";
    }
}
