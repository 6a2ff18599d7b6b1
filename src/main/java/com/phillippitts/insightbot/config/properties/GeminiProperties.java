package com.phillippitts.insightbot.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Gemini analysis backend.
 * Binds to properties prefixed with "gemini".
 *
 * @param baseUrl       REST base URL, e.g. {@code https://generativelanguage.googleapis.com/v1beta}
 * @param uploadBaseUrl Files API upload base URL
 * @param model         model used for generateContent
 * @param apiKey        process-wide fallback key used when a guild has none; may be blank
 * @param pollAttempts  how many times an uploaded file is polled for the ACTIVE state
 * @param pollInterval  delay between polls
 * @param timeout       read timeout for backend requests
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
        @NotBlank(message = "Gemini base URL must not be blank")
        String baseUrl,

        @NotBlank(message = "Gemini upload base URL must not be blank")
        String uploadBaseUrl,

        @NotBlank(message = "Gemini model must not be blank")
        String model,

        String apiKey,

        @Positive(message = "Poll attempts must be positive")
        int pollAttempts,

        @NotNull
        Duration pollInterval,

        @NotNull
        Duration timeout
) {
    public boolean hasFallbackKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
