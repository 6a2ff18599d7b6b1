package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.presentation.dto.ApiKeyRequest;
import com.phillippitts.insightbot.presentation.dto.IntervalRequest;
import com.phillippitts.insightbot.presentation.dto.ModeRequest;
import com.phillippitts.insightbot.presentation.dto.SettingsResponse;
import com.phillippitts.insightbot.service.settings.GuildSettingsStore;
import com.phillippitts.insightbot.service.settings.SettingKey;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-guild settings. A running session picks changes up at its next cycle.
 */
@RestController
@RequestMapping("/guilds/{guildId}/settings")
class SettingsController {

    private static final Logger LOG = LogManager.getLogger(SettingsController.class);

    private final GuildSettingsStore settingsStore;

    SettingsController(GuildSettingsStore settingsStore) {
        this.settingsStore = settingsStore;
    }

    @GetMapping
    ResponseEntity<SettingsResponse> get(@PathVariable String guildId) {
        GuildId id = GuildId.of(guildId);
        return ResponseEntity.ok(SettingsResponse.from(id, settingsStore.get(id)));
    }

    @PutMapping("/mode")
    ResponseEntity<SettingsResponse> setMode(@PathVariable String guildId, @Valid @RequestBody ModeRequest request) {
        return update(guildId, SettingKey.MODE, request.mode());
    }

    @PutMapping("/interval")
    ResponseEntity<SettingsResponse> setInterval(@PathVariable String guildId,
                                                 @Valid @RequestBody IntervalRequest request) {
        return update(guildId, SettingKey.INTERVAL, String.valueOf(request.seconds()));
    }

    @PutMapping("/api-key")
    ResponseEntity<SettingsResponse> setApiKey(@PathVariable String guildId,
                                               @Valid @RequestBody ApiKeyRequest request) {
        return update(guildId, SettingKey.API_KEY, request.apiKey());
    }

    @DeleteMapping("/api-key")
    ResponseEntity<SettingsResponse> clearApiKey(@PathVariable String guildId) {
        return update(guildId, SettingKey.API_KEY, null);
    }

    private ResponseEntity<SettingsResponse> update(String guildId, SettingKey key, String value) {
        GuildId id = GuildId.of(guildId);
        settingsStore.set(id, key, value);
        LOG.info("Setting updated: {}", key.column());
        return ResponseEntity.ok(SettingsResponse.from(id, settingsStore.get(id)));
    }
}
