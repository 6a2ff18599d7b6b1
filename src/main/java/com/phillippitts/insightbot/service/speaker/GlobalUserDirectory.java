package com.phillippitts.insightbot.service.speaker;

import com.phillippitts.insightbot.config.audio.AudioCaptureProperties;
import com.phillippitts.insightbot.config.properties.SpeakerDirectoryProperties;
import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide user names from {@code speakers.names.*}, plus the local capture speaker.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class GlobalUserDirectory implements SpeakerDirectory {

    private final Map<String, String> names;

    public GlobalUserDirectory(SpeakerDirectoryProperties properties, AudioCaptureProperties captureProperties) {
        Map<String, String> merged = new HashMap<>();
        if (captureProperties.getSpeakerName() != null) {
            merged.put(captureProperties.getSpeakerId(), captureProperties.getSpeakerName());
        }
        merged.putAll(properties.names());
        this.names = Map.copyOf(merged);
    }

    @Override
    public Optional<String> lookup(GuildId guildId, SpeakerId speakerId) {
        return Optional.ofNullable(names.get(speakerId.value()));
    }
}
