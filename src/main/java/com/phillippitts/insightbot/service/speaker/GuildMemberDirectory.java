package com.phillippitts.insightbot.service.speaker;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guild-scoped member names (nicknames), registered through the speaker endpoint.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GuildMemberDirectory implements SpeakerDirectory {

    private final Map<GuildId, Map<SpeakerId, String>> members = new ConcurrentHashMap<>();

    @Override
    public Optional<String> lookup(GuildId guildId, SpeakerId speakerId) {
        Map<SpeakerId, String> guild = members.get(guildId);
        return guild == null ? Optional.empty() : Optional.ofNullable(guild.get(speakerId));
    }

    public void register(GuildId guildId, SpeakerId speakerId, String displayName) {
        Objects.requireNonNull(guildId, "guildId must not be null");
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must not be blank");
        }
        members.computeIfAbsent(guildId, k -> new ConcurrentHashMap<>()).put(speakerId, displayName.trim());
    }

    /** @return {@code true} if a name was registered and is now removed */
    public boolean forget(GuildId guildId, SpeakerId speakerId) {
        Map<SpeakerId, String> guild = members.get(guildId);
        return guild != null && guild.remove(speakerId) != null;
    }

    public Map<SpeakerId, String> members(GuildId guildId) {
        Map<SpeakerId, String> guild = members.get(guildId);
        return guild == null ? Map.of() : Map.copyOf(guild);
    }
}
