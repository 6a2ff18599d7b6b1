package com.phillippitts.insightbot.service.speaker;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;

import java.util.Optional;

/**
 * One source of speaker display names. Implementations are consulted in {@code @Order}.
 */
public interface SpeakerDirectory {

    Optional<String> lookup(GuildId guildId, SpeakerId speakerId);
}
