package com.phillippitts.insightbot.service.speaker;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SpeakerId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves display names at flush time by walking the directories in order.
 *
 * <p>Never fails: a directory that throws is skipped, and a speaker no directory knows gets
 * the synthetic name {@code User_<id>}. Results are not cached.
 */
@Component
public class SpeakerNameResolver {

    private static final Logger LOG = LogManager.getLogger(SpeakerNameResolver.class);

    private final List<SpeakerDirectory> directories;

    public SpeakerNameResolver(List<SpeakerDirectory> directories) {
        this.directories = List.copyOf(directories);
    }

    public Map<SpeakerId, String> resolve(GuildId guildId, Collection<SpeakerId> speakers) {
        Map<SpeakerId, String> names = new LinkedHashMap<>();
        for (SpeakerId speaker : speakers) {
            names.put(speaker, resolve(guildId, speaker));
        }
        return names;
    }

    public String resolve(GuildId guildId, SpeakerId speaker) {
        for (SpeakerDirectory directory : directories) {
            try {
                Optional<String> name = directory.lookup(guildId, speaker);
                if (name.isPresent() && !name.get().isBlank()) {
                    return name.get();
                }
            } catch (RuntimeException e) {
                LOG.warn("Speaker lookup failed in {} for {}: {}",
                        directory.getClass().getSimpleName(), speaker, e.getMessage());
            }
        }
        return syntheticName(speaker);
    }

    public static String syntheticName(SpeakerId speaker) {
        return "User_" + speaker.value();
    }
}
