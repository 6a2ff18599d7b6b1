package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.GuildId;

/**
 * Creates idle sessions for the registry.
 */
@FunctionalInterface
public interface GuildSessionFactory {

    GuildSession create(GuildId guildId);
}
