package com.phillippitts.insightbot.service.publish;

import com.phillippitts.insightbot.domain.GuildId;

/**
 * Resolves a guild's text channel into a {@link PublishTarget}.
 */
public interface ReportChannels {

    PublishTarget open(GuildId guildId, String channelId);
}
