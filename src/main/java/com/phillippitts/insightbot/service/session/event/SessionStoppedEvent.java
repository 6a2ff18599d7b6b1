package com.phillippitts.insightbot.service.session.event;

import com.phillippitts.insightbot.domain.GuildId;

import java.time.Instant;

/**
 * Published after a guild session has been torn down.
 *
 * @param finalCycle whether a final analysis cycle ran before teardown
 */
public record SessionStoppedEvent(GuildId guildId, boolean finalCycle, Instant at) { }
