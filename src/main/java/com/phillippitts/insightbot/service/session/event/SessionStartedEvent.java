package com.phillippitts.insightbot.service.session.event;

import com.phillippitts.insightbot.domain.GuildId;

import java.time.Instant;

/**
 * Published when a guild session starts capturing.
 */
public record SessionStartedEvent(GuildId guildId, Instant at) { }
