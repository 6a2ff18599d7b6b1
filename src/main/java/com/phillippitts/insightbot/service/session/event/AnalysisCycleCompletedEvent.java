package com.phillippitts.insightbot.service.session.event;

import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.domain.CycleTrigger;
import com.phillippitts.insightbot.domain.GuildId;

import java.time.Duration;
import java.time.Instant;

/**
 * Published after every analysis cycle, whatever its outcome.
 */
public record AnalysisCycleCompletedEvent(GuildId guildId,
                                          CycleTrigger trigger,
                                          CycleOutcome outcome,
                                          Duration elapsed,
                                          Instant at) { }
