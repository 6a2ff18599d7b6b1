package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SessionState;

import java.time.Instant;

/**
 * Point-in-time view of a guild's session.
 *
 * @param nextCycleAt           when the next scheduled cycle is due, {@code null} when not waiting
 * @param secondsUntilNextCycle best-effort countdown, {@code null} when not waiting
 * @param contextChars          length of the rolling context
 * @param bufferedBytes         audio buffered since the last flush
 */
public record SessionStatus(GuildId guildId,
                            SessionState state,
                            Instant nextCycleAt,
                            Long secondsUntilNextCycle,
                            int contextChars,
                            long bufferedBytes) {

    public static SessionStatus idle(GuildId guildId) {
        return new SessionStatus(guildId, SessionState.IDLE, null, null, 0, 0);
    }
}
