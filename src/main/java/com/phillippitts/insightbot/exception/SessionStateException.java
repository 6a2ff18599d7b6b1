package com.phillippitts.insightbot.exception;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SessionState;

/**
 * Thrown when a lifecycle command does not match the guild's current session state,
 * e.g. starting while already capturing or stopping a guild with no session.
 */
public class SessionStateException extends InsightBotException {

    private final GuildId guildId;
    private final SessionState state;

    public SessionStateException(GuildId guildId, SessionState state, String message) {
        super(message + " (guild: " + guildId + ", state: " + state + ")");
        this.guildId = guildId;
        this.state = state;
    }

    public GuildId getGuildId() {
        return guildId;
    }

    public SessionState getState() {
        return state;
    }
}
