package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.SessionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide guild to session map. At most one live session per guild.
 *
 * <p>Sessions are created lazily on first access; a retired session still in the map is
 * replaced atomically. {@link #remove} runs the stop sequence and deletes the entry as its
 * last step, even if stopping failed.
 */
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<GuildId, GuildSession> sessions = new ConcurrentHashMap<>();
    private final GuildSessionFactory factory;

    public SessionRegistry(GuildSessionFactory factory) {
        this.factory = Objects.requireNonNull(factory);
    }

    public GuildSession getOrCreate(GuildId guildId) {
        Objects.requireNonNull(guildId, "guildId must not be null");
        return sessions.compute(guildId,
                (id, existing) -> existing == null || existing.isRetired() ? factory.create(id) : existing);
    }

    public Optional<GuildSession> find(GuildId guildId) {
        return Optional.ofNullable(sessions.get(guildId));
    }

    /**
     * Stops the guild's session and removes it.
     *
     * @return {@code true} if a capturing session was stopped
     */
    public boolean remove(GuildId guildId, boolean skipFinal) {
        GuildSession session = sessions.get(guildId);
        if (session == null) {
            return false;
        }
        try {
            return session.stop(skipFinal);
        } finally {
            sessions.remove(guildId, session);
        }
    }

    /** Number of sessions capturing or stopping. */
    public int activeCount() {
        int count = 0;
        for (GuildSession session : sessions.values()) {
            if (session.state() != SessionState.IDLE) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return sessions.size();
    }

    public List<GuildSession> snapshot() {
        return List.copyOf(sessions.values());
    }

    /** Stops every session without a final cycle. */
    public void shutdown() {
        List<GuildId> ids = List.copyOf(sessions.keySet());
        if (!ids.isEmpty()) {
            LOG.info("Shutting down {} session(s)", ids.size());
        }
        for (GuildId id : ids) {
            try {
                remove(id, true);
            } catch (RuntimeException e) {
                LOG.warn("Failed to stop session for guild {} during shutdown: {}", id, e.getMessage());
            }
        }
    }
}
