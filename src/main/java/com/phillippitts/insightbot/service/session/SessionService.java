package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.config.properties.GeminiProperties;
import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.domain.StartResult;
import com.phillippitts.insightbot.service.publish.PublishTarget;
import com.phillippitts.insightbot.service.publish.ReportChannels;
import com.phillippitts.insightbot.service.publish.ReportPublisher;
import com.phillippitts.insightbot.service.settings.GuildSettingsStore;
import com.phillippitts.insightbot.service.voice.VoiceGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for guild session commands: start, stop, analyze now and status.
 */
@Service
public class SessionService {

    private static final Logger LOG = LogManager.getLogger(SessionService.class);
    private static final int MAX_START_ATTEMPTS = 3;

    private final SessionRegistry registry;
    private final VoiceGateway voiceGateway;
    private final ReportChannels reportChannels;
    private final ReportPublisher reportPublisher;
    private final GuildSettingsStore settingsStore;
    private final GeminiProperties geminiProperties;
    private final Clock clock;

    public SessionService(SessionRegistry registry,
                          VoiceGateway voiceGateway,
                          ReportChannels reportChannels,
                          ReportPublisher reportPublisher,
                          GuildSettingsStore settingsStore,
                          GeminiProperties geminiProperties,
                          Clock clock) {
        this.registry = registry;
        this.voiceGateway = voiceGateway;
        this.reportChannels = reportChannels;
        this.reportPublisher = reportPublisher;
        this.settingsStore = settingsStore;
        this.geminiProperties = geminiProperties;
        this.clock = clock;
    }

    /**
     * Joins {@code voiceChannel} and starts capturing; reports go to {@code textChannel}.
     *
     * @throws com.phillippitts.insightbot.exception.TransportException if the voice channel cannot be joined
     */
    public StartResult start(GuildId guildId, String voiceChannel, String textChannel) {
        GuildSettings settings = settingsStore.get(guildId);
        String credential = settings.hasApiKey()
                ? settings.apiKey()
                : (geminiProperties.hasFallbackKey() ? geminiProperties.apiKey() : null);
        PublishTarget target = reportChannels.open(guildId, textChannel);

        StartResult result = StartResult.SESSION_CLOSED;
        for (int attempt = 0; attempt < MAX_START_ATTEMPTS && result == StartResult.SESSION_CLOSED; attempt++) {
            GuildSession session = registry.getOrCreate(guildId);
            result = session.start(() -> voiceGateway.connect(voiceChannel), target, credential);
        }
        if (result == StartResult.STARTED) {
            if (credential == null) {
                LOG.warn("Guild {} started without an API key; cycles will report a missing credential", guildId);
            }
            try {
                reportPublisher.publishStarted(target, settings);
            } catch (RuntimeException e) {
                LOG.warn("Failed to post start notice for guild {}: {}", guildId, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Stops the guild's session and removes it from the registry.
     *
     * @return {@code false} if the guild had no capturing session
     */
    public boolean stop(GuildId guildId, boolean skipFinal) {
        return registry.remove(guildId, skipFinal);
    }

    /**
     * Requests an immediate analysis.
     *
     * @return the pending cycle, or empty if the guild is not capturing
     */
    public Optional<CompletableFuture<CycleOutcome>> analyzeNow(GuildId guildId) {
        return registry.find(guildId)
                .filter(GuildSession::isCapturing)
                .map(GuildSession::forceAnalysis);
    }

    public SessionStatus status(GuildId guildId) {
        Optional<GuildSession> found = registry.find(guildId);
        if (found.isEmpty()) {
            return SessionStatus.idle(guildId);
        }
        GuildSession session = found.get();
        Instant next = session.nextCycleAt().orElse(null);
        Long secondsLeft = next == null ? null : Math.max(0, Duration.between(clock.instant(), next).toSeconds());
        return new SessionStatus(guildId, session.state(), next, secondsLeft,
                session.context().length(), session.bufferedBytes());
    }
}
