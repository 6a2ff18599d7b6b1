package com.phillippitts.insightbot.service.events;

import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.service.session.event.AnalysisCycleCompletedEvent;
import com.phillippitts.insightbot.service.voice.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason() + '-' + e.channel();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}, channel={}. Check audio device & permissions.", e.reason(), e.channel());
        }
    }

    @EventListener
    void onCycleCompleted(AnalysisCycleCompletedEvent e) {
        if (e.outcome() == CycleOutcome.RATE_LIMITED && shouldLog("rate-limit")) {
            LOG.warn("Analysis backend rate limit reached (guild={}). Cycles are skipped until quota recovers.",
                    e.guildId());
        } else if (e.outcome() == CycleOutcome.NO_CREDENTIAL && shouldLog("no-credential-" + e.guildId())) {
            LOG.warn("Guild {} has no API key configured. Set one via PUT /guilds/{}/settings/api-key "
                    + "or gemini.api-key.", e.guildId(), e.guildId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
