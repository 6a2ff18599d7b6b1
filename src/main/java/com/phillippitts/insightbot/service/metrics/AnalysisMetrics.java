package com.phillippitts.insightbot.service.metrics;

import com.phillippitts.insightbot.service.session.event.AnalysisCycleCompletedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStartedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStoppedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics tracking for guild sessions and analysis cycles.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Cycle counts per trigger and outcome</li>
 *   <li>Cycle latency per trigger</li>
 *   <li>Session starts and stops</li>
 * </ul>
 *
 * <p>Fed from application events, so the session engine carries no metrics dependency.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "insightbot";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onCycleCompleted(AnalysisCycleCompletedEvent event) {
        String trigger = tag(event.trigger());
        Counter.builder(METRIC_PREFIX + ".analysis.cycles")
                .description("Number of analysis cycles by trigger and outcome")
                .tag("trigger", trigger)
                .tag("outcome", tag(event.outcome()))
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".analysis.latency")
                .description("Time taken by an analysis cycle")
                .tag("trigger", trigger)
                .register(registry)
                .record(event.elapsed());
    }

    @EventListener
    public void onSessionStarted(SessionStartedEvent event) {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Number of sessions started")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onSessionStopped(SessionStoppedEvent event) {
        Counter.builder(METRIC_PREFIX + ".sessions.stopped")
                .description("Number of sessions stopped")
                .tag("final", Boolean.toString(event.finalCycle()))
                .register(registry)
                .increment();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
