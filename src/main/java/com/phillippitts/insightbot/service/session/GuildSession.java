package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.domain.CycleTrigger;
import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.domain.SessionState;
import com.phillippitts.insightbot.domain.StartResult;
import com.phillippitts.insightbot.exception.SessionCapacityException;
import com.phillippitts.insightbot.service.audio.AudioAccumulator;
import com.phillippitts.insightbot.service.publish.PublishTarget;
import com.phillippitts.insightbot.service.session.event.AnalysisCycleCompletedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStartedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStoppedEvent;
import com.phillippitts.insightbot.service.settings.GuildSettingsStore;
import com.phillippitts.insightbot.service.voice.CaptureHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State machine for one guild's capture session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → CAPTURING            (start)
 * CAPTURING → STOPPING → IDLE (stop; the session is then retired)
 * </pre>
 *
 * <p>The capture handle, accumulator and publish target live in one {@link ActiveCapture}
 * value, so they are attached and cleared together: the session is CAPTURING exactly while
 * one is held.
 *
 * <p><b>Thread Safety:</b> start and stop are serialized by the lifecycle lock; a start that
 * finds the lock held is rejected instead of queued. Cycles are serialized by the cycle lock
 * and, apart from the final one, only ever run on the session's {@link CycleScheduler} loop.
 * Stop cancels and awaits the loop before it runs the final cycle and releases the transport.
 *
 * @since 1.0
 */
public class GuildSession {

    private static final Logger LOG = LogManager.getLogger(GuildSession.class);
    private static final DateTimeFormatter SESSION_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final GuildId guildId;
    private final GuildSettingsStore settingsStore;
    private final AnalysisCycle cycle;
    private final Executor loopExecutor;
    private final SessionProperties props;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile SessionState state = SessionState.IDLE;
    private volatile ActiveCapture active;
    private volatile CycleScheduler scheduler;
    private volatile String context = "";
    private volatile GuildSettings settings = GuildSettings.defaults();
    private volatile Instant nextCycleAt;
    private volatile boolean retired;

    /** Resources held while capturing. */
    private record ActiveCapture(CaptureHandle handle,
                                 AudioAccumulator accumulator,
                                 PublishTarget target,
                                 String credential,
                                 String sessionStamp) {
    }

    public GuildSession(GuildId guildId,
                        GuildSettingsStore settingsStore,
                        AnalysisCycle cycle,
                        Executor loopExecutor,
                        SessionProperties props,
                        ApplicationEventPublisher events,
                        Clock clock) {
        this.guildId = Objects.requireNonNull(guildId);
        this.settingsStore = Objects.requireNonNull(settingsStore);
        this.cycle = Objects.requireNonNull(cycle);
        this.loopExecutor = Objects.requireNonNull(loopExecutor);
        this.props = Objects.requireNonNull(props);
        this.events = Objects.requireNonNull(events);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Starts capturing with an already connected handle.
     *
     * <p>When the start is rejected the handle is left untouched and stays the caller's to release.
     */
    public StartResult start(CaptureHandle handle, PublishTarget target, String credential) {
        Objects.requireNonNull(handle, "handle must not be null");
        return start(() -> handle, target, credential);
    }

    /**
     * Starts capturing; {@code connector} is only invoked once the session has accepted the start,
     * so a rejected start never touches the transport.
     *
     * @param connector  acquires the capture handle
     * @param target     channel reports and notices are published to
     * @param credential analysis credential used when the guild has no key of its own; may be null
     * @return the start result
     * @throws com.phillippitts.insightbot.exception.TransportException if the transport cannot be
     *         acquired or recording cannot start; nothing is left attached
     * @throws SessionCapacityException if no session loop thread is available
     */
    public StartResult start(Supplier<CaptureHandle> connector, PublishTarget target, String credential) {
        Objects.requireNonNull(connector, "connector must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (!lifecycleLock.tryLock()) {
            LOG.info("Start rejected for guild {}: lifecycle transition in progress", guildId);
            return StartResult.ALREADY_CAPTURING;
        }
        try {
            if (retired) {
                return StartResult.SESSION_CLOSED;
            }
            if (state != SessionState.IDLE || active != null) {
                return StartResult.ALREADY_CAPTURING;
            }
            CaptureHandle handle = connector.get();
            AudioAccumulator accumulator = new AudioAccumulator();
            CycleScheduler newScheduler = new CycleScheduler(this, props.toDuration(props.getCountdownStep()));
            try {
                handle.startRecording(accumulator::append);
                active = new ActiveCapture(handle, accumulator, target, credential,
                        LocalDateTime.now(clock).format(SESSION_STAMP));
                context = "";
                refreshSettings();
                newScheduler.start(loopExecutor);
                // Published only after the loop executor accepted the task.
                scheduler = newScheduler;
                state = SessionState.CAPTURING;
            } catch (RuntimeException e) {
                state = SessionState.IDLE;
                scheduler = null;
                active = null;
                release(handle);
                if (e instanceof RejectedExecutionException) {
                    throw new SessionCapacityException("No session loop available for guild " + guildId, e);
                }
                throw e;
            }
            LOG.info("Session started for guild {}: mode={}, interval={}",
                    guildId, settings.mode().value(), settings.intervalSeconds());
            publishQuietly(new SessionStartedEvent(guildId, clock.instant()));
            return StartResult.STARTED;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the session: cancel and await the loop, run the final cycle unless {@code skipFinal},
     * stop recording, disconnect, then clear the capture. Every step runs even if an earlier one
     * failed. The session is retired afterwards; callers remove it from the registry.
     *
     * @return {@code false} if the session was not capturing
     */
    public boolean stop(boolean skipFinal) {
        lifecycleLock.lock();
        try {
            if (state != SessionState.CAPTURING) {
                // Idle sessions are retired too; the registry drops them after this call.
                retired = true;
                return false;
            }
            state = SessionState.STOPPING;
            ActiveCapture capture = active;
            CycleScheduler loop = scheduler;
            LOG.info("Stopping session for guild {}: skipFinal={}", guildId, skipFinal);
            try {
                if (loop != null) {
                    loop.cancel();
                    if (!loop.awaitTermination(props.getStopAwaitTimeout())) {
                        LOG.warn("Session loop for guild {} did not stop within {}", guildId, props.getStopAwaitTimeout());
                    }
                }
                if (!skipFinal) {
                    runCycle(CycleTrigger.FINAL);
                }
            } finally {
                if (capture != null) {
                    release(capture.handle());
                }
                active = null;
                scheduler = null;
                nextCycleAt = null;
                state = SessionState.IDLE;
                retired = true;
            }
            LOG.info("Session stopped for guild {}", guildId);
            publishQuietly(new SessionStoppedEvent(guildId, !skipFinal, clock.instant()));
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Requests an immediate cycle on the session loop. The periodic phase is not reset.
     *
     * @return completes with the cycle's outcome, or {@link CycleOutcome#SKIPPED} if the session
     *         is not capturing or stops before the cycle runs
     */
    public CompletableFuture<CycleOutcome> forceAnalysis() {
        CycleScheduler loop = scheduler;
        if (state != SessionState.CAPTURING || loop == null) {
            return CompletableFuture.completedFuture(CycleOutcome.SKIPPED);
        }
        return loop.requestForce();
    }

    /**
     * Runs one cycle. Scheduled and manual cycles are skipped once a stop has been requested;
     * the final cycle runs while stopping.
     */
    CycleOutcome runCycle(CycleTrigger trigger) {
        cycleLock.lock();
        try {
            ActiveCapture capture = active;
            if (capture == null) {
                return CycleOutcome.SKIPPED;
            }
            SessionState current = state;
            if (!trigger.isFinal() && current != SessionState.CAPTURING) {
                return CycleOutcome.SKIPPED;
            }
            boolean hadGuildContext = ThreadContext.containsKey("guildId");
            if (!hadGuildContext) {
                ThreadContext.put("guildId", guildId.value());
            }
            try {
                return executeCycle(capture, trigger);
            } finally {
                if (!hadGuildContext) {
                    ThreadContext.remove("guildId");
                }
            }
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleOutcome executeCycle(ActiveCapture capture, CycleTrigger trigger) {
        GuildSettings snapshot = refreshSettings();
        String credential = snapshot.hasApiKey() ? snapshot.apiKey() : capture.credential();
        long startNanos = System.nanoTime();
        CycleOutcome outcome;
        try {
            CycleResult result = cycle.run(new CycleRequest(guildId, capture.accumulator(), capture.target(),
                    capture.sessionStamp(), context, snapshot.mode(), credential, trigger));
            if (result.newContext() != null) {
                context = result.newContext();
            }
            outcome = result.outcome();
        } catch (RuntimeException e) {
            LOG.error("Analysis cycle failed: trigger={}", trigger, e);
            outcome = CycleOutcome.FAILED;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        LOG.info("Analysis cycle finished: trigger={}, outcome={}, elapsed={}ms", trigger, outcome, elapsed.toMillis());
        publishQuietly(new AnalysisCycleCompletedEvent(guildId, trigger, outcome, elapsed, clock.instant()));
        return outcome;
    }

    /** Interval for the next wait, re-read from the settings store. */
    Duration currentInterval() {
        return props.toDuration(refreshSettings().intervalSeconds());
    }

    void markNextCycle(Duration untilNext) {
        nextCycleAt = untilNext == null ? null : clock.instant().plus(untilNext);
    }

    private GuildSettings refreshSettings() {
        try {
            settings = settingsStore.get(guildId);
        } catch (RuntimeException e) {
            LOG.warn("Settings lookup failed for guild {}; keeping cached settings: {}", guildId, e.getMessage());
        }
        return settings;
    }

    private void release(CaptureHandle handle) {
        try {
            handle.stopRecording();
        } catch (RuntimeException e) {
            LOG.warn("Failed to stop recording for guild {}: {}", guildId, e.getMessage());
        }
        try {
            handle.disconnect();
        } catch (RuntimeException e) {
            LOG.warn("Failed to disconnect transport for guild {}: {}", guildId, e.getMessage());
        }
    }

    private void publishQuietly(Object event) {
        try {
            events.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    public GuildId guildId() {
        return guildId;
    }

    public SessionState state() {
        return state;
    }

    public boolean isCapturing() {
        return state == SessionState.CAPTURING;
    }

    /** {@code true} once stopped; a retired session never starts again. */
    public boolean isRetired() {
        return retired;
    }

    /** Rolling context carried into the next analysis. */
    public String context() {
        return context;
    }

    /** Settings snapshot taken at the last cycle or start. */
    public GuildSettings settings() {
        return settings;
    }

    /** When the next scheduled cycle is due; best effort, empty when no wait is in progress. */
    public Optional<Instant> nextCycleAt() {
        return Optional.ofNullable(nextCycleAt);
    }

    public long bufferedBytes() {
        ActiveCapture capture = active;
        return capture == null ? 0 : capture.accumulator().bufferedBytes();
    }
}
