package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.domain.CycleTrigger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The session-owned loop that drives every periodic and forced cycle of one session.
 *
 * <p>Each iteration re-reads the interval, waits until the deadline in countdown-step slices
 * and then runs a scheduled cycle. Forced cycles are queued to the loop and run while it
 * waits, without moving the deadline. Because every cycle runs on this one thread, cycles of a
 * session never overlap.
 *
 * <p>Cancellation is cooperative: {@link #cancel()} wakes the wait, an in-flight cycle is
 * allowed to finish, queued forces complete as {@link CycleOutcome#SKIPPED}.
 */
final class CycleScheduler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(CycleScheduler.class);

    private final GuildSession session;
    private final Duration countdownStep;
    private final BlockingQueue<Trigger> triggers = new LinkedBlockingQueue<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Object gate = new Object();

    private volatile boolean cancelled;
    private boolean closed; // guarded by gate

    /** A queued request; {@code result == null} only for the wake-up sent by cancel. */
    private record Trigger(CompletableFuture<CycleOutcome> result) {
        static final Trigger WAKE = new Trigger(null);
    }

    CycleScheduler(GuildSession session, Duration countdownStep) {
        this.session = session;
        this.countdownStep = countdownStep;
    }

    /**
     * Hands the loop to {@code executor}.
     *
     * @throws java.util.concurrent.RejectedExecutionException if no loop thread is available
     */
    void start(Executor executor) {
        executor.execute(this);
    }

    CompletableFuture<CycleOutcome> requestForce() {
        CompletableFuture<CycleOutcome> result = new CompletableFuture<>();
        synchronized (gate) {
            if (closed || cancelled) {
                result.complete(CycleOutcome.SKIPPED);
                return result;
            }
            triggers.add(new Trigger(result));
        }
        return result;
    }

    void cancel() {
        cancelled = true;
        triggers.add(Trigger.WAKE);
    }

    boolean isCancelled() {
        return cancelled;
    }

    /**
     * Waits for the loop to exit.
     *
     * @return {@code false} if the timeout elapsed or the caller was interrupted
     */
    boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void run() {
        ThreadContext.put("guildId", session.guildId().value());
        LOG.info("Session loop started");
        try {
            while (!cancelled) {
                try {
                    Duration interval = session.currentInterval();
                    long deadline = System.nanoTime() + interval.toNanos();
                    session.markNextCycle(interval);
                    if (!awaitDeadline(deadline) || cancelled) {
                        break;
                    }
                    session.runCycle(CycleTrigger.SCHEDULED);
                } catch (RuntimeException e) {
                    LOG.error("Session loop iteration failed; continuing", e);
                }
            }
        } finally {
            synchronized (gate) {
                closed = true;
            }
            drainPending();
            session.markNextCycle(null);
            LOG.info("Session loop stopped");
            terminated.countDown();
            ThreadContext.clearAll();
        }
    }

    /**
     * Waits until {@code deadlineNanos}, running forced cycles as they arrive.
     *
     * @return {@code true} when the deadline was reached, {@code false} when cancelled
     */
    private boolean awaitDeadline(long deadlineNanos) {
        long stepNanos = countdownStep.toNanos();
        while (!cancelled) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                return true;
            }
            Trigger trigger;
            try {
                trigger = triggers.poll(Math.min(remaining, stepNanos), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelled = true;
                return false;
            }
            if (trigger == null) {
                long left = deadlineNanos - System.nanoTime();
                if (left > 0) {
                    LOG.debug("Next analysis in {}ms", TimeUnit.NANOSECONDS.toMillis(left));
                }
            } else if (trigger.result() != null) {
                runForced(trigger.result());
            }
        }
        return false;
    }

    private void runForced(CompletableFuture<CycleOutcome> result) {
        if (cancelled) {
            result.complete(CycleOutcome.SKIPPED);
            return;
        }
        try {
            result.complete(session.runCycle(CycleTrigger.MANUAL));
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private void drainPending() {
        Trigger trigger;
        while ((trigger = triggers.poll()) != null) {
            if (trigger.result() != null) {
                trigger.result().complete(CycleOutcome.SKIPPED);
            }
        }
    }
}
