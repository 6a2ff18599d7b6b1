/**
 * Multi-tenant session lifecycle and scheduling engine.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.insightbot.service.session.SessionRegistry} - one session per guild,
 *       created lazily and removed after stop</li>
 *   <li>{@link com.phillippitts.insightbot.service.session.GuildSession} - IDLE/CAPTURING/STOPPING
 *       state machine owning the capture handle, accumulator and rolling context</li>
 *   <li>{@code CycleScheduler} - the session-owned loop running periodic and forced cycles</li>
 *   <li>{@link com.phillippitts.insightbot.service.session.AnalysisCycle} - flush, convert,
 *       analyze, publish and cleanup for one cycle</li>
 * </ul>
 *
 * <p>Ordering rules:
 * <ul>
 *   <li>Cycles of one session never overlap; cleanup of a cycle finishes before the next flush</li>
 *   <li>The interval is re-read before every wait; forcing a cycle does not move the deadline</li>
 *   <li>Stop cancels and awaits the loop, runs the optional final cycle, then releases the transport</li>
 *   <li>The rolling context only changes after a non-empty successful report</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.insightbot.service.session;
