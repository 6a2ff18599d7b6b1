/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.insightbot.exception.InsightBotException}
 * and are mapped to HTTP responses by the presentation layer's exception handler.
 * Failures inside an analysis cycle are not exceptions; they are reported as
 * {@link com.phillippitts.insightbot.domain.AnalysisResult} values.
 *
 * <ul>
 *   <li>{@link com.phillippitts.insightbot.exception.TransportException} - voice transport
 *       could not be acquired at session start</li>
 *   <li>{@link com.phillippitts.insightbot.exception.AudioConversionException} - one speaker's
 *       audio could not be converted</li>
 *   <li>{@link com.phillippitts.insightbot.exception.InvalidSettingException} - rejected guild setting</li>
 *   <li>{@link com.phillippitts.insightbot.exception.SessionStateException} - lifecycle command
 *       does not match the session state</li>
 *   <li>{@link com.phillippitts.insightbot.exception.SessionCapacityException} - no capacity to
 *       host another session</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.insightbot.exception;
