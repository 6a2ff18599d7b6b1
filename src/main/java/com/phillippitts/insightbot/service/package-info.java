/**
 * Service layer containing the session engine and the adapters it drives.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.session} - guild sessions, the analysis cycle and the session registry</li>
 *   <li>{@code service.audio} - per-speaker accumulation, PCM conversion and artifact batches</li>
 *   <li>{@code service.analysis} - analysis backend contract and the Gemini implementation</li>
 *   <li>{@code service.voice} - voice transport contract and the Java Sound implementation</li>
 *   <li>{@code service.publish} - report formatting and the report board</li>
 *   <li>{@code service.settings} - per-guild settings persistence</li>
 *   <li>{@code service.speaker} - speaker display name lookup</li>
 * </ul>
 *
 * <p>Services depend on domain models, never on the presentation layer, and throw domain
 * exceptions rather than HTTP exceptions.
 */
package com.phillippitts.insightbot.service;
