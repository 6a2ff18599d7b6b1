/**
 * Audio buffering and artifact production.
 *
 * <p>{@link com.phillippitts.insightbot.service.audio.AudioAccumulator} buffers per-speaker PCM
 * between cycles. {@link com.phillippitts.insightbot.service.audio.ArtifactPipeline} writes a flush
 * to disk and converts each speaker through the configured
 * {@link com.phillippitts.insightbot.service.audio.AudioConverter}, returning a
 * {@link com.phillippitts.insightbot.service.audio.ConvertedBatch} that owns the temporary files.
 *
 * @since 1.0
 */
package com.phillippitts.insightbot.service.audio;
