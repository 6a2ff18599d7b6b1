/**
 * Domain values shared by the session engine and its collaborators.
 *
 * <p>All types are immutable. {@link com.phillippitts.insightbot.domain.AnalysisResult} carries
 * analysis failures as typed values so that the session never classifies errors from message text.
 *
 * @since 1.0
 */
package com.phillippitts.insightbot.domain;
