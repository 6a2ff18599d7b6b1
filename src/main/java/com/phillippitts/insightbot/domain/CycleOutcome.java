package com.phillippitts.insightbot.domain;

/**
 * Result of a single analysis cycle as seen by the session.
 */
public enum CycleOutcome {
    /** Session was not capturing or the cycle was cancelled before it ran. */
    SKIPPED,
    /** Nothing was buffered since the previous flush. */
    NO_AUDIO,
    /** Every speaker's conversion failed. */
    NO_ARTIFACTS,
    REPORTED,
    EMPTY_REPORT,
    NO_CREDENTIAL,
    RATE_LIMITED,
    UPLOAD_FAILED,
    FAILED;

    /** Maps an analysis result kind to its cycle outcome; blank reports are classified by the caller. */
    public static CycleOutcome of(AnalysisResult.Kind kind) {
        return switch (kind) {
            case SUCCESS -> REPORTED;
            case NO_CREDENTIAL -> NO_CREDENTIAL;
            case RATE_LIMITED -> RATE_LIMITED;
            case UPLOAD_FAILED -> UPLOAD_FAILED;
            case FAILURE -> FAILED;
        };
    }
}
