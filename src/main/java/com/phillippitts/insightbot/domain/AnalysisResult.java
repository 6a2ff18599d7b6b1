package com.phillippitts.insightbot.domain;

import java.util.Objects;

/**
 * Typed outcome of one call to the analysis backend.
 *
 * <p>Failures are values, not exceptions: callers branch on {@link #kind()} and never inspect
 * message text to classify a failure.
 *
 * @param kind   classification of the outcome
 * @param report report text, non-null only for {@link Kind#SUCCESS} (may be blank)
 * @param detail diagnostic detail for failures, may be {@code null}
 */
public record AnalysisResult(Kind kind, String report, String detail) {

    public enum Kind {
        SUCCESS,
        NO_CREDENTIAL,
        RATE_LIMITED,
        UPLOAD_FAILED,
        FAILURE
    }

    public AnalysisResult {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.SUCCESS) {
            Objects.requireNonNull(report, "report must not be null on success");
        } else if (report != null) {
            throw new IllegalArgumentException("report is only allowed on success");
        }
    }

    public static AnalysisResult success(String report) {
        return new AnalysisResult(Kind.SUCCESS, report, null);
    }

    public static AnalysisResult noCredential() {
        return new AnalysisResult(Kind.NO_CREDENTIAL, null, "no API key configured");
    }

    public static AnalysisResult rateLimited(String detail) {
        return new AnalysisResult(Kind.RATE_LIMITED, null, detail);
    }

    public static AnalysisResult uploadFailed(String detail) {
        return new AnalysisResult(Kind.UPLOAD_FAILED, null, detail);
    }

    public static AnalysisResult failure(String detail) {
        return new AnalysisResult(Kind.FAILURE, null, detail);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
