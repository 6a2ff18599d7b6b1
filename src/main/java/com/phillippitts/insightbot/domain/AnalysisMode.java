package com.phillippitts.insightbot.domain;

import java.util.Locale;

/**
 * Kind of report the analysis backend is asked to produce.
 */
public enum AnalysisMode {
    /** Positions, conflict structure, fact checks and compromise proposals. */
    DEBATE("debate"),
    /** Catch-up summary for participants joining late. */
    SUMMARY("summary");

    private final String value;

    AnalysisMode(String value) {
        this.value = value;
    }

    /** Lower-case value as stored and accepted over the API. */
    public String value() {
        return value;
    }

    /**
     * Parses a mode name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known mode
     */
    public static AnalysisMode parse(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (AnalysisMode mode : values()) {
                if (mode.value.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown analysis mode: " + name);
    }

    /** Lenient variant used when reading stored values. */
    public static AnalysisMode parseOrDefault(String name, AnalysisMode fallback) {
        try {
            return parse(name);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
