package com.phillippitts.insightbot.domain;

import java.util.Objects;

/**
 * Identity of a participant whose audio is captured. Display names are resolved separately.
 */
public record SpeakerId(String value) {

    public SpeakerId {
        Objects.requireNonNull(value, "speaker id must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("speaker id must not be blank");
        }
    }

    public static SpeakerId of(String value) {
        return new SpeakerId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
