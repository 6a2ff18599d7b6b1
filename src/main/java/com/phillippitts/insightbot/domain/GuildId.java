package com.phillippitts.insightbot.domain;

import java.util.Objects;

/**
 * Opaque, stable identity of a guild. Used as the session registry key.
 */
public record GuildId(String value) {

    public GuildId {
        Objects.requireNonNull(value, "guild id must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("guild id must not be blank");
        }
    }

    public static GuildId of(String value) {
        return new GuildId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
