package com.counteragent.argumentation.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declared strength of a counter-argument, ordered from weakest to strongest. The formal engine
 * ignores it; only the heuristic fallback reads it.
 */
public enum ArgumentStrength {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong"),
    DECISIVE("decisive");

    private final String value;

    ArgumentStrength(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean atLeast(ArgumentStrength other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static ArgumentStrength fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Argument strength must be non-empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ArgumentStrength strength : values()) {
            if (strength.value.equals(normalized)) {
                return strength;
            }
        }
        throw new IllegalArgumentException("Unknown argument strength '" + raw + "'");
    }
}
