package com.counteragent.argumentation.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of counter-argument, as declared by whoever produced it. Drives the attack pattern used by
 * {@link AttackGraphBuilder}.
 */
public enum CounterArgumentType {
    DIRECT_REFUTATION("direct_refutation"),
    COUNTER_EXAMPLE("counter_example"),
    ALTERNATIVE_EXPLANATION("alternative_explanation"),
    PREMISE_CHALLENGE("premise_challenge"),
    REDUCTIO_AD_ABSURDUM("reductio_ad_absurdum");

    private final String value;

    CounterArgumentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves either the wire value ({@code counter_example}) or the constant name, ignoring case.
     */
    @JsonCreator
    public static CounterArgumentType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Counter-argument type must be non-empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CounterArgumentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown counter-argument type '" + raw + "'");
    }
}
