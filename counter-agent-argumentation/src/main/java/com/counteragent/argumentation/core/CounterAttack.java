package com.counteragent.argumentation.core;

import java.util.Objects;

/**
 * A counter-argument identity together with its declared type.
 */
public record CounterAttack(ArgumentRef counter, CounterArgumentType type) {

    public CounterAttack {
        Objects.requireNonNull(counter, "counter");
        Objects.requireNonNull(type, "type");
    }

    public static CounterAttack of(String counterId, CounterArgumentType type) {
        return new CounterAttack(ArgumentRef.of(counterId), type);
    }
}
