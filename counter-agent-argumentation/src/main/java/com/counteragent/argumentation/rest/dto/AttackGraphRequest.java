package com.counteragent.argumentation.rest.dto;

import java.util.List;

/**
 * An original argument and every counter-argument raised against it. Used for strength
 * assessment and attack-graph rendering.
 */
public record AttackGraphRequest(String originalId, List<CounterPayload> counters) {

    public AttackGraphRequest {
        counters = counters == null ? List.of() : List.copyOf(counters);
    }
}
