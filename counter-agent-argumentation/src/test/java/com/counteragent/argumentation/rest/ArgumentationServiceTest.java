package com.counteragent.argumentation.rest;

import com.counteragent.argumentation.core.ArgumentationEngine;
import com.counteragent.argumentation.core.ExtensionCalculator;
import com.counteragent.argumentation.exceptions.AttackGraphBuildException;
import com.counteragent.argumentation.rest.dto.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentationServiceTest {

    private final ArgumentationService service = new ArgumentationService(new ArgumentationEngine(), true);

    @Test
    void testFormalValidation() {
        ValidationPayload payload = service.validate(new ValidationRequest("claim",
                new CounterPayload("rebuttal", "direct_refutation", "strong")));

        assertTrue(payload.validAttack());
        assertFalse(payload.originalSurvives());
        assertEquals("FORMAL", payload.mode());
        assertEquals("{rebuttal}", payload.extensions().grounded());
        assertEquals(List.of("{rebuttal}"), payload.extensions().complete());
    }

    @Test
    void testBuildErrorFallsBackToHeuristic() {
        ValidationPayload payload = service.validate(new ValidationRequest("same",
                new CounterPayload("same", "counter_example", "weak")));

        assertEquals("HEURISTIC", payload.mode());
        assertTrue(payload.validAttack());
        assertTrue(payload.originalSurvives());
        assertFalse(payload.counterSucceeds());
        assertNull(payload.extensions());
    }

    @Test
    void testBuildErrorWithoutFallback() {
        ArgumentationService strict = new ArgumentationService(new ArgumentationEngine(), false);
        assertThrows(AttackGraphBuildException.class, () -> strict.validate(new ValidationRequest("same",
                new CounterPayload("same", "counter_example", "weak"))));
    }

    @Test
    void testDefaultIdentities() {
        AttackGraphPayload graph = service.attackGraph(new AttackGraphRequest(null, List.of(
                new CounterPayload(null, "premise_challenge", null),
                new CounterPayload(null, "alternative_explanation", null))));

        assertEquals(List.of("original", "counter_0", "counter_1", "conclusion"),
                graph.nodes().stream().map(AttackGraphPayload.Node::id).toList());
        assertEquals("OUT", graph.nodes().get(0).label());
        assertEquals("counter", graph.nodes().get(1).role());
        assertEquals("premise_challenge", graph.nodes().get(1).counterType());
        assertEquals("conclusion", graph.nodes().get(3).role());
        assertEquals(List.of("counter_0", "counter_1"), graph.grounded());
        assertEquals(List.of(List.of("counter_0", "counter_1")), graph.complete());
        assertEquals("FORMAL", graph.mode());
    }

    @Test
    void testOversizedStrengthUsesGroundedScoring() {
        ArgumentationService capped = new ArgumentationService(
                new ArgumentationEngine(new ExtensionCalculator(3), true), true);
        List<CounterPayload> counters = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            counters.add(new CounterPayload(null, "direct_refutation", "moderate"));
        }
        StrengthPayload payload = capped.assess(new AttackGraphRequest("claim", counters));

        assertEquals("GROUNDED_ONLY", payload.mode());
        assertEquals(0.0, payload.score());
    }

    @Test
    void testDuplicateCountersFallBackForStrength() {
        StrengthPayload payload = service.assess(new AttackGraphRequest("claim", List.of(
                new CounterPayload("x", "direct_refutation", "strong"),
                new CounterPayload("x", "direct_refutation", "weak"))));

        assertEquals("HEURISTIC", payload.mode());
        assertEquals(0.4, payload.score(), 1e-9);
    }

    @Test
    void testAttackGraphText() {
        assertEquals("Attack graph not available.", service.attackGraphText(new AttackGraphRequest("claim", List.of())));
    }
}
