package com.counteragent.argumentation.core;

import com.counteragent.argumentation.exceptions.AttackGraphBuildException;
import com.counteragent.argumentation.exceptions.DuplicateNodeException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttackGraphBuilderTest {

    private final ArgumentRef original = ArgumentRef.of("original");
    private final ArgumentRef counter = ArgumentRef.of("counter");

    @Test
    void testDirectAttackPatterns() {
        for (CounterArgumentType type : List.of(CounterArgumentType.DIRECT_REFUTATION,
                CounterArgumentType.PREMISE_CHALLENGE,
                CounterArgumentType.COUNTER_EXAMPLE,
                CounterArgumentType.REDUCTIO_AD_ABSURDUM)) {
            ArgumentationFramework af = AttackGraphBuilder.build(original, new CounterAttack(counter, type));

            assertEquals(Set.of(original, counter), af.nodes(), type.value());
            assertEquals(Set.of(new AttackEdge(counter, original)), af.attacks(), type.value());
            assertTrue(af.isSealed());
        }
    }

    @Test
    void testAlternativeExplanationAttacksConclusion() {
        ArgumentationFramework af = AttackGraphBuilder.build(original,
                new CounterAttack(counter, CounterArgumentType.ALTERNATIVE_EXPLANATION));

        assertEquals(Set.of(original, counter, AttackGraphBuilder.CONCLUSION), af.nodes());
        assertEquals(Set.of(
                new AttackEdge(original, AttackGraphBuilder.CONCLUSION),
                new AttackEdge(counter, AttackGraphBuilder.CONCLUSION)), af.attacks());
        assertFalse(af.attacks(counter, original));
    }

    @Test
    void testAlternativeExplanationsShareOneConclusion() {
        ArgumentationFramework af = AttackGraphBuilder.build(original, List.of(
                CounterAttack.of("counter_0", CounterArgumentType.ALTERNATIVE_EXPLANATION),
                CounterAttack.of("counter_1", CounterArgumentType.ALTERNATIVE_EXPLANATION)));

        assertEquals(4, af.size());
        assertEquals(3, af.attackersOf(AttackGraphBuilder.CONCLUSION).size());
    }

    @Test
    void testCountersNeverAttackEachOther() {
        ArgumentationFramework af = AttackGraphBuilder.build(original, List.of(
                CounterAttack.of("counter_0", CounterArgumentType.DIRECT_REFUTATION),
                CounterAttack.of("counter_1", CounterArgumentType.COUNTER_EXAMPLE),
                CounterAttack.of("counter_2", CounterArgumentType.ALTERNATIVE_EXPLANATION)));

        for (AttackEdge edge : af.attacks()) {
            assertTrue(edge.target().equals(original) || edge.target().equals(AttackGraphBuilder.CONCLUSION),
                    edge.toString());
        }
        assertEquals(Set.of(ArgumentRef.of("counter_0"), ArgumentRef.of("counter_1")), af.attackersOf(original));
    }

    @Test
    void testNoCountersYieldsSingleNode() {
        ArgumentationFramework af = AttackGraphBuilder.build(original, List.of());
        assertEquals(Set.of(original), af.nodes());
        assertTrue(af.attacks().isEmpty());
    }

    @Test
    void testDuplicateIdentityRejected() {
        AttackGraphBuildException ex = assertThrows(AttackGraphBuildException.class,
                () -> AttackGraphBuilder.build(original,
                        new CounterAttack(original, CounterArgumentType.DIRECT_REFUTATION)));
        assertInstanceOf(DuplicateNodeException.class, ex.getCause());
    }

    @Test
    void testReservedConclusionIdRejected() {
        assertThrows(AttackGraphBuildException.class, () -> AttackGraphBuilder.build(original, List.of(
                CounterAttack.of("conclusion", CounterArgumentType.DIRECT_REFUTATION),
                CounterAttack.of("counter_1", CounterArgumentType.ALTERNATIVE_EXPLANATION))));
    }

    @Test
    void testConclusionIdAllowedWithoutAlternativeExplanation() {
        ArgumentationFramework af = AttackGraphBuilder.build(original,
                CounterAttack.of("conclusion", CounterArgumentType.PREMISE_CHALLENGE));
        assertTrue(af.attacks(AttackGraphBuilder.CONCLUSION, original));
    }
}
