package com.counteragent.argumentation.core;

import com.counteragent.argumentation.exceptions.TooLargeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrengthAssessorTest {

    private final ArgumentRef original = ArgumentRef.of("original");
    private final StrengthAssessor assessor = new StrengthAssessor(new ExtensionCalculator());

    @Test
    void testNoCountersIsUndefeated() {
        assertEquals(1.0, assessor.assess(original, List.of()));
        assertEquals(1.0, assessor.assessGrounded(original, List.of()));
    }

    @Test
    void testSingleDirectRefutationDefeatsOriginal() {
        double before = assessor.assess(original, List.of());
        double after = assessor.assess(original,
                List.of(CounterAttack.of("counter_0", CounterArgumentType.DIRECT_REFUTATION)));

        assertEquals(0.0, after);
        assertTrue(after < before);
    }

    @Test
    void testAddingAttackersNeverRaisesScore() {
        List<CounterAttack> counters = new ArrayList<>();
        double previous = assessor.assess(original, counters);
        CounterArgumentType[] types = CounterArgumentType.values();
        for (int i = 0; i < 8; i++) {
            counters.add(CounterAttack.of("counter_" + i, types[i % types.length]));
            double current = assessor.assess(original, counters);
            assertTrue(current <= previous, "score rose after adding " + counters.get(i));
            assertTrue(current >= 0.0 && current <= 1.0);
            previous = current;
        }
    }

    @Test
    void testAlternativeExplanationKeepsFullStrength() {
        // original is unattacked: accepted by the single complete extension and by the grounded one
        double score = assessor.assess(original,
                List.of(CounterAttack.of("counter_0", CounterArgumentType.ALTERNATIVE_EXPLANATION)));
        assertEquals(1.0, score);
    }

    @Test
    void testMixedCountersDefeatOriginal() {
        double score = assessor.assess(original, List.of(
                CounterAttack.of("counter_0", CounterArgumentType.ALTERNATIVE_EXPLANATION),
                CounterAttack.of("counter_1", CounterArgumentType.PREMISE_CHALLENGE)));
        assertEquals(0.0, score);
    }

    @Test
    void testGroundedOnlyScoring() {
        assertEquals(0.0, assessor.assessGrounded(original,
                List.of(CounterAttack.of("counter_0", CounterArgumentType.COUNTER_EXAMPLE))));
        assertEquals(1.0, assessor.assessGrounded(original,
                List.of(CounterAttack.of("counter_0", CounterArgumentType.ALTERNATIVE_EXPLANATION))));
    }

    @Test
    void testOversizedCounterSetRequiresGroundedScoring() {
        StrengthAssessor capped = new StrengthAssessor(new ExtensionCalculator(4));
        List<CounterAttack> counters = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            counters.add(CounterAttack.of("counter_" + i, CounterArgumentType.DIRECT_REFUTATION));
        }
        assertThrows(TooLargeException.class, () -> capped.assess(original, counters));
        assertEquals(0.0, capped.assessGrounded(original, counters));
    }

    @Test
    void testClamp() {
        assertEquals(1.0, StrengthAssessor.clamp(1.5));
        assertEquals(0.0, StrengthAssessor.clamp(-0.1));
        assertEquals(0.25, StrengthAssessor.clamp(0.25));
    }
}
