package com.counteragent.argumentation.core;

import com.counteragent.argumentation.exceptions.AttackGraphBuildException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentationEngineTest {

    private final ArgumentationEngine engine = new ArgumentationEngine();
    private final ArgumentRef original = ArgumentRef.of("original");

    @Test
    void testValidateCounterArgument() {
        ValidationResult result = engine.validateCounterArgument(original,
                CounterAttack.of("counter", CounterArgumentType.REDUCTIO_AD_ABSURDUM));
        assertTrue(result.isValidAttack());
        assertFalse(result.originalSurvives());
    }

    @Test
    void testGenerateAttackGraph() {
        String graph = engine.generateAttackGraph(original, List.of(
                CounterAttack.of("counter_0", CounterArgumentType.DIRECT_REFUTATION),
                CounterAttack.of("counter_1", CounterArgumentType.ALTERNATIVE_EXPLANATION)));

        assertEquals("framework: <{conclusion,counter_0,counter_1,original},"
                        + "{(counter_0,original),(counter_1,conclusion),(original,conclusion)}>\n"
                        + "grounded: {counter_0,counter_1}\n"
                        + "complete: [{counter_0,counter_1}]",
                graph);
    }

    @Test
    void testGenerateAttackGraphWithoutCounters() {
        assertEquals(ArgumentationEngine.ATTACK_GRAPH_UNAVAILABLE, engine.generateAttackGraph(original, List.of()));
    }

    @Test
    void testAnalyzeAboveCapSkipsEnumeration() {
        ArgumentationEngine capped = new ArgumentationEngine(new ExtensionCalculator(2), true);
        AttackGraphAnalysis analysis = capped.analyze(original, List.of(
                CounterAttack.of("counter_0", CounterArgumentType.DIRECT_REFUTATION),
                CounterAttack.of("counter_1", CounterArgumentType.DIRECT_REFUTATION)));

        assertTrue(analysis.complete().isEmpty());
        assertEquals(EvaluationMode.GROUNDED_ONLY, analysis.mode());
        assertEquals(Label.OUT, analysis.groundedLabelling().labelOf(original));
        assertTrue(analysis.render().endsWith("grounded: {counter_0,counter_1}"));
    }

    @Test
    void testBuildErrorsPropagate() {
        assertThrows(AttackGraphBuildException.class, () -> engine.assessArgumentStrength(original, List.of(
                CounterAttack.of("dup", CounterArgumentType.DIRECT_REFUTATION),
                CounterAttack.of("dup", CounterArgumentType.COUNTER_EXAMPLE))));
    }

    @Test
    void testConcurrentCallsAgree() throws Exception {
        List<CounterAttack> counters = List.of(
                CounterAttack.of("counter_0", CounterArgumentType.ALTERNATIVE_EXPLANATION),
                CounterAttack.of("counter_1", CounterArgumentType.PREMISE_CHALLENGE));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Double>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> engine.assessArgumentStrength(original, counters)));
            }
            for (Future<Double> future : futures) {
                assertEquals(0.0, future.get(10, TimeUnit.SECONDS).doubleValue());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
