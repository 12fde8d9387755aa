package com.counteragent.argumentation.core;

import com.counteragent.argumentation.exceptions.ArgumentationException;
import com.counteragent.argumentation.exceptions.AttackGraphBuildException;
import io.quarkus.logging.Log;

import java.util.List;
import java.util.Objects;

/**
 * Translates an original argument and its typed counter-arguments into an attack graph.
 * <p>
 * Attack patterns per {@link CounterArgumentType}:
 * <ul>
 *   <li>DIRECT_REFUTATION, PREMISE_CHALLENGE, COUNTER_EXAMPLE, REDUCTIO_AD_ABSURDUM:
 *       {@code counter -> original}</li>
 *   <li>ALTERNATIVE_EXPLANATION: an auxiliary {@link #CONCLUSION} node attacked by both
 *       {@code original} and {@code counter}</li>
 * </ul>
 * Counters never attack each other. All ALTERNATIVE_EXPLANATION counters share the one
 * {@code conclusion} node.
 */
public final class AttackGraphBuilder {

    public static final ArgumentRef CONCLUSION = ArgumentRef.of("conclusion");

    private AttackGraphBuilder() {}

    public static ArgumentationFramework build(ArgumentRef original, CounterAttack counter) {
        return build(original, List.of(counter));
    }

    /**
     * Builds and seals the framework.
     *
     * @throws AttackGraphBuildException if identities collide (two counters with the same id, a
     *                                   counter reusing the original's id, or an id clashing with
     *                                   the auxiliary conclusion node)
     */
    public static ArgumentationFramework build(ArgumentRef original, List<CounterAttack> counters) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(counters, "counters");
        ArgumentationFramework af = new ArgumentationFramework();
        try {
            af.addNode(original);
            for (CounterAttack counter : counters) {
                af.addNode(counter.counter());
            }
            boolean needsConclusion = counters.stream()
                    .anyMatch(c -> c.type() == CounterArgumentType.ALTERNATIVE_EXPLANATION);
            if (needsConclusion && af.contains(CONCLUSION)) {
                throw new ArgumentationException(
                        "Argument id '" + CONCLUSION + "' is reserved for alternative explanations");
            }
            for (CounterAttack counter : counters) {
                addAttackPattern(af, original, counter);
            }
        } catch (ArgumentationException e) {
            throw new AttackGraphBuildException(
                    String.format("Cannot build attack graph for '%s' with %d counter(s): %s",
                            original, counters.size(), e.getMessage()), e);
        }
        Log.debugf("Built attack graph for '%s': %d arguments, %d attacks",
                original, af.size(), af.attacks().size());
        return af.seal();
    }

    private static void addAttackPattern(ArgumentationFramework af, ArgumentRef original, CounterAttack counter) {
        ArgumentRef attacker = counter.counter();
        switch (counter.type()) {
            case DIRECT_REFUTATION, PREMISE_CHALLENGE, COUNTER_EXAMPLE, REDUCTIO_AD_ABSURDUM ->
                    af.addAttack(attacker, original);
            case ALTERNATIVE_EXPLANATION -> {
                // both explanations attack a shared conclusion instead of each other
                af.addNodeIfAbsent(CONCLUSION);
                af.addAttack(original, CONCLUSION);
                af.addAttack(attacker, CONCLUSION);
            }
        }
    }
}
