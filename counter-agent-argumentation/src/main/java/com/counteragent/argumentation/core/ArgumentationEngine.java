package com.counteragent.argumentation.core;

import io.quarkus.logging.Log;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the argumentation engine: counter-argument validation, strength assessment and
 * attack-graph generation. Every call builds and consumes its own framework, so one engine can
 * serve concurrent callers.
 */
public final class ArgumentationEngine {

    public static final String ATTACK_GRAPH_UNAVAILABLE = "Attack graph not available.";

    private final ExtensionCalculator calculator;
    private final CounterArgumentValidator validator;
    private final StrengthAssessor assessor;

    public ArgumentationEngine() {
        this(new ExtensionCalculator(), true);
    }

    public ArgumentationEngine(ExtensionCalculator calculator, boolean includeFormalRepresentation) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.validator = new CounterArgumentValidator(calculator, includeFormalRepresentation);
        this.assessor = new StrengthAssessor(calculator);
    }

    public ExtensionCalculator calculator() {
        return calculator;
    }

    public ValidationResult validateCounterArgument(ArgumentRef original, CounterAttack counter) {
        return validator.validate(original, counter.counter(), counter.type());
    }

    public double assessArgumentStrength(ArgumentRef original, List<CounterAttack> counters) {
        return assessor.assess(original, counters);
    }

    public double assessArgumentStrengthGrounded(ArgumentRef original, List<CounterAttack> counters) {
        return assessor.assessGrounded(original, counters);
    }

    /**
     * Textual dump of the attack graph formed by all counters, or {@link #ATTACK_GRAPH_UNAVAILABLE}
     * when there are none.
     */
    public String generateAttackGraph(ArgumentRef original, List<CounterAttack> counters) {
        if (counters.isEmpty()) {
            return ATTACK_GRAPH_UNAVAILABLE;
        }
        return analyze(original, counters).render();
    }

    /**
     * Builds the attack graph and computes its grounded labelling, plus the complete extensions
     * when the graph is within the enumeration cap.
     */
    public AttackGraphAnalysis analyze(ArgumentRef original, List<CounterAttack> counters) {
        ArgumentationFramework af = AttackGraphBuilder.build(original, counters);
        Extension grounded = calculator.grounded(af);
        Optional<List<Extension>> complete = Optional.empty();
        if (calculator.canEnumerate(af)) {
            complete = Optional.of(calculator.complete(af, grounded));
        } else {
            Log.debugf("Skipping complete enumeration for %d arguments (cap %d)",
                    af.size(), calculator.enumerationCap());
        }
        return new AttackGraphAnalysis(af, grounded, Labelling.fromExtension(af, grounded), complete);
    }
}
