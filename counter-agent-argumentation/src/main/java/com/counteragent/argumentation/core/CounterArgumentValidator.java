package com.counteragent.argumentation.core;

import io.quarkus.logging.Log;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a single counter-argument defeats the original under grounded and complete
 * semantics.
 */
public final class CounterArgumentValidator {

    private final ExtensionCalculator calculator;
    private final boolean includeFormalRepresentation;

    public CounterArgumentValidator(ExtensionCalculator calculator) {
        this(calculator, true);
    }

    public CounterArgumentValidator(ExtensionCalculator calculator, boolean includeFormalRepresentation) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.includeFormalRepresentation = includeFormalRepresentation;
    }

    /**
     * @throws com.counteragent.argumentation.exceptions.AttackGraphBuildException if the two
     *         identities cannot form a graph
     * @throws com.counteragent.argumentation.exceptions.TooLargeException if the enumeration cap is
     *         configured below the size of the graph
     */
    public ValidationResult validate(ArgumentRef original, ArgumentRef counter, CounterArgumentType type) {
        ArgumentationFramework af = AttackGraphBuilder.build(original, new CounterAttack(counter, type));

        Extension grounded = calculator.grounded(af);
        List<Extension> complete = calculator.complete(af, grounded);
        ExtensionSummary summary = new ExtensionSummary(grounded, complete);

        boolean isValidAttack = grounded.contains(counter) && !grounded.contains(original);
        boolean originalSurvives = summary.credulouslyAccepted(original);
        boolean counterSucceeds = grounded.contains(counter) || summary.credulouslyAccepted(counter);
        // always true for a finite framework, kept for compatibility
        boolean logicalConsistency = !complete.isEmpty();

        Optional<String> formal = includeFormalRepresentation
                ? Optional.of(AttackGraphRenderer.render(af, summary))
                : Optional.empty();

        Log.debugf("Validated %s counter '%s' against '%s': validAttack=%s, originalSurvives=%s, counterSucceeds=%s",
                type.value(), counter, original, isValidAttack, originalSurvives, counterSucceeds);

        return new ValidationResult(isValidAttack, originalSurvives, counterSucceeds, logicalConsistency,
                formal, EvaluationMode.FORMAL, Optional.of(summary));
    }
}
