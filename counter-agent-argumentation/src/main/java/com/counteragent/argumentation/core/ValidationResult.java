package com.counteragent.argumentation.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of checking one counter-argument against one original argument.
 *
 * @param isValidAttack         the counter is skeptically accepted and the original is not
 * @param originalSurvives      some complete extension still accepts the original
 * @param counterSucceeds       the counter is accepted by the grounded or some complete extension
 * @param logicalConsistency    at least one complete extension exists
 * @param formalRepresentation  display-only dump of the graph and its extensions
 * @param mode                  how the result was obtained
 * @param extensions            the computed extensions, absent for heuristic results
 */
public record ValidationResult(boolean isValidAttack,
                               boolean originalSurvives,
                               boolean counterSucceeds,
                               boolean logicalConsistency,
                               Optional<String> formalRepresentation,
                               EvaluationMode mode,
                               Optional<ExtensionSummary> extensions) {

    public ValidationResult {
        formalRepresentation = formalRepresentation == null ? Optional.empty() : formalRepresentation;
        extensions = extensions == null ? Optional.empty() : extensions;
        Objects.requireNonNull(mode, "mode");
    }

    public boolean isFormal() {
        return mode == EvaluationMode.FORMAL;
    }
}
