package com.counteragent.argumentation.fallback;

import com.counteragent.argumentation.core.ArgumentStrength;
import com.counteragent.argumentation.core.EvaluationMode;
import com.counteragent.argumentation.core.ValidationResult;
import io.quarkus.logging.Log;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Degraded answers based only on the declared strength of counter-arguments. Used by callers when
 * the formal engine refuses a request; every result is tagged {@link EvaluationMode#HEURISTIC}.
 */
public final class HeuristicFallback {
    private HeuristicFallback() {}

    public static final String FORMAL_REPRESENTATION_UNAVAILABLE = "Not available (formal engine unavailable)";

    private static final Set<ArgumentStrength> ORIGINAL_SURVIVES =
            EnumSet.of(ArgumentStrength.WEAK, ArgumentStrength.MODERATE);
    private static final Set<ArgumentStrength> COUNTER_SUCCEEDS =
            EnumSet.of(ArgumentStrength.MODERATE, ArgumentStrength.STRONG, ArgumentStrength.DECISIVE);

    public static ValidationResult validate(ArgumentStrength counterStrength) {
        ArgumentStrength strength = counterStrength != null ? counterStrength : ArgumentStrength.MODERATE;
        boolean originalSurvives = ORIGINAL_SURVIVES.contains(strength);
        boolean counterSucceeds = COUNTER_SUCCEEDS.contains(strength);
        Log.debugf("Heuristic validation for %s counter: originalSurvives=%s, counterSucceeds=%s",
                strength.value(), originalSurvives, counterSucceeds);
        return new ValidationResult(true, originalSurvives, counterSucceeds, true,
                Optional.of(FORMAL_REPRESENTATION_UNAVAILABLE), EvaluationMode.HEURISTIC, Optional.empty());
    }

    /**
     * {@code (1 - k/N) * max(0.2, 1 - 0.1 N)} where {@code k} counts STRONG and DECISIVE counters,
     * or 1.0 when there are none.
     */
    public static double assess(List<ArgumentStrength> counterStrengths) {
        int total = counterStrengths.size();
        if (total == 0) {
            return 1.0;
        }
        long strong = counterStrengths.stream()
                .filter(s -> s != null && s.atLeast(ArgumentStrength.STRONG))
                .count();
        double strengthFactor = 1.0 - ((double) strong / total);
        double countFactor = Math.max(0.2, 1.0 - (0.1 * total));
        return strengthFactor * countFactor;
    }
}
