package com.counteragent.argumentation.core;

import io.quarkus.logging.Log;

import java.util.List;
import java.util.Objects;

/**
 * Scores how much of an original argument's strength survives a set of counter-arguments,
 * on a scale from 0 (defeated) to 1 (undefeated).
 */
public final class StrengthAssessor {

    private final ExtensionCalculator calculator;

    public StrengthAssessor(ExtensionCalculator calculator) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
    }

    /**
     * Share of complete extensions accepting the original, averaged with 1.0 when the grounded
     * extension accepts it as well.
     *
     * @throws com.counteragent.argumentation.exceptions.TooLargeException if the graph exceeds the
     *         enumeration cap; use {@link #assessGrounded} instead
     */
    public double assess(ArgumentRef original, List<CounterAttack> counters) {
        if (counters.isEmpty()) {
            return 1.0;
        }
        ArgumentationFramework af = AttackGraphBuilder.build(original, counters);
        Extension grounded = calculator.grounded(af);
        ExtensionSummary summary = new ExtensionSummary(grounded, calculator.complete(af, grounded));

        double acceptanceRate = summary.complete().isEmpty()
                ? 0.0
                : (double) summary.acceptingCount(original) / summary.complete().size();
        if (summary.skepticallyAccepted(original)) {
            acceptanceRate = (acceptanceRate + 1.0) / 2.0;
        }
        double score = clamp(acceptanceRate);
        Log.debugf("Strength of '%s' against %d counter(s): %.3f (%d complete extension(s))",
                original, counters.size(), score, summary.complete().size());
        return score;
    }

    /**
     * Reduced score from the grounded labelling alone: IN scores 1.0, UNDEC 0.5 and OUT 0.0.
     * Polynomial, so usable above the enumeration cap.
     */
    public double assessGrounded(ArgumentRef original, List<CounterAttack> counters) {
        if (counters.isEmpty()) {
            return 1.0;
        }
        ArgumentationFramework af = AttackGraphBuilder.build(original, counters);
        Label label = calculator.groundedLabelling(af).labelOf(original);
        double score = switch (label) {
            case IN -> 1.0;
            case UNDEC -> 0.5;
            case OUT -> 0.0;
        };
        Log.debugf("Grounded-only strength of '%s' against %d counter(s): %s -> %.1f",
                original, counters.size(), label, score);
        return score;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
