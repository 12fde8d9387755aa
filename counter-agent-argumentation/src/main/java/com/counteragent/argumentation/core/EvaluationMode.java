package com.counteragent.argumentation.core;

/**
 * How a result was obtained. Anything other than {@link #FORMAL} is a degraded answer and must be
 * reported as such.
 */
public enum EvaluationMode {
    /** Grounded and complete semantics were both computed. */
    FORMAL,
    /** Only the grounded extension was computed, the framework was above the enumeration cap. */
    GROUNDED_ONLY,
    /** Strength-based heuristic; no attack graph was evaluated. */
    HEURISTIC
}
