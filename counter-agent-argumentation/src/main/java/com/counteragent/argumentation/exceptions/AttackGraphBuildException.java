package com.counteragent.argumentation.exceptions;

/**
 * Raised when an attack graph cannot be assembled from the supplied argument identities,
 * typically because two of them collide. The original construction failure is kept as the cause.
 */
public class AttackGraphBuildException extends ArgumentationException {
    private static final long serialVersionUID = 1L;

    public AttackGraphBuildException(String message, ArgumentationException cause) {
        super(message, cause);
    }
}
