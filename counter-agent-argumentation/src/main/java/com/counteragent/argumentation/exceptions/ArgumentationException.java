package com.counteragent.argumentation.exceptions;

/**
 * Base type for every error raised by the argumentation engine.
 * <p>
 * All subclasses signal a local, synchronous condition (a caller programming error or a policy
 * limit). None of them is transient, so retrying the same call never helps.
 * </p>
 */
public class ArgumentationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ArgumentationException(String message) {
        super(message);
    }

    public ArgumentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
