package com.counteragent.argumentation.exceptions;

/**
 * Thrown when complete-extension enumeration is requested on a framework whose node count exceeds
 * the configured cap. Callers should fall back to the grounded extension, which stays polynomial.
 */
public class TooLargeException extends ArgumentationException {
    private static final long serialVersionUID = 1L;

    private final int nodeCount;
    private final int cap;

    public TooLargeException(int nodeCount, int cap) {
        super(String.format("Complete-extension enumeration refused: framework has %d arguments, cap is %d",
                nodeCount, cap));
        this.nodeCount = nodeCount;
        this.cap = cap;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getCap() {
        return cap;
    }
}
