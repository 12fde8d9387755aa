package com.counteragent.argumentation.exceptions;

/**
 * Thrown when a node is added to an argumentation framework that already contains it.
 */
public class DuplicateNodeException extends ArgumentationException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super(String.format("Argument '%s' is already part of the framework", nodeId));
        this.nodeId = nodeId;
    }

    /**
     * The identifier that was added twice.
     */
    public String getNodeId() {
        return nodeId;
    }
}
