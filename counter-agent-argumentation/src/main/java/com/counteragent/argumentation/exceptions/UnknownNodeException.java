package com.counteragent.argumentation.exceptions;

/**
 * Thrown when an attack references an argument that was never added to the framework.
 */
public class UnknownNodeException extends ArgumentationException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;
    private final String attackerId;
    private final String targetId;

    public UnknownNodeException(String nodeId) {
        super(String.format("Argument '%s' is not part of the framework", nodeId));
        this.nodeId = nodeId;
        this.attackerId = null;
        this.targetId = null;
    }

    public UnknownNodeException(String nodeId, String attackerId, String targetId) {
        super(String.format("Cannot add attack (%s -> %s): argument '%s' is not part of the framework",
                attackerId, targetId, nodeId));
        this.nodeId = nodeId;
        this.attackerId = attackerId;
        this.targetId = targetId;
    }

    /**
     * The identifier that could not be resolved.
     */
    public String getNodeId() {
        return nodeId;
    }

    /**
     * Attacker of the rejected edge, or {@code null} when the failure was not caused by an attack.
     */
    public String getAttackerId() {
        return attackerId;
    }

    /**
     * Target of the rejected edge, or {@code null} when the failure was not caused by an attack.
     */
    public String getTargetId() {
        return targetId;
    }
}
