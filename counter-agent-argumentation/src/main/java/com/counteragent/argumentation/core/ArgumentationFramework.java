package com.counteragent.argumentation.core;

import com.counteragent.argumentation.exceptions.DuplicateNodeException;
import com.counteragent.argumentation.exceptions.UnknownNodeException;

import java.util.*;

/**
 * Abstract argumentation framework: a set of arguments and a set of directed attacks between them.
 * <p>
 * A framework is populated once by the call that owns it and then {@link #seal() sealed}; after
 * that it is read-only. Parallel edges collapse to a single attack. Insertion order of nodes is
 * preserved, which keeps every derived view deterministic.
 * </p>
 */
public final class ArgumentationFramework {

    private final Set<ArgumentRef> nodes = new LinkedHashSet<>();
    private final Set<AttackEdge> attacks = new LinkedHashSet<>();
    private final Map<ArgumentRef, Set<ArgumentRef>> attackersByTarget = new HashMap<>();
    private final Map<ArgumentRef, Set<ArgumentRef>> targetsByAttacker = new HashMap<>();
    private boolean sealed;

    public ArgumentationFramework() {
    }

    /**
     * Adds a node.
     *
     * @throws DuplicateNodeException if the node is already present
     */
    public ArgumentationFramework addNode(ArgumentRef node) {
        Objects.requireNonNull(node, "node");
        requireOpen();
        if (!nodes.add(node)) {
            throw new DuplicateNodeException(node.id());
        }
        attackersByTarget.put(node, new LinkedHashSet<>());
        targetsByAttacker.put(node, new LinkedHashSet<>());
        return this;
    }

    /**
     * Idempotent variant of {@link #addNode(ArgumentRef)}.
     *
     * @return {@code true} if the node was added, {@code false} if it was already present
     */
    public boolean addNodeIfAbsent(ArgumentRef node) {
        requireOpen();
        if (contains(node)) {
            return false;
        }
        addNode(node);
        return true;
    }

    /**
     * Adds the attack {@code attacker -> target}. Adding an existing attack again is a no-op.
     *
     * @throws UnknownNodeException if either endpoint has not been added
     */
    public ArgumentationFramework addAttack(ArgumentRef attacker, ArgumentRef target) {
        Objects.requireNonNull(attacker, "attacker");
        Objects.requireNonNull(target, "target");
        requireOpen();
        for (ArgumentRef endpoint : List.of(attacker, target)) {
            if (!nodes.contains(endpoint)) {
                throw new UnknownNodeException(endpoint.id(), attacker.id(), target.id());
            }
        }
        if (attacks.add(new AttackEdge(attacker, target))) {
            attackersByTarget.get(target).add(attacker);
            targetsByAttacker.get(attacker).add(target);
        }
        return this;
    }

    /**
     * Freezes the framework. Further mutation attempts fail with {@link IllegalStateException}.
     */
    public ArgumentationFramework seal() {
        this.sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    public boolean contains(ArgumentRef node) {
        return nodes.contains(node);
    }

    public Set<ArgumentRef> nodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public Set<AttackEdge> attacks() {
        return Collections.unmodifiableSet(attacks);
    }

    /**
     * Nodes that have an edge into {@code node}.
     *
     * @throws UnknownNodeException if {@code node} is not part of the framework
     */
    public Set<ArgumentRef> attackersOf(ArgumentRef node) {
        return Collections.unmodifiableSet(lookup(attackersByTarget, node));
    }

    /**
     * Nodes that {@code node} has an edge into.
     *
     * @throws UnknownNodeException if {@code node} is not part of the framework
     */
    public Set<ArgumentRef> attackedBy(ArgumentRef node) {
        return Collections.unmodifiableSet(lookup(targetsByAttacker, node));
    }

    public boolean attacks(ArgumentRef attacker, ArgumentRef target) {
        return attacks.contains(new AttackEdge(attacker, target));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    private Set<ArgumentRef> lookup(Map<ArgumentRef, Set<ArgumentRef>> index, ArgumentRef node) {
        Set<ArgumentRef> found = index.get(node);
        if (found == null) {
            throw new UnknownNodeException(String.valueOf(node));
        }
        return found;
    }

    private void requireOpen() {
        if (sealed) {
            throw new IllegalStateException("Argumentation framework is sealed");
        }
    }

    @Override
    public String toString() {
        return AttackGraphRenderer.render(this);
    }
}
