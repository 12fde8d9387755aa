package com.counteragent.argumentation.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Directed attack {@code attacker -> target}. Self-attacks are allowed.
 */
public record AttackEdge(ArgumentRef attacker, ArgumentRef target) implements Comparable<AttackEdge> {

    private static final Comparator<AttackEdge> ORDER = Comparator
            .comparing(AttackEdge::attacker)
            .thenComparing(AttackEdge::target);

    public AttackEdge {
        Objects.requireNonNull(attacker, "attacker");
        Objects.requireNonNull(target, "target");
    }

    public boolean isSelfAttack() {
        return attacker.equals(target);
    }

    @Override
    public int compareTo(AttackEdge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + attacker + "," + target + ")";
    }
}
