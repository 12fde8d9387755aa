package com.counteragent.argumentation.core;

import java.util.*;

/**
 * IN/OUT/UNDEC assignment over the nodes of a framework. A legal labelling is an equivalent view of a
 * complete extension: its IN nodes.
 */
public final class Labelling {

    private final Map<ArgumentRef, Label> labels;

    private Labelling(Map<ArgumentRef, Label> labels) {
        this.labels = Collections.unmodifiableMap(labels);
    }

    /**
     * Labels every member of {@code in} as IN, every node attacked by a member of {@code in} as OUT,
     * and everything else as UNDEC.
     */
    public static Labelling fromExtension(ArgumentationFramework af, Set<ArgumentRef> in) {
        Map<ArgumentRef, Label> labels = new LinkedHashMap<>();
        for (ArgumentRef node : af.nodes()) {
            if (in.contains(node)) {
                labels.put(node, Label.IN);
            } else if (af.attackersOf(node).stream().anyMatch(in::contains)) {
                labels.put(node, Label.OUT);
            } else {
                labels.put(node, Label.UNDEC);
            }
        }
        return new Labelling(labels);
    }

    public static Labelling fromExtension(ArgumentationFramework af, Extension extension) {
        return fromExtension(af, extension.members());
    }

    /**
     * Wraps an explicit assignment. Nodes of {@code af} missing from the map are labelled UNDEC.
     */
    public static Labelling of(ArgumentationFramework af, Map<ArgumentRef, Label> assignment) {
        Map<ArgumentRef, Label> labels = new LinkedHashMap<>();
        for (ArgumentRef node : af.nodes()) {
            labels.put(node, assignment.getOrDefault(node, Label.UNDEC));
        }
        return new Labelling(labels);
    }

    public Label labelOf(ArgumentRef node) {
        Label label = labels.get(node);
        if (label == null) {
            throw new IllegalArgumentException("No label for argument '" + node + "'");
        }
        return label;
    }

    public Set<ArgumentRef> in() {
        return select(Label.IN);
    }

    public Set<ArgumentRef> out() {
        return select(Label.OUT);
    }

    public Set<ArgumentRef> undec() {
        return select(Label.UNDEC);
    }

    public Map<ArgumentRef, Label> asMap() {
        return labels;
    }

    /**
     * Checks the complete-labelling conditions against {@code af}: a node is IN iff all its attackers
     * are OUT, OUT iff some attacker is IN, and UNDEC otherwise.
     */
    public boolean isLegal(ArgumentationFramework af) {
        if (!labels.keySet().equals(af.nodes())) {
            return false;
        }
        for (ArgumentRef node : af.nodes()) {
            Set<ArgumentRef> attackers = af.attackersOf(node);
            boolean allAttackersOut = attackers.stream().allMatch(a -> labels.get(a) == Label.OUT);
            boolean someAttackerIn = attackers.stream().anyMatch(a -> labels.get(a) == Label.IN);
            Label expected = allAttackersOut ? Label.IN : someAttackerIn ? Label.OUT : Label.UNDEC;
            if (labels.get(node) != expected) {
                return false;
            }
        }
        return true;
    }

    public Extension toExtension(Extension.Kind kind) {
        return new Extension(kind, in());
    }

    private Set<ArgumentRef> select(Label wanted) {
        Set<ArgumentRef> result = new LinkedHashSet<>();
        labels.forEach((node, label) -> {
            if (label == wanted) result.add(node);
        });
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Labelling)) return false;
        return labels.equals(((Labelling) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
