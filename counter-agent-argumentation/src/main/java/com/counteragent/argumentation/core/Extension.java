package com.counteragent.argumentation.core;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A set of arguments that can be accepted together, tagged with the semantics that produced it.
 */
public record Extension(Kind kind, Set<ArgumentRef> members) {

    public enum Kind {
        CONFLICT_FREE,
        ADMISSIBLE,
        COMPLETE,
        GROUNDED
    }

    public Extension {
        Objects.requireNonNull(kind, "kind");
        members = members == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(members));
    }

    public boolean contains(ArgumentRef argument) {
        return members.contains(argument);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return members.stream().map(ArgumentRef::id).collect(Collectors.joining(",", "{", "}"));
    }
}
