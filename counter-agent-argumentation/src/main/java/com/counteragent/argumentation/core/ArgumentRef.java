package com.counteragent.argumentation.core;

import java.util.Objects;

/**
 * Opaque identity of a node in an attack graph. The engine never looks behind the identifier:
 * argument text, type and strength stay in the caller's own records.
 */
public record ArgumentRef(String id) implements Comparable<ArgumentRef> {

    public ArgumentRef {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Argument id must be non-empty");
        }
    }

    public static ArgumentRef of(String id) {
        return new ArgumentRef(id);
    }

    @Override
    public int compareTo(ArgumentRef other) {
        return id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return id;
    }
}
