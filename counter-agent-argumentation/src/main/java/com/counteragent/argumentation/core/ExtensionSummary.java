package com.counteragent.argumentation.core;

import java.util.List;
import java.util.Objects;

public record ExtensionSummary(Extension grounded, List<Extension> complete) {

    public ExtensionSummary {
        Objects.requireNonNull(grounded, "grounded");
        complete = complete == null ? List.of() : List.copyOf(complete);
    }

    /**
     * Credulous acceptance: some complete extension contains the argument.
     */
    public boolean credulouslyAccepted(ArgumentRef argument) {
        return complete.stream().anyMatch(e -> e.contains(argument));
    }

    /**
     * Skeptical acceptance: every complete extension contains the argument. Since the grounded
     * extension is the intersection of all complete ones this is grounded membership.
     */
    public boolean skepticallyAccepted(ArgumentRef argument) {
        return grounded.contains(argument);
    }

    public long acceptingCount(ArgumentRef argument) {
        return complete.stream().filter(e -> e.contains(argument)).count();
    }
}
