package com.counteragent.argumentation.core;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic text dump of attack graphs and extensions, for display only. Nodes, attacks and
 * extensions are sorted so the same graph always renders the same way.
 */
public final class AttackGraphRenderer {
    private AttackGraphRenderer() {}

    private static final Comparator<Extension> EXTENSION_ORDER = Comparator
            .comparingInt(Extension::size)
            .thenComparing(Extension::toString);

    /**
     * Renders {@code <{a,b},{(b,a)}>}.
     */
    public static String render(ArgumentationFramework af) {
        String nodes = af.nodes().stream().sorted()
                .map(ArgumentRef::id)
                .collect(Collectors.joining(",", "{", "}"));
        String attacks = af.attacks().stream().sorted()
                .map(AttackEdge::toString)
                .collect(Collectors.joining(",", "{", "}"));
        return "<" + nodes + "," + attacks + ">";
    }

    public static String render(ArgumentationFramework af, ExtensionSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("framework: ").append(render(af)).append('\n');
        sb.append("grounded: ").append(summary.grounded()).append('\n');
        sb.append("complete: ").append(renderExtensions(summary.complete()));
        return sb.toString();
    }

    /**
     * Smallest extensions first, then by rendered text.
     */
    public static Comparator<Extension> extensionOrder() {
        return EXTENSION_ORDER;
    }

    public static String renderExtensions(List<Extension> extensions) {
        return extensions.stream()
                .sorted(EXTENSION_ORDER)
                .map(Extension::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
