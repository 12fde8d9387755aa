package com.counteragent.argumentation.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Data transfer object representing a JointJS friendly view of an attack graph.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttackGraphPayload(
        List<Node> nodes,
        List<Link> links,
        List<String> grounded,
        List<List<String>> complete,
        String mode
) {

    public AttackGraphPayload {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        links = links == null ? List.of() : List.copyOf(links);
        grounded = grounded == null ? List.of() : List.copyOf(grounded);
        complete = complete == null ? null : List.copyOf(complete);
    }

    /**
     * @param role        {@code original}, {@code counter} or {@code conclusion}
     * @param counterType wire value of the counter type, only for counters
     * @param label       grounded label (IN, OUT or UNDEC)
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(
            String id,
            String role,
            String counterType,
            String label
    ) {
    }

    public record Link(
            String source,
            String target
    ) {
    }
}
