package com.counteragent.argumentation.rest.dto;

import com.counteragent.argumentation.core.Extension;
import com.counteragent.argumentation.core.AttackGraphRenderer;
import com.counteragent.argumentation.core.ValidationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationPayload(
        @JsonProperty("is_valid_attack") boolean validAttack,
        @JsonProperty("original_survives") boolean originalSurvives,
        @JsonProperty("counter_succeeds") boolean counterSucceeds,
        @JsonProperty("logical_consistency") boolean logicalConsistency,
        @JsonProperty("formal_representation") String formalRepresentation,
        @JsonProperty("mode") String mode,
        @JsonProperty("extensions") Extensions extensions
) {

    public static ValidationPayload from(ValidationResult result) {
        Extensions extensions = result.extensions()
                .map(summary -> new Extensions(
                        summary.grounded().toString(),
                        summary.complete().stream()
                                .sorted(AttackGraphRenderer.extensionOrder())
                                .map(Extension::toString)
                                .collect(Collectors.toList())))
                .orElse(null);
        return new ValidationPayload(
                result.isValidAttack(),
                result.originalSurvives(),
                result.counterSucceeds(),
                result.logicalConsistency(),
                result.formalRepresentation().orElse(null),
                result.mode().name(),
                extensions);
    }

    public record Extensions(String grounded, List<String> complete) {
        public Extensions {
            complete = complete == null ? List.of() : List.copyOf(complete);
        }
    }
}
