package com.counteragent.argumentation.core;

import java.util.List;
import java.util.Optional;

/**
 * A built attack graph together with everything computed on it. {@code complete} is absent when
 * the graph was too large to enumerate.
 */
public record AttackGraphAnalysis(ArgumentationFramework framework,
                                  Extension grounded,
                                  Labelling groundedLabelling,
                                  Optional<List<Extension>> complete) {

    public EvaluationMode mode() {
        return complete.isPresent() ? EvaluationMode.FORMAL : EvaluationMode.GROUNDED_ONLY;
    }

    public String render() {
        return complete
                .map(c -> AttackGraphRenderer.render(framework, new ExtensionSummary(grounded, c)))
                .orElseGet(() -> AttackGraphRenderer.render(framework)
                        + "\ngrounded: " + grounded);
    }
}
