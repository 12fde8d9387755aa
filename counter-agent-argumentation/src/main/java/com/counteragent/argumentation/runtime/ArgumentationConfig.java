package com.counteragent.argumentation.runtime;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Maps argumentation engine properties to the application's configuration.
 */
@StaticInitSafe
@ConfigMapping(prefix = "counteragent.argumentation")
public interface ArgumentationConfig {

    /**
     * Largest framework, in arguments, for which complete extensions are enumerated.
     * @return the node-count cap
     */
    @WithDefault("32")
    int enumerationCap();

    /**
     * Whether callers answer with the strength heuristic when the formal engine refuses a request.
     * @return true to degrade instead of failing
     */
    @WithDefault("true")
    boolean fallbackEnabled();

    /**
     * Whether validation results carry the textual attack-graph dump.
     * @return true to include it
     */
    @WithDefault("true")
    boolean includeFormalRepresentation();
}
