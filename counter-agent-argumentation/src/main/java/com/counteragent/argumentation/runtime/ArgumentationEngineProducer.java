package com.counteragent.argumentation.runtime;

import com.counteragent.argumentation.core.ArgumentationEngine;
import com.counteragent.argumentation.core.ExtensionCalculator;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Builds the engine from {@link ArgumentationConfig} and exposes it for injection. The engine itself
 * stays container-agnostic; configuration reaches it only through its constructor.
 */
@ApplicationScoped
public class ArgumentationEngineProducer {

    private final ArgumentationConfig config;

    @Inject
    public ArgumentationEngineProducer(ArgumentationConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public ArgumentationEngine engine() {
        Log.infof("Argumentation engine configured: enumerationCap=%d, fallbackEnabled=%s, formalRepresentation=%s",
                config.enumerationCap(), config.fallbackEnabled(), config.includeFormalRepresentation());
        return new ArgumentationEngine(new ExtensionCalculator(config.enumerationCap()),
                config.includeFormalRepresentation());
    }
}
