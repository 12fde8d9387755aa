package com.counteragent.argumentation.rest;

import com.counteragent.argumentation.core.*;
import com.counteragent.argumentation.exceptions.AttackGraphBuildException;
import com.counteragent.argumentation.exceptions.TooLargeException;
import com.counteragent.argumentation.fallback.HeuristicFallback;
import com.counteragent.argumentation.rest.dto.*;
import com.counteragent.argumentation.runtime.ArgumentationConfig;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Translates client payloads into engine calls and chooses the degraded path when the engine
 * refuses a request: grounded-only scoring for oversized graphs, and the strength heuristic when
 * enabled.
 */
@ApplicationScoped
public class ArgumentationService {

    static final String DEFAULT_ORIGINAL_ID = "original";
    static final String DEFAULT_COUNTER_PREFIX = "counter_";

    private final ArgumentationEngine engine;
    private final boolean fallbackEnabled;

    @Inject
    public ArgumentationService(ArgumentationEngine engine, ArgumentationConfig config) {
        this(engine, config.fallbackEnabled());
    }

    public ArgumentationService(ArgumentationEngine engine, boolean fallbackEnabled) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.fallbackEnabled = fallbackEnabled;
    }

    public ValidationPayload validate(ValidationRequest request) {
        if (request == null || request.counter() == null) {
            throw new BadRequestException("A counter-argument is required");
        }
        ArgumentRef original = originalOf(request.originalId());
        CounterPayload payload = request.counter();
        CounterAttack counter = toCounterAttack(payload, 0);
        ArgumentStrength strength = strengthOf(payload);
        Log.infof("Validating %s counter '%s' against '%s'", counter.type().value(), counter.counter(), original);
        try {
            return ValidationPayload.from(engine.validateCounterArgument(original, counter));
        } catch (TooLargeException | AttackGraphBuildException e) {
            if (!fallbackEnabled) {
                throw e;
            }
            Log.warnf("Formal validation unavailable, using heuristic fallback: %s", e.getMessage());
            return ValidationPayload.from(HeuristicFallback.validate(strength));
        }
    }

    public StrengthPayload assess(AttackGraphRequest request) {
        AttackGraphRequest req = requireRequest(request);
        ArgumentRef original = originalOf(req.originalId());
        List<CounterAttack> counters = toCounterAttacks(req.counters());
        List<ArgumentStrength> strengths = req.counters().stream()
                .map(ArgumentationService::strengthOf)
                .collect(Collectors.toList());
        Log.infof("Assessing strength of '%s' against %d counter(s)", original, counters.size());
        try {
            return new StrengthPayload(engine.assessArgumentStrength(original, counters), EvaluationMode.FORMAL.name());
        } catch (TooLargeException e) {
            Log.warnf("Complete enumeration refused, scoring from the grounded labelling: %s", e.getMessage());
            return new StrengthPayload(engine.assessArgumentStrengthGrounded(original, counters),
                    EvaluationMode.GROUNDED_ONLY.name());
        } catch (AttackGraphBuildException e) {
            if (!fallbackEnabled) {
                throw e;
            }
            Log.warnf("Formal assessment unavailable, using heuristic fallback: %s", e.getMessage());
            return new StrengthPayload(HeuristicFallback.assess(strengths), EvaluationMode.HEURISTIC.name());
        }
    }

    public AttackGraphPayload attackGraph(AttackGraphRequest request) {
        AttackGraphRequest req = requireRequest(request);
        ArgumentRef original = originalOf(req.originalId());
        List<CounterAttack> counters = toCounterAttacks(req.counters());
        AttackGraphAnalysis analysis = engine.analyze(original, counters);

        Map<ArgumentRef, CounterArgumentType> counterTypes = new HashMap<>();
        counters.forEach(c -> counterTypes.put(c.counter(), c.type()));

        List<AttackGraphPayload.Node> nodes = analysis.framework().nodes().stream()
                .map(node -> new AttackGraphPayload.Node(
                        node.id(),
                        roleOf(node, original, counterTypes),
                        Optional.ofNullable(counterTypes.get(node)).map(CounterArgumentType::value).orElse(null),
                        analysis.groundedLabelling().labelOf(node).name()))
                .collect(Collectors.toList());
        List<AttackGraphPayload.Link> links = analysis.framework().attacks().stream()
                .sorted()
                .map(edge -> new AttackGraphPayload.Link(edge.attacker().id(), edge.target().id()))
                .collect(Collectors.toList());
        List<List<String>> complete = analysis.complete()
                .map(list -> list.stream()
                        .sorted(AttackGraphRenderer.extensionOrder())
                        .map(ArgumentationService::ids)
                        .collect(Collectors.toList()))
                .orElse(null);

        return new AttackGraphPayload(nodes, links, ids(analysis.grounded()), complete,
                analysis.mode().name());
    }

    public String attackGraphText(AttackGraphRequest request) {
        AttackGraphRequest req = requireRequest(request);
        return engine.generateAttackGraph(originalOf(req.originalId()), toCounterAttacks(req.counters()));
    }

    private static AttackGraphRequest requireRequest(AttackGraphRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        return request;
    }

    private static List<String> ids(Extension extension) {
        return extension.members().stream().map(ArgumentRef::id).collect(Collectors.toList());
    }

    private static String roleOf(ArgumentRef node, ArgumentRef original, Map<ArgumentRef, CounterArgumentType> counters) {
        if (node.equals(original)) return "original";
        if (counters.containsKey(node)) return "counter";
        return "conclusion";
    }

    private static ArgumentRef originalOf(String id) {
        return ArgumentRef.of(id == null || id.isBlank() ? DEFAULT_ORIGINAL_ID : id);
    }

    private static List<CounterAttack> toCounterAttacks(List<CounterPayload> payloads) {
        List<CounterAttack> counters = new ArrayList<>();
        for (int i = 0; i < payloads.size(); i++) {
            counters.add(toCounterAttack(payloads.get(i), i));
        }
        return counters;
    }

    private static CounterAttack toCounterAttack(CounterPayload payload, int index) {
        if (payload == null) {
            throw new BadRequestException("Counter-argument #" + index + " is missing");
        }
        String id = payload.id() == null || payload.id().isBlank() ? DEFAULT_COUNTER_PREFIX + index : payload.id();
        try {
            return new CounterAttack(ArgumentRef.of(id), CounterArgumentType.fromValue(payload.type()));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
    }

    private static ArgumentStrength strengthOf(CounterPayload payload) {
        if (payload.strength() == null || payload.strength().isBlank()) {
            return ArgumentStrength.MODERATE;
        }
        try {
            return ArgumentStrength.fromValue(payload.strength());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
    }
}
