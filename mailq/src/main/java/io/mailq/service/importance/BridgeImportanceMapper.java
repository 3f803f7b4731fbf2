package io.mailq.service.importance;

import io.mailq.domain.model.ClassifiedEmail;
import io.mailq.domain.model.DecisionSource;
import io.mailq.domain.model.Importance;
import io.mailq.infrastructure.metrics.EngineMetrics;
import io.mailq.service.guardrail.GuardrailMatcher;
import io.mailq.service.guardrail.GuardrailResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Bridge Importance Mapper - guardrail overrides on top of the upstream model.
 *
 * DECISION:
 * 1. Guardrail match → its importance, verbatim (absolute override, may lower critical to routine)
 * 2. Otherwise → upstream importance, coerced to routine when missing or unrecognized
 *
 * Single authority for importance before temporal decay; nothing downstream re-reads raw model output.
 */
public final class BridgeImportanceMapper {
    private static final Logger log = LoggerFactory.getLogger(BridgeImportanceMapper.class);

    private final GuardrailMatcher guardrails;
    private final EngineMetrics metrics;

    public BridgeImportanceMapper(GuardrailMatcher guardrails) {
        this(guardrails, EngineMetrics.NOOP);
    }

    public BridgeImportanceMapper(GuardrailMatcher guardrails, EngineMetrics metrics) {
        this.guardrails = guardrails;
        this.metrics = metrics;
    }

    public BridgeDecision mapEmail(ClassifiedEmail email) {
        Optional<GuardrailResult> guardrail = guardrails.evaluate(email);
        if (guardrail.isPresent()) {
            GuardrailResult result = guardrail.get();
            metrics.recordBridgeDecision(DecisionSource.GUARDRAIL, result.category());
            log.info("[BridgeImportanceMapper] guardrail_applied email={} rule={} category={} importance={}",
                email.id(), result.ruleName(), result.category(), result.importance());
            return new BridgeDecision(
                email.id(),
                result.importance(),
                result.reason(),
                DecisionSource.GUARDRAIL,
                result.ruleName(),
                result.category()
            );
        }

        Importance importance = coerceModelImportance(email);
        metrics.recordBridgeDecision(DecisionSource.GEMINI, null);
        log.debug("[BridgeImportanceMapper] map_decision email={} importance={} source=gemini",
            email.id(), importance);
        return new BridgeDecision(
            email.id(),
            importance,
            "gemini importance: " + importance.wireValue(),
            DecisionSource.GEMINI,
            null,
            null
        );
    }

    /**
     * Validate the upstream importance.
     *
     * Missing → routine. Unrecognized → routine with a warning.
     */
    public Importance coerceModelImportance(ClassifiedEmail email) {
        Optional<String> raw = email.rawImportance();
        if (raw.isEmpty()) {
            return Importance.ROUTINE;
        }

        Optional<Importance> parsed = Importance.fromWire(raw.get());
        if (parsed.isEmpty()) {
            log.warn("[BridgeImportanceMapper] Unknown importance '{}' for email {}, defaulting to routine",
                raw.get(), email.id());
            metrics.recordImportanceCoerced();
            return Importance.ROUTINE;
        }
        return parsed.get();
    }
}
