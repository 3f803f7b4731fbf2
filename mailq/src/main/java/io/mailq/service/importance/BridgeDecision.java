package io.mailq.service.importance;

import io.mailq.domain.model.DecisionSource;
import io.mailq.domain.model.GuardrailCategory;
import io.mailq.domain.model.Importance;

/**
 * Final importance of an email before temporal decay.
 *
 * @param emailId    email the decision applies to
 * @param importance guardrail override or validated upstream importance
 * @param reason     human-readable explanation
 * @param source     guardrail or gemini
 * @param ruleName   matching guardrail rule, null for upstream decisions
 * @param guardrail  guardrail category, null for upstream decisions
 */
public record BridgeDecision(
    String emailId,
    Importance importance,
    String reason,
    DecisionSource source,
    String ruleName,
    GuardrailCategory guardrail
) {
    public boolean isGuardrailOverride() {
        return source == DecisionSource.GUARDRAIL;
    }
}
