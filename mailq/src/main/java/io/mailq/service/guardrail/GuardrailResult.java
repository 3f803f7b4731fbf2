package io.mailq.service.guardrail;

import io.mailq.domain.model.GuardrailCategory;
import io.mailq.domain.model.Importance;

/**
 * Verdict of the first guardrail rule that matched an email.
 *
 * @param importance importance forced by the category
 * @param reason     rule description, or guardrail:category:name when it has none
 * @param ruleName   matching rule
 * @param category   bucket the rule came from
 */
public record GuardrailResult(
    Importance importance,
    String reason,
    String ruleName,
    GuardrailCategory category
) {}
