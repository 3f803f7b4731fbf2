package io.mailq.domain.model;

/**
 * Guardrail buckets in evaluation order.
 * never_surface > force_critical > force_non_critical
 */
public enum GuardrailCategory {
    NEVER_SURFACE("never_surface", Importance.ROUTINE),
    FORCE_CRITICAL("force_critical", Importance.CRITICAL),
    FORCE_NON_CRITICAL("force_non_critical", Importance.ROUTINE);

    private final String key;
    private final Importance importance;

    GuardrailCategory(String key, Importance importance) {
        this.key = key;
        this.importance = importance;
    }

    /**
     * Key used under {@code guardrails:} in the rule file.
     */
    public String key() {
        return key;
    }

    /**
     * Importance forced when a rule of this category matches.
     */
    public Importance importance() {
        return importance;
    }

    @Override
    public String toString() {
        return key;
    }
}
