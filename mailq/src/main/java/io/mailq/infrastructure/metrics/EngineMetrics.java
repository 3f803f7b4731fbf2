package io.mailq.infrastructure.metrics;

import io.mailq.domain.model.DecisionSource;
import io.mailq.domain.model.EntityType;
import io.mailq.domain.model.GuardrailCategory;

/**
 * Engine metrics for monitoring importance resolution.
 *
 * Implementations can publish to Prometheus or discard (NOOP).
 * Purely observational: nothing in the resolution path reads these values back.
 *
 * Key metrics:
 * - Bridge decisions by source and guardrail category
 * - Upstream importance values coerced to routine
 * - Temporal decisions by entity type and decay reason
 * - Timestamp parse errors
 * - Entities removed by each deduplication pass
 */
public interface EngineMetrics {

    /**
     * Record a pre-decay importance decision.
     *
     * @param source   guardrail or upstream model
     * @param category guardrail category, null when the model decided
     */
    void recordBridgeDecision(DecisionSource source, GuardrailCategory category);

    /**
     * Record an unrecognized upstream importance that was coerced to routine.
     */
    void recordImportanceCoerced();

    /**
     * Record a temporal decision for one entity.
     *
     * @param type        entity type
     * @param decayReason decay reason tag
     * @param wasModified whether importance changed
     * @param hidden      whether the entity is hidden from the digest
     */
    void recordTemporalDecision(EntityType type, String decayReason, boolean wasModified, boolean hidden);

    /**
     * Record a malformed timestamp on an entity.
     */
    void recordParseError(EntityType type);

    /**
     * Record one deduplication run.
     *
     * @param input       entities in
     * @param afterThread entities left after the thread pass
     * @param output      entities out
     */
    void recordDeduplication(int input, int afterThread, int output);

    /**
     * Metrics sink that discards everything.
     */
    EngineMetrics NOOP = new EngineMetrics() {
        @Override
        public void recordBridgeDecision(DecisionSource source, GuardrailCategory category) { }

        @Override
        public void recordImportanceCoerced() { }

        @Override
        public void recordTemporalDecision(EntityType type, String decayReason, boolean wasModified, boolean hidden) { }

        @Override
        public void recordParseError(EntityType type) { }

        @Override
        public void recordDeduplication(int input, int afterThread, int output) { }
    };
}
