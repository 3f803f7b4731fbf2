package io.mailq.infrastructure.metrics;

import io.mailq.domain.model.DecisionSource;
import io.mailq.domain.model.EntityType;
import io.mailq.domain.model.GuardrailCategory;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - mailq_bridge_decisions_total{source, category}
 * - mailq_importance_coerced_total
 * - mailq_temporal_decisions_total{type, reason, modified}
 * - mailq_temporal_hidden_total{type}
 * - mailq_temporal_parse_errors_total{type}
 * - mailq_dedup_removed_total{pass}
 * - mailq_dedup_batch_size
 *
 * Usage:
 * <pre>
 * PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
 * EntityEnricher enricher = new EntityEnricher(resolver, metrics);
 *
 * // Expose from whatever HTTP layer hosts the engine
 * String body = metrics.scrape();
 * </pre>
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    private final Counter bridgeDecisions;
    private final Counter importanceCoerced;
    private final Counter temporalDecisions;
    private final Counter temporalHidden;
    private final Counter parseErrors;
    private final Counter dedupRemoved;
    private final Histogram dedupBatchSize;

    /**
     * Create metrics registered in the default registry.
     */
    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    /**
     * Create metrics registered in a custom registry (for isolation in tests).
     */
    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.bridgeDecisions = Counter.build()
            .name("mailq_bridge_decisions_total")
            .help("Pre-decay importance decisions by source and guardrail category")
            .labelNames("source", "category")
            .register(registry);

        this.importanceCoerced = Counter.build()
            .name("mailq_importance_coerced_total")
            .help("Unrecognized upstream importance values coerced to routine")
            .register(registry);

        this.temporalDecisions = Counter.build()
            .name("mailq_temporal_decisions_total")
            .help("Temporal decay decisions by entity type and reason")
            .labelNames("type", "reason", "modified")
            .register(registry);

        this.temporalHidden = Counter.build()
            .name("mailq_temporal_hidden_total")
            .help("Entities hidden from the digest as expired")
            .labelNames("type")
            .register(registry);

        this.parseErrors = Counter.build()
            .name("mailq_temporal_parse_errors_total")
            .help("Malformed entity timestamps treated as missing")
            .labelNames("type")
            .register(registry);

        this.dedupRemoved = Counter.build()
            .name("mailq_dedup_removed_total")
            .help("Entities removed by deduplication pass")
            .labelNames("pass")
            .register(registry);

        this.dedupBatchSize = Histogram.build()
            .name("mailq_dedup_batch_size")
            .help("Entities per deduplication batch")
            .buckets(1, 5, 10, 25, 50, 100, 250, 500)
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized engine metrics");
    }

    @Override
    public void recordBridgeDecision(DecisionSource source, GuardrailCategory category) {
        bridgeDecisions.labels(source.wireValue(), category != null ? category.key() : "none").inc();
    }

    @Override
    public void recordImportanceCoerced() {
        importanceCoerced.inc();
    }

    @Override
    public void recordTemporalDecision(EntityType type, String decayReason, boolean wasModified, boolean hidden) {
        temporalDecisions.labels(type.wireValue(), decayReason, String.valueOf(wasModified)).inc();
        if (hidden) {
            temporalHidden.labels(type.wireValue()).inc();
        }
    }

    @Override
    public void recordParseError(EntityType type) {
        parseErrors.labels(type.wireValue()).inc();
    }

    @Override
    public void recordDeduplication(int input, int afterThread, int output) {
        dedupBatchSize.observe(input);
        dedupRemoved.labels("thread").inc(Math.max(0, input - afterThread));
        dedupRemoved.labels("signature").inc(Math.max(0, afterThread - output));
    }

    /**
     * Get Prometheus CollectorRegistry for a /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    /**
     * Render the registry in the Prometheus text exposition format.
     */
    public String scrape() {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.metricFamilySamples());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render metrics", e);
        }
        return writer.toString();
    }
}
