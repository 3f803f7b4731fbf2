package io.mailq.service.enrichment;

import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.Importance;
import io.mailq.domain.model.NotificationEntity;
import io.mailq.infrastructure.metrics.EngineMetrics;
import io.mailq.service.temporal.DecayReason;
import io.mailq.service.temporal.NotificationSignals;
import io.mailq.service.temporal.TemporalDecayResolver;
import io.mailq.service.temporal.TemporalDecayResult;
import io.mailq.service.temporal.TemporalExtraction;
import io.mailq.service.temporal.TemporalFieldExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entity Enricher - applies temporal decay to a batch and records the audit trail.
 *
 * PER ENTITY:
 * 1. stored = upstream importance (routine if missing)
 * 2. extract time window; malformed counts a parse error and means "no temporal data"
 * 3. notification overlay, then the decision table
 * 4. audit fields, digest section, hide flag
 * 5. stats + metrics
 *
 * Enrichment mutates the given entities in place and never throws for bad data.
 */
public final class EntityEnricher {
    private static final Logger log = LoggerFactory.getLogger(EntityEnricher.class);

    private final TemporalDecayResolver resolver;
    private final EngineMetrics metrics;
    private final TemporalStats stats = new TemporalStats();

    public EntityEnricher() {
        this(new TemporalDecayResolver(), EngineMetrics.NOOP);
    }

    public EntityEnricher(TemporalDecayResolver resolver) {
        this(resolver, EngineMetrics.NOOP);
    }

    public EntityEnricher(TemporalDecayResolver resolver, EngineMetrics metrics) {
        this.resolver = resolver;
        this.metrics = metrics;
    }

    public List<Entity> enrich(List<Entity> entities, Instant now) {
        for (Entity entity : entities) {
            enrichEntity(entity, now);
        }
        return entities;
    }

    public Entity enrichEntity(Entity entity, Instant now) {
        Importance stored = entity.importance() != null ? entity.importance() : Importance.ROUTINE;

        int malformed = 0;
        Optional<TemporalDecayResult> overlay = Optional.empty();
        if (entity instanceof NotificationEntity notification) {
            NotificationSignals signals = TemporalFieldExtractor.signals(notification);
            malformed += signals.malformedFields();
            overlay = resolver.resolveNotification(signals, stored, now);
            // OTP/shipping notifications are time-bound; without a matching overlay rule they have no usable time
            if (overlay.isEmpty() && notification.hasOtpOrShippingFields()) {
                overlay = Optional.of(new TemporalDecayResult(stored, DecayReason.NO_TEMPORAL_DATA, false, null));
            }
        }

        TemporalExtraction window = TemporalFieldExtractor.extract(entity);
        if (window.isMalformed()) {
            malformed++;
        }

        TemporalDecayResult result = overlay.orElseGet(
            () -> resolver.resolve(entity.type(), stored, window.start(), window.end(), now));

        Importance resolved = result.resolvedImportance();
        DigestSection section = resolver.sectionFor(resolved);
        boolean hide = resolver.shouldHide(entity.type(), resolved, window.start(), window.end(), now);

        entity.recordResolution(stored, resolved, result.decayReason(), result.wasModified(), section, hide);

        stats.record(stored, resolved, result.decayReason(), hide, malformed);
        for (int i = 0; i < malformed; i++) {
            metrics.recordParseError(entity.type());
        }
        metrics.recordTemporalDecision(entity.type(), result.decayReason(), result.wasModified(), hide);

        if (result.wasModified() || hide) {
            log.info("[EntityEnricher] temporal_decision email={} type={} {}→{} reason={} hidden={}",
                entity.sourceEmailId(), entity.type().wireValue(), stored, resolved, result.decayReason(), hide);
        } else if (DecayReason.NO_TEMPORAL_DATA.equals(result.decayReason()) && window.isMalformed()) {
            log.debug("[EntityEnricher] email={} treated as no temporal data: {}",
                entity.sourceEmailId(), window.error());
        }
        return entity;
    }

    /**
     * Drop entities flagged hideInDigest.
     */
    public List<Entity> filterVisible(List<Entity> entities) {
        List<Entity> visible = new ArrayList<>(entities.size());
        for (Entity entity : entities) {
            if (!entity.hideInDigest()) {
                visible.add(entity);
            }
        }
        int hidden = entities.size() - visible.size();
        if (hidden > 0) {
            log.info("[EntityEnricher] Filtered {} hidden entities from digest", hidden);
        }
        return visible;
    }

    public TemporalStats.Snapshot getStats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
    }
}
