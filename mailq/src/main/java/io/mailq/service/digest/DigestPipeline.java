package io.mailq.service.digest;

import io.mailq.domain.model.ClassifiedEmail;
import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.Entity;
import io.mailq.service.dedup.EntityDeduplicator;
import io.mailq.service.enrichment.EntityEnricher;
import io.mailq.service.importance.BridgeDecision;
import io.mailq.service.importance.BridgeImportanceMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Digest Pipeline - classified emails + extracted entities → sectioned digest.
 *
 * FLOW:
 * bridge decision per email → importance applied to that email's entities
 * → enrich → deduplicate → split hidden → group by section
 *
 * Entities that arrive already enriched keep their importance (logged as a warning)
 * and are re-resolved at the new evaluation time.
 */
public final class DigestPipeline {
    private static final Logger log = LoggerFactory.getLogger(DigestPipeline.class);

    private final BridgeImportanceMapper mapper;
    private final EntityEnricher enricher;
    private final EntityDeduplicator deduplicator;

    public DigestPipeline(BridgeImportanceMapper mapper, EntityEnricher enricher, EntityDeduplicator deduplicator) {
        this.mapper = mapper;
        this.enricher = enricher;
        this.deduplicator = deduplicator;
    }

    public DigestBatch process(List<ClassifiedEmail> emails, List<Entity> entities, Instant now) {
        List<BridgeDecision> decisions = new ArrayList<>(emails.size());
        Map<String, BridgeDecision> byEmail = new HashMap<>();
        for (ClassifiedEmail email : emails) {
            BridgeDecision decision = mapper.mapEmail(email);
            decisions.add(decision);
            byEmail.put(decision.emailId(), decision);
        }

        int unmatched = 0;
        int alreadyEnriched = 0;
        for (Entity entity : entities) {
            BridgeDecision decision = byEmail.get(entity.sourceEmailId());
            if (decision == null) {
                unmatched++;
            } else if (entity.isEnriched()) {
                alreadyEnriched++;
            } else {
                entity.applyImportance(decision.importance());
            }
        }
        if (unmatched > 0) {
            log.debug("[DigestPipeline] {} entities had no classified source email; keeping their importance", unmatched);
        }
        if (alreadyEnriched > 0) {
            log.warn("[DigestPipeline] {} entities were already enriched; bridge decision not applied, keeping their importance",
                alreadyEnriched);
        }

        enricher.enrich(entities, now);
        List<Entity> deduped = deduplicator.deduplicate(entities);

        List<Entity> visible = new ArrayList<>(deduped.size());
        List<Entity> hidden = new ArrayList<>();
        for (Entity entity : deduped) {
            if (entity.hideInDigest()) {
                hidden.add(entity);
            } else {
                visible.add(entity);
            }
        }

        Map<DigestSection, List<Entity>> sections = DigestSectionGrouper.group(visible);
        log.info("[DigestPipeline] emails={} entities={} deduped={} visible={} hidden={}",
            emails.size(), entities.size(), deduped.size(), visible.size(), hidden.size());
        return new DigestBatch(sections, hidden, decisions);
    }
}
