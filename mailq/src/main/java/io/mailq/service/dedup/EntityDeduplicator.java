package io.mailq.service.dedup;

import io.mailq.domain.model.Entity;
import io.mailq.domain.model.Importance;
import io.mailq.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entity Deduplicator - one entity per thread, then one per signature.
 *
 * PASSES:
 * 1. Thread: entities sharing a non-blank thread id collapse to the best one
 * 2. Signature: remaining entities sharing a signature collapse to the best one
 *
 * BEST: highest (importance rank, confidence, timestamp); missing timestamp ranks lowest,
 * the earliest of equal candidates wins. Survivors keep their input order, so a second
 * run over the output changes nothing.
 */
public final class EntityDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(EntityDeduplicator.class);

    static final Comparator<Entity> RANKING = Comparator
        .comparingInt((Entity e) -> Importance.rankOf(e.importance()))
        .thenComparingDouble(Entity::confidence)
        .thenComparing(Entity::timestamp, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private final EngineMetrics metrics;

    public EntityDeduplicator() {
        this(EngineMetrics.NOOP);
    }

    public EntityDeduplicator(EngineMetrics metrics) {
        this.metrics = metrics;
    }

    public List<Entity> deduplicate(List<Entity> entities) {
        if (entities == null || entities.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, List<Entity>> threads = new LinkedHashMap<>();
        for (Entity entity : entities) {
            if (entity.source().hasThread()) {
                threads.computeIfAbsent(entity.sourceThreadId(), k -> new ArrayList<>()).add(entity);
            }
        }
        Set<Entity> threadLosers = losers(threads.values());
        List<Entity> afterThread = retain(entities, threadLosers);

        Map<String, List<Entity>> signatures = new LinkedHashMap<>();
        for (Entity entity : afterThread) {
            signatures.computeIfAbsent(EntitySignatures.signatureOf(entity), k -> new ArrayList<>()).add(entity);
        }
        List<Entity> result = retain(afterThread, losers(signatures.values()));

        metrics.recordDeduplication(entities.size(), afterThread.size(), result.size());
        if (result.size() < entities.size()) {
            log.debug("[EntityDeduplicator] {} → {} after thread pass → {} after signature pass",
                entities.size(), afterThread.size(), result.size());
        }
        return result;
    }

    /**
     * Group by the supplied email→thread map (email id when unmapped) and deduplicate each group.
     * Without a map this is {@link #deduplicate}.
     */
    public List<Entity> deduplicateByThread(List<Entity> entities, Map<String, String> emailToThread) {
        if (emailToThread == null || emailToThread.isEmpty()) {
            return deduplicate(entities);
        }

        Map<String, List<Entity>> groups = new LinkedHashMap<>();
        for (Entity entity : entities) {
            String thread = emailToThread.getOrDefault(entity.sourceEmailId(), entity.sourceEmailId());
            groups.computeIfAbsent(thread, k -> new ArrayList<>()).add(entity);
        }

        List<Entity> result = new ArrayList<>();
        for (List<Entity> group : groups.values()) {
            result.addAll(deduplicate(group));
        }
        return result;
    }

    /**
     * Bucket by stored importance; missing importance counts as routine.
     */
    public Map<Importance, List<Entity>> groupByImportance(List<Entity> entities) {
        Map<Importance, List<Entity>> groups = new EnumMap<>(Importance.class);
        for (Importance importance : Importance.values()) {
            groups.put(importance, new ArrayList<>());
        }
        for (Entity entity : entities) {
            Importance importance = entity.importance() != null ? entity.importance() : Importance.ROUTINE;
            groups.get(importance).add(entity);
        }
        return groups;
    }

    static Entity selectBest(List<Entity> group) {
        Entity best = group.get(0);
        for (int i = 1; i < group.size(); i++) {
            Entity candidate = group.get(i);
            if (RANKING.compare(candidate, best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    private static Set<Entity> losers(Iterable<List<Entity>> groups) {
        Set<Entity> losers = Collections.newSetFromMap(new IdentityHashMap<>());
        for (List<Entity> group : groups) {
            if (group.size() < 2) {
                continue;
            }
            Entity best = selectBest(group);
            for (Entity entity : group) {
                if (entity != best) {
                    losers.add(entity);
                }
            }
        }
        return losers;
    }

    private static List<Entity> retain(List<Entity> entities, Set<Entity> losers) {
        List<Entity> kept = new ArrayList<>(entities.size() - losers.size());
        for (Entity entity : entities) {
            if (!losers.contains(entity)) {
                kept.add(entity);
            }
        }
        return kept;
    }
}
