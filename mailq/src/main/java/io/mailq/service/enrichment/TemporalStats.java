package io.mailq.service.enrichment;

import io.mailq.domain.model.Importance;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enrichment counters, owned by one {@link EntityEnricher}.
 *
 * Thread-safe: all mutation and snapshotting happens under one lock.
 */
public final class TemporalStats {

    private final ReentrantLock lock = new ReentrantLock();

    private long totalProcessed;
    private long escalated;
    private long downgraded;
    private long unchanged;
    private long hidden;
    private long parseErrors;
    private final Map<String, Long> decayReasons = new TreeMap<>();

    /**
     * Immutable copy of the counters.
     */
    public record Snapshot(
        long totalProcessed,
        long escalated,
        long downgraded,
        long unchanged,
        long hidden,
        long parseErrors,
        Map<String, Long> decayReasons
    ) {
        public Snapshot {
            decayReasons = Map.copyOf(decayReasons);
        }

        public long reasonCount(String reason) {
            return decayReasons.getOrDefault(reason, 0L);
        }
    }

    void record(Importance stored, Importance resolved, String decayReason, boolean hide, int malformedFields) {
        lock.lock();
        try {
            totalProcessed++;
            if (resolved.isHigherThan(stored)) {
                escalated++;
            } else if (stored.isHigherThan(resolved)) {
                downgraded++;
            } else {
                unchanged++;
            }
            if (hide) {
                hidden++;
            }
            parseErrors += malformedFields;
            if (decayReason != null) {
                decayReasons.merge(decayReason, 1L, Long::sum);
            }
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(totalProcessed, escalated, downgraded, unchanged, hidden, parseErrors,
                new TreeMap<>(decayReasons));
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            totalProcessed = 0;
            escalated = 0;
            downgraded = 0;
            unchanged = 0;
            hidden = 0;
            parseErrors = 0;
            decayReasons.clear();
        } finally {
            lock.unlock();
        }
    }
}
