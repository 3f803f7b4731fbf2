package io.mailq.service.enrichment;

import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.EntityType;
import io.mailq.domain.model.EventEntity;
import io.mailq.domain.model.Importance;
import io.mailq.domain.model.NotificationEntity;
import io.mailq.domain.model.ShipStatus;
import io.mailq.domain.model.TestEntities;
import io.mailq.infrastructure.metrics.EngineMetrics;
import io.mailq.service.temporal.DecayReason;
import io.mailq.service.temporal.TemporalDecayResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests:
 * - Audit fields on each entity
 * - Stats counters and reason histogram
 * - Parse errors do not abort the batch
 * - Concurrent enrichment keeps exact counts
 */
@ExtendWith(MockitoExtension.class)
class EntityEnricherTest {

    private static final Instant NOW = Instant.parse("2025-11-20T12:00:00Z");

    @Mock
    private EngineMetrics metrics;

    private EntityEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new EntityEnricher(new TemporalDecayResolver(), metrics);
    }

    @Test
    @DisplayName("Expired critical event decays to routine and is hidden")
    void testExpiredEvent() {
        EventEntity event = TestEntities.event("m1", Importance.CRITICAL, "2025-11-19T18:00:00Z", "2025-11-19T20:00:00Z");

        enricher.enrichEntity(event, NOW);

        assertEquals(Importance.CRITICAL, event.storedImportance());
        assertEquals(Importance.ROUTINE, event.resolvedImportance());
        assertEquals(DecayReason.TEMPORAL_EXPIRED, event.decayReason());
        assertTrue(event.wasModified());
        assertEquals(DigestSection.WORTH_KNOWING, event.digestSection());
        assertTrue(event.hideInDigest());
        assertEquals(Importance.CRITICAL, event.importance(), "Stored importance is not overwritten");
        verify(metrics).recordTemporalDecision(EntityType.EVENT, DecayReason.TEMPORAL_EXPIRED, true, true);
    }

    @Test
    void testUpcomingEventEscalated() {
        EventEntity event = TestEntities.event("m1", Importance.ROUTINE, "2025-11-22T18:00:00Z", null);

        enricher.enrichEntity(event, NOW);

        assertEquals(Importance.TIME_SENSITIVE, event.resolvedImportance());
        assertEquals(DigestSection.COMING_UP, event.digestSection());
        assertFalse(event.hideInDigest());
    }

    @Test
    @DisplayName("Out-for-delivery notification goes to TODAY via the overlay")
    void testNotificationOverlay() {
        NotificationEntity notification = TestEntities.notification("m1", "t1", "Your package is out for delivery",
            Importance.TIME_SENSITIVE, ShipStatus.OUT_FOR_DELIVERY, null, null);

        enricher.enrichEntity(notification, NOW);

        assertEquals(Importance.CRITICAL, notification.resolvedImportance());
        assertEquals(DecayReason.DELIVERY_ACTIVE, notification.decayReason());
        assertEquals(DigestSection.TODAY, notification.digestSection());
        assertFalse(notification.hideInDigest(), "Notifications are never hidden");
    }

    @Test
    void testPlainNotificationIsNonTemporal() {
        NotificationEntity notification = TestEntities.notification("m1", "", "Statement ready",
            Importance.ROUTINE, null, null, null);

        enricher.enrichEntity(notification, NOW);

        assertEquals(DecayReason.NON_TEMPORAL_TYPE, notification.decayReason());
        assertFalse(notification.wasModified());
    }

    @Test
    @DisplayName("In-transit notification with no dates has no temporal data")
    void testShippingNotificationWithoutOverlayMatch() {
        NotificationEntity notification = TestEntities.notification("m1", "t1", "Your order has shipped",
            Importance.TIME_SENSITIVE, ShipStatus.IN_TRANSIT, null, null);

        enricher.enrichEntity(notification, NOW);

        assertEquals(DecayReason.NO_TEMPORAL_DATA, notification.decayReason());
        assertEquals(Importance.TIME_SENSITIVE, notification.resolvedImportance());
        assertEquals(DigestSection.COMING_UP, notification.digestSection());
        assertFalse(notification.wasModified());
        assertFalse(notification.hideInDigest());
    }

    @Test
    void testExpiredOtpNotificationHasNoTemporalData() {
        NotificationEntity notification = TestEntities.notification("m1", "", "Your code",
            Importance.CRITICAL, null, null, "2025-11-20T11:00:00Z");

        enricher.enrichEntity(notification, NOW);

        assertEquals(DecayReason.NO_TEMPORAL_DATA, notification.decayReason());
        assertEquals(Importance.CRITICAL, notification.resolvedImportance());
    }

    @Test
    @DisplayName("Missing stored importance is treated as routine")
    void testMissingImportance() {
        Entity newsletter = TestEntities.newsletter("m1", null);

        enricher.enrichEntity(newsletter, NOW);

        assertEquals(Importance.ROUTINE, newsletter.storedImportance());
        assertEquals(Importance.ROUTINE, newsletter.resolvedImportance());
    }

    @Test
    @DisplayName("Malformed timestamp counts a parse error and falls back to no temporal data")
    void testMalformedTimestamp() {
        EventEntity bad = TestEntities.event("m1", Importance.TIME_SENSITIVE, "tomorrow at 7 PM", null);
        EventEntity good = TestEntities.event("m2", Importance.ROUTINE, "2025-11-22T18:00:00Z", null);

        enricher.enrich(List.of(bad, good), NOW);

        assertEquals(Importance.TIME_SENSITIVE, bad.resolvedImportance());
        assertEquals(DecayReason.NO_TEMPORAL_DATA, bad.decayReason());
        assertTrue(good.isEnriched(), "Batch continues after a parse error");

        TemporalStats.Snapshot stats = enricher.getStats();
        assertEquals(1, stats.parseErrors());
        assertEquals(2, stats.totalProcessed());
        verify(metrics).recordParseError(EntityType.EVENT);
    }

    @Test
    void testStatsCounters() {
        List<Entity> batch = List.of(
            TestEntities.event("up", Importance.ROUTINE, "2025-11-22T18:00:00Z", null),
            TestEntities.event("down", Importance.CRITICAL, "2025-11-18T18:00:00Z", null),
            TestEntities.newsletter("same", Importance.ROUTINE)
        );

        enricher.enrich(batch, NOW);
        TemporalStats.Snapshot stats = enricher.getStats();

        assertEquals(3, stats.totalProcessed());
        assertEquals(1, stats.escalated());
        assertEquals(1, stats.downgraded());
        assertEquals(1, stats.unchanged());
        assertEquals(1, stats.hidden());
        assertEquals(1, stats.reasonCount(DecayReason.TEMPORAL_UPCOMING));
        assertEquals(1, stats.reasonCount(DecayReason.TEMPORAL_EXPIRED));
        assertEquals(1, stats.reasonCount(DecayReason.NON_TEMPORAL_TYPE));
    }

    @Test
    void testStatsSnapshotIsACopyAndResetClears() {
        enricher.enrichEntity(TestEntities.newsletter("m1", Importance.ROUTINE), NOW);
        TemporalStats.Snapshot before = enricher.getStats();

        enricher.resetStats();

        assertEquals(1, before.totalProcessed());
        assertEquals(0, enricher.getStats().totalProcessed());
        assertTrue(enricher.getStats().decayReasons().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> before.decayReasons().put("x", 1L));
    }

    @Test
    @DisplayName("Stats do not influence resolution")
    void testResetDoesNotChangeDecisions() {
        EventEntity first = TestEntities.event("m1", Importance.ROUTINE, "2025-11-22T18:00:00Z", null);
        EventEntity second = TestEntities.event("m2", Importance.ROUTINE, "2025-11-22T18:00:00Z", null);

        enricher.enrichEntity(first, NOW);
        enricher.resetStats();
        enricher.enrichEntity(second, NOW);

        assertEquals(first.resolvedImportance(), second.resolvedImportance());
        assertEquals(first.decayReason(), second.decayReason());
    }

    @Test
    void testFilterVisible() {
        EventEntity expired = TestEntities.event("old", Importance.ROUTINE, "2025-11-18T18:00:00Z", null);
        EventEntity upcoming = TestEntities.event("new", Importance.ROUTINE, "2025-11-22T18:00:00Z", null);
        List<Entity> batch = enricher.enrich(List.of(expired, upcoming), NOW);

        assertEquals(List.of(upcoming), enricher.filterVisible(batch));
    }

    @Test
    void testConcurrentEnrichmentKeepsExactCounts() throws InterruptedException {
        EntityEnricher shared = new EntityEnricher();
        int threads = 8;
        int perThread = 250;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            int id = i;
            new Thread(() -> {
                try {
                    startLatch.await();
                    List<Entity> batch = new ArrayList<>();
                    for (int j = 0; j < perThread; j++) {
                        batch.add(TestEntities.event("m" + id + "-" + j, Importance.ROUTINE, "2025-11-22T18:00:00Z", null));
                    }
                    shared.enrich(batch, NOW);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            }).start();
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "All threads should complete");

        TemporalStats.Snapshot stats = shared.getStats();
        assertEquals(threads * perThread, stats.totalProcessed());
        assertEquals(threads * perThread, stats.escalated());
        assertEquals(threads * perThread, stats.reasonCount(DecayReason.TEMPORAL_UPCOMING));
    }
}
