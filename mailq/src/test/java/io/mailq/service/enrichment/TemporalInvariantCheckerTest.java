package io.mailq.service.enrichment;

import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.EventEntity;
import io.mailq.domain.model.Importance;
import io.mailq.domain.model.TestEntities;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemporalInvariantCheckerTest {

    private static final Instant NOW = Instant.parse("2025-11-20T12:00:00Z");

    @Test
    void testCriticalNewsletterIsFlagged() {
        Entity newsletter = TestEntities.newsletter("m1", Importance.CRITICAL);
        newsletter.recordResolution(Importance.CRITICAL, Importance.CRITICAL, "non_temporal_type", false,
            DigestSection.TODAY, false);

        List<String> violations = TemporalInvariantChecker.check(newsletter, NOW);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("newsletter"));
    }

    @Test
    void testExpiredEventStillTimeSensitiveIsFlagged() {
        EventEntity event = TestEntities.event("m1", Importance.TIME_SENSITIVE, "2025-11-18T18:00:00Z", null);
        event.recordResolution(Importance.TIME_SENSITIVE, Importance.TIME_SENSITIVE, "temporal_upcoming", false,
            DigestSection.COMING_UP, false);

        assertEquals(1, TemporalInvariantChecker.check(event, NOW).size());
    }

    @Test
    void testEnricherOutputHasNoViolations() {
        EntityEnricher enricher = new EntityEnricher();
        List<Entity> batch = enricher.enrich(List.of(
            TestEntities.event("past", Importance.CRITICAL, "2025-11-18T18:00:00Z", "2025-11-18T19:00:00Z"),
            TestEntities.event("now", Importance.ROUTINE, "2025-11-20T11:30:00Z", "2025-11-20T13:00:00Z"),
            TestEntities.deadline("due", Importance.CRITICAL, "2025-11-10"),
            TestEntities.newsletter("news", Importance.ROUTINE)
        ), NOW);

        for (Entity entity : batch) {
            assertEquals(List.of(), TemporalInvariantChecker.check(entity, NOW), entity.toString());
        }
    }

    @Test
    void testUnenrichedEntityHasNoViolations() {
        assertTrue(TemporalInvariantChecker.check(TestEntities.newsletter("m1", Importance.CRITICAL), NOW).isEmpty());
    }
}
