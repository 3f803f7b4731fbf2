package io.mailq.service.enrichment;

import io.mailq.config.TemporalPolicy;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.EntityType;
import io.mailq.domain.model.Importance;
import io.mailq.service.temporal.TemporalExtraction;
import io.mailq.service.temporal.TemporalFieldExtractor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sanity checks on enriched entities. Reports, never corrects.
 *
 * "Past" means past the grace period: inside it an entity may still be active.
 */
public final class TemporalInvariantChecker {

    private TemporalInvariantChecker() {}

    public static List<String> check(Entity entity, Instant now) {
        return check(entity, now, TemporalPolicy.defaults().gracePeriod());
    }

    public static List<String> check(Entity entity, Instant now, Duration gracePeriod) {
        List<String> violations = new ArrayList<>();
        if (!entity.isEnriched()) {
            return violations;
        }

        Importance resolved = entity.resolvedImportance();

        if (entity.type() == EntityType.NEWSLETTER && resolved == Importance.CRITICAL) {
            violations.add("newsletter resolved to critical: email=" + entity.sourceEmailId());
        }

        TemporalExtraction window = TemporalFieldExtractor.extract(entity);
        if (window.status() == TemporalExtraction.Status.PRESENT) {
            Instant end = window.end() != null ? window.end() : window.start();
            if (end.plus(gracePeriod).isBefore(now) && (resolved == Importance.CRITICAL || resolved == Importance.TIME_SENSITIVE)) {
                violations.add("expired " + entity.type().wireValue() + " resolved to " + resolved
                    + ": email=" + entity.sourceEmailId() + " end=" + end);
            }
        }
        return violations;
    }
}
