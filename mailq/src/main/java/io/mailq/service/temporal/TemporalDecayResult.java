package io.mailq.service.temporal;

import io.mailq.domain.model.Importance;

import java.time.Instant;

/**
 * Outcome of temporal decay for one entity.
 *
 * @param resolvedImportance importance after decay
 * @param decayReason        rule that fired (see {@link DecayReason})
 * @param wasModified        resolved != stored
 * @param decayedAt          evaluation time when the expiry rule fired, else null
 */
public record TemporalDecayResult(
    Importance resolvedImportance,
    String decayReason,
    boolean wasModified,
    Instant decayedAt
) {
    static TemporalDecayResult unchanged(Importance stored, String reason) {
        return new TemporalDecayResult(stored, reason, false, null);
    }

    static TemporalDecayResult resolved(Importance stored, Importance resolved, String reason) {
        return new TemporalDecayResult(resolved, reason, resolved != stored, null);
    }
}
