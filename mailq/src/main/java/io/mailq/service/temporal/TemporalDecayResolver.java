package io.mailq.service.temporal;

import io.mailq.config.TemporalPolicy;
import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.EntityType;
import io.mailq.domain.model.Importance;
import io.mailq.domain.model.ShipStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Temporal Decay Resolver - importance as a function of time.
 *
 * DECISION TABLE (first match wins, end defaults to start):
 * - not event/deadline             → unchanged, non_temporal_type
 * - no start                       → unchanged, no_temporal_data
 * - end + grace &lt; now             → routine, temporal_expired
 * - start - window ≤ now ≤ end + window → critical, temporal_active
 * - start ≤ now + horizon          → at least time_sensitive, temporal_upcoming
 * - stored critical                → critical, temporal_distant_but_critical
 * - otherwise                      → routine, temporal_distant
 *
 * NOTIFICATION OVERLAY (checked before the table for notifications):
 * - OTP not yet expired            → critical, otp_active
 * - out for delivery               → critical, delivery_active
 * - delivered more than 24h ago    → routine, delivery_stale
 *
 * Pure: no clock reads, no shared state.
 */
public final class TemporalDecayResolver {

    private final TemporalPolicy policy;

    public TemporalDecayResolver() {
        this(TemporalPolicy.defaults());
    }

    public TemporalDecayResolver(TemporalPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public TemporalPolicy policy() {
        return policy;
    }

    public TemporalDecayResult resolve(EntityType type, Importance stored, Instant start, Instant end, Instant now) {
        if (!type.isTemporal()) {
            return TemporalDecayResult.unchanged(stored, DecayReason.NON_TEMPORAL_TYPE);
        }
        if (start == null) {
            return TemporalDecayResult.unchanged(stored, DecayReason.NO_TEMPORAL_DATA);
        }

        Instant effectiveEnd = end != null ? end : start;

        if (effectiveEnd.plus(policy.gracePeriod()).isBefore(now)) {
            return new TemporalDecayResult(
                Importance.ROUTINE,
                DecayReason.TEMPORAL_EXPIRED,
                stored != Importance.ROUTINE,
                now
            );
        }

        Instant activeFrom = start.minus(policy.activeWindow());
        Instant activeUntil = effectiveEnd.plus(policy.activeWindow());
        if (!now.isBefore(activeFrom) && !now.isAfter(activeUntil)) {
            return TemporalDecayResult.resolved(stored, Importance.CRITICAL, DecayReason.TEMPORAL_ACTIVE);
        }

        if (!start.isAfter(now.plus(policy.upcomingHorizon()))) {
            Importance escalated = stored == Importance.CRITICAL ? Importance.CRITICAL : Importance.TIME_SENSITIVE;
            return TemporalDecayResult.resolved(stored, escalated, DecayReason.TEMPORAL_UPCOMING);
        }

        if (stored == Importance.CRITICAL) {
            return TemporalDecayResult.unchanged(stored, DecayReason.TEMPORAL_DISTANT_BUT_CRITICAL);
        }
        return TemporalDecayResult.resolved(stored, Importance.ROUTINE, DecayReason.TEMPORAL_DISTANT);
    }

    /**
     * Notification overlay. Empty when no overlay rule applies.
     */
    public Optional<TemporalDecayResult> resolveNotification(NotificationSignals signals, Importance stored, Instant now) {
        if (signals.otpExpiresAt() != null && now.isBefore(signals.otpExpiresAt())) {
            return Optional.of(TemporalDecayResult.resolved(stored, Importance.CRITICAL, DecayReason.OTP_ACTIVE));
        }
        if (signals.shipStatus() == ShipStatus.OUT_FOR_DELIVERY) {
            return Optional.of(TemporalDecayResult.resolved(stored, Importance.CRITICAL, DecayReason.DELIVERY_ACTIVE));
        }
        if (signals.shipStatus() == ShipStatus.DELIVERED
            && signals.deliveredAt() != null
            && signals.deliveredAt().plus(policy.deliveryStaleAfter()).isBefore(now)) {
            return Optional.of(TemporalDecayResult.resolved(stored, Importance.ROUTINE, DecayReason.DELIVERY_STALE));
        }
        return Optional.empty();
    }

    public DigestSection sectionFor(Importance resolved) {
        return DigestSection.forImportance(resolved);
    }

    /**
     * Hide only events/deadlines that resolved to routine and are past their grace period.
     */
    public boolean shouldHide(EntityType type, Importance resolved, Instant start, Instant end, Instant now) {
        if (!type.isTemporal() || resolved != Importance.ROUTINE || start == null) {
            return false;
        }
        Instant effectiveEnd = end != null ? end : start;
        return effectiveEnd.plus(policy.gracePeriod()).isBefore(now);
    }
}
