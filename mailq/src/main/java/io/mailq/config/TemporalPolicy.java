package io.mailq.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Thresholds for temporal decay.
 *
 * Bound from the {@code temporal_decay} section of mailq-policy.yaml.
 * Used by TemporalDecayResolver for expiry, active, upcoming and delivery windows.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemporalPolicy(
    @JsonProperty("grace_period_hours")
    Double gracePeriodHours,        // past end/start before an item counts as expired

    @JsonProperty("active_window_hours")
    Double activeWindowHours,       // padding around [start, end] that counts as "happening now"

    @JsonProperty("upcoming_horizon_days")
    Double upcomingHorizonDays,     // start within this many days => coming up

    @JsonProperty("delivery_stale_hours")
    Double deliveryStaleHours       // delivered longer ago than this => routine
) {
    public static final double DEFAULT_GRACE_PERIOD_HOURS = 1.0;
    public static final double DEFAULT_ACTIVE_WINDOW_HOURS = 1.0;
    public static final double DEFAULT_UPCOMING_HORIZON_DAYS = 7.0;
    public static final double DEFAULT_DELIVERY_STALE_HOURS = 24.0;

    /**
     * Default policy: 1h grace, 1h active window, 7 day horizon, 24h delivery staleness.
     */
    public static TemporalPolicy defaults() {
        return new TemporalPolicy(
            DEFAULT_GRACE_PERIOD_HOURS,
            DEFAULT_ACTIVE_WINDOW_HOURS,
            DEFAULT_UPCOMING_HORIZON_DAYS,
            DEFAULT_DELIVERY_STALE_HOURS
        );
    }

    /**
     * Fill fields missing from a partial config with defaults.
     */
    public TemporalPolicy withDefaults() {
        return new TemporalPolicy(
            gracePeriodHours != null ? gracePeriodHours : DEFAULT_GRACE_PERIOD_HOURS,
            activeWindowHours != null ? activeWindowHours : DEFAULT_ACTIVE_WINDOW_HOURS,
            upcomingHorizonDays != null ? upcomingHorizonDays : DEFAULT_UPCOMING_HORIZON_DAYS,
            deliveryStaleHours != null ? deliveryStaleHours : DEFAULT_DELIVERY_STALE_HOURS
        );
    }

    /**
     * Validate configuration values. All windows must be non-negative and bounded.
     */
    public boolean isValid() {
        return inRange(gracePeriodHours, 0, 24 * 7)
            && inRange(activeWindowHours, 0, 24 * 7)
            && inRange(upcomingHorizonDays, 0, 365)
            && inRange(deliveryStaleHours, 0, 24 * 30);
    }

    public Duration gracePeriod() {
        return hours(gracePeriodHours);
    }

    public Duration activeWindow() {
        return hours(activeWindowHours);
    }

    public Duration upcomingHorizon() {
        return hours(upcomingHorizonDays * 24);
    }

    public Duration deliveryStaleAfter() {
        return hours(deliveryStaleHours);
    }

    private static Duration hours(double hours) {
        return Duration.ofSeconds(Math.round(hours * 3600));
    }

    private static boolean inRange(Double value, double min, double max) {
        return value != null && !value.isNaN() && value >= min && value <= max;
    }
}
