package io.mailq.service.temporal;

/**
 * Decay reason tags recorded on enriched entities and in the stats histogram.
 */
public final class DecayReason {
    public static final String NO_TEMPORAL_DATA = "no_temporal_data";
    public static final String NON_TEMPORAL_TYPE = "non_temporal_type";
    public static final String TEMPORAL_EXPIRED = "temporal_expired";
    public static final String TEMPORAL_ACTIVE = "temporal_active";
    public static final String TEMPORAL_UPCOMING = "temporal_upcoming";
    public static final String TEMPORAL_DISTANT = "temporal_distant";
    public static final String TEMPORAL_DISTANT_BUT_CRITICAL = "temporal_distant_but_critical";
    public static final String OTP_ACTIVE = "otp_active";
    public static final String DELIVERY_ACTIVE = "delivery_active";
    public static final String DELIVERY_STALE = "delivery_stale";

    private DecayReason() {}
}
