package io.mailq.service.temporal;

import io.mailq.domain.model.ShipStatus;

import java.time.Instant;

/**
 * Parsed OTP and shipping fields of a notification.
 *
 * @param otpExpiresAt    OTP expiry, null when absent or malformed
 * @param shipStatus      shipping state, null when absent
 * @param deliveredAt     delivery time, null when absent or malformed
 * @param malformedFields count of timestamp fields that failed to parse
 */
public record NotificationSignals(
    Instant otpExpiresAt,
    ShipStatus shipStatus,
    Instant deliveredAt,
    int malformedFields
) {
    public static final NotificationSignals NONE = new NotificationSignals(null, null, null, 0);

    public boolean isEmpty() {
        return otpExpiresAt == null && shipStatus == null && deliveredAt == null;
    }
}
