package io.mailq.domain.model;

/**
 * Generic notification: deliveries, security codes, account alerts.
 *
 * OTP and shipping fields feed the notification overlay of temporal decay.
 */
public final class NotificationEntity extends Entity {
    private final String category;          // "package_delivery", "fraud_alert", "bill"
    private final String message;
    private final boolean actionRequired;
    private final String otpExpiresAt;      // ISO-8601
    private final ShipStatus shipStatus;
    private final String deliveredAt;       // ISO-8601
    private final String trackingNumber;

    public NotificationEntity(
        EntitySource source,
        double confidence,
        Importance importance,
        String category,
        String message,
        boolean actionRequired,
        String otpExpiresAt,
        ShipStatus shipStatus,
        String deliveredAt,
        String trackingNumber
    ) {
        super(EntityType.NOTIFICATION, source, confidence, importance);
        this.category = category;
        this.message = message;
        this.actionRequired = actionRequired;
        this.otpExpiresAt = otpExpiresAt;
        this.shipStatus = shipStatus;
        this.deliveredAt = deliveredAt;
        this.trackingNumber = trackingNumber;
    }

    public String category() {
        return category;
    }

    public String message() {
        return message;
    }

    public boolean actionRequired() {
        return actionRequired;
    }

    public String otpExpiresAt() {
        return otpExpiresAt;
    }

    public ShipStatus shipStatus() {
        return shipStatus;
    }

    public String deliveredAt() {
        return deliveredAt;
    }

    public String trackingNumber() {
        return trackingNumber;
    }

    public boolean hasOtpOrShippingFields() {
        return (otpExpiresAt != null && !otpExpiresAt.isBlank()) || shipStatus != null;
    }
}
