package io.mailq.domain.model;

import java.util.Locale;

/**
 * Package shipping state reported by a delivery notification.
 */
public enum ShipStatus {
    PROCESSING,
    IN_TRANSIT,
    OUT_FOR_DELIVERY,
    DELIVERED,
    UNKNOWN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ShipStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
