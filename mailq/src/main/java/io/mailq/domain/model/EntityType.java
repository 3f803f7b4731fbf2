package io.mailq.domain.model;

import java.util.Locale;

/**
 * Entity discriminant as emitted by the extractor.
 */
public enum EntityType {
    FLIGHT,
    EVENT,
    DEADLINE,
    REMINDER,
    PROMO,
    NOTIFICATION,
    RECEIPT,
    NEWSLETTER,
    UNKNOWN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Events and deadlines carry a time window that drives decay and hiding.
     */
    public boolean isTemporal() {
        return this == EVENT || this == DEADLINE;
    }

    public static EntityType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
