package io.mailq.domain.model;

import java.util.Optional;

/**
 * Importance level assigned to an email or entity.
 *
 * Order: ROUTINE < TIME_SENSITIVE < CRITICAL
 */
public enum Importance {
    ROUTINE("routine", 1),
    TIME_SENSITIVE("time_sensitive", 2),
    CRITICAL("critical", 3);

    private final String wireValue;
    private final int rank;

    Importance(String wireValue, int rank) {
        this.wireValue = wireValue;
        this.rank = rank;
    }

    /**
     * Lower-case form used by the upstream classifier and the guardrail config.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Rank used for escalation checks and best-entity selection (routine=1 .. critical=3).
     */
    public int rank() {
        return rank;
    }

    public boolean isHigherThan(Importance other) {
        return other == null || rank > other.rank;
    }

    /**
     * Rank of a possibly-unknown importance. Unknown ranks 0.
     */
    public static int rankOf(Importance importance) {
        return importance == null ? 0 : importance.rank;
    }

    /**
     * Parse a wire value. Exact match only: case or padding variants are unrecognized.
     */
    public static Optional<Importance> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Importance importance : values()) {
            if (importance.wireValue.equals(value)) {
                return Optional.of(importance);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
