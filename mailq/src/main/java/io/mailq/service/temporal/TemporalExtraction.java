package io.mailq.service.temporal;

import java.time.Instant;

/**
 * Result of reading an entity's time window.
 *
 * PRESENT:   start parsed (end may still be null)
 * ABSENT:    entity carries no time window
 * MALFORMED: start text could not be parsed; callers fall back to "no temporal data"
 *
 * @param status outcome
 * @param start  window start, null unless PRESENT
 * @param end    window end, null when absent or unparseable
 * @param error  parse failure detail, null unless MALFORMED
 */
public record TemporalExtraction(
    Status status,
    Instant start,
    Instant end,
    String error
) {
    public enum Status {
        PRESENT,
        ABSENT,
        MALFORMED
    }

    private static final TemporalExtraction ABSENT = new TemporalExtraction(Status.ABSENT, null, null, null);

    public static TemporalExtraction present(Instant start, Instant end) {
        return new TemporalExtraction(Status.PRESENT, start, end, null);
    }

    public static TemporalExtraction absent() {
        return ABSENT;
    }

    public static TemporalExtraction malformed(String error) {
        return new TemporalExtraction(Status.MALFORMED, null, null, error);
    }

    public boolean isMalformed() {
        return status == Status.MALFORMED;
    }
}
