package io.mailq.domain.model;

/**
 * Unclassified email header data used by the expired-event pre-filter.
 *
 * @param subject       subject line
 * @param snippet       body snippet
 * @param date          send date text (ISO-8601 or RFC 1123), may be blank
 * @param temporalStart event start from ground-truth data, may be blank
 * @param type          email type, e.g. "event" or "calendar"
 */
public record RawEmail(
    String subject,
    String snippet,
    String date,
    String temporalStart,
    String type
) {
    public RawEmail {
        subject = subject != null ? subject : "";
        snippet = snippet != null ? snippet : "";
        date = date != null ? date : "";
        temporalStart = temporalStart != null ? temporalStart : "";
        type = type != null ? type : "";
    }
}
