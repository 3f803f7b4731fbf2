package io.mailq.service.temporal;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * ISO-8601 timestamp parsing for extractor output.
 *
 * Accepted:
 * - 2025-11-21T18:00:00Z, 2025-11-21T18:00:00+05:30
 * - 2025-11-21T18:00:00 (naive → UTC)
 * - 2025-11-21 18:00:00 (space separator)
 * - 2025-11-21 (midnight UTC)
 */
public final class TimestampParser {

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:.*");

    private TimestampParser() {}

    /**
     * @throws DateTimeParseException if the text is not an accepted form
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DateTimeParseException("Empty timestamp", String.valueOf(text), 0);
        }

        String value = text.trim();
        if (SPACE_SEPARATED.matcher(value).matches()) {
            value = value.substring(0, 10) + "T" + value.substring(11);
        }

        if (value.length() == 10) {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
        }

        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            // No offset: timezone-naive values are UTC
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                .toInstant(ZoneOffset.UTC);
        }
    }
}
