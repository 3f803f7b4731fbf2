package io.mailq.service.temporal;

import io.mailq.domain.model.RawEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drops emails about events that already happened, before extraction.
 *
 * PATTERNS:
 * 0. event/calendar email whose temporal start is more than 1h in the past
 * 1. calendar accepted/declined reply for a date more than 2h in the past
 * 2. "starts in N hours/days/minutes" reminder whose start already passed
 * 3. "Notification:" for a date more than 2h in the past
 *
 * Unparseable dates keep the email. All times are UTC.
 */
public final class ExpiredEmailFilter {
    private static final Logger log = LoggerFactory.getLogger(ExpiredEmailFilter.class);

    private static final Duration EVENT_BUFFER = Duration.ofHours(1);
    private static final Duration CALENDAR_BUFFER = Duration.ofHours(2);

    private static final Pattern CALENDAR_DATE = Pattern.compile(
        "@\\s+(?:Mon|Tue|Wed|Thu|Fri|Sat|Sun)\\s+(\\w+)\\s+(\\d+)(?:,?\\s+(\\d{4}))?(?:\\s+(\\d+)([ap]m))?",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern STARTS_IN_HOURS = Pattern.compile("starts in (\\d+)\\s*(hour|hr)s?", Pattern.CASE_INSENSITIVE);
    private static final Pattern STARTS_IN_DAYS = Pattern.compile("starts in (\\d+)\\s*days?", Pattern.CASE_INSENSITIVE);
    private static final Pattern STARTS_IN_MINUTES = Pattern.compile("starts in (\\d+)\\s*(minute|min)s?", Pattern.CASE_INSENSITIVE);

    private ExpiredEmailFilter() {}

    public static List<RawEmail> filter(List<RawEmail> emails, Instant now) {
        List<RawEmail> kept = new ArrayList<>(emails.size());
        for (RawEmail email : emails) {
            if (!isExpired(email, now)) {
                kept.add(email);
            }
        }
        if (kept.size() < emails.size()) {
            log.info("[ExpiredEmailFilter] Dropped {} expired of {} emails", emails.size() - kept.size(), emails.size());
        }
        return kept;
    }

    public static boolean isExpired(RawEmail email, Instant now) {
        String subject = email.subject().toLowerCase(Locale.ROOT);
        String snippet = email.snippet().toLowerCase(Locale.ROOT);

        boolean eventType = "event".equals(email.type()) || "calendar".equals(email.type());
        if (eventType && !email.temporalStart().isBlank()) {
            try {
                Instant start = TimestampParser.parse(email.temporalStart());
                if (start.isBefore(now.minus(EVENT_BUFFER))) {
                    return true;
                }
            } catch (DateTimeParseException e) {
                log.debug("[ExpiredEmailFilter] Unparseable temporal_start '{}'", email.temporalStart());
            }
        }

        Instant sentAt = null;
        if (!email.date().isBlank()) {
            Optional<Instant> parsed = parseSendDate(email.date());
            if (parsed.isEmpty()) {
                log.warn("[ExpiredEmailFilter] Failed to parse email date '{}', keeping email", email.date());
                return false;
            }
            sentAt = parsed.get();
        }

        int currentYear = now.atZone(ZoneOffset.UTC).getYear();

        if (subject.contains("accepted:") || subject.contains("declined:")
            || snippet.contains("you accepted") || snippet.contains("you declined")) {
            Optional<Instant> eventDate = calendarDate(email.subject(), currentYear);
            if (eventDate.isPresent() && eventDate.get().isBefore(now.minus(CALENDAR_BUFFER))) {
                return true;
            }
        }

        if (subject.contains("starts in") || subject.contains("don't forget") || snippet.contains("starts in")) {
            Optional<Instant> startsAt = startsInTime(email.subject() + " " + email.snippet(), sentAt);
            if (startsAt.isPresent() && startsAt.get().isBefore(now)) {
                return true;
            }
        }

        if (subject.contains("notification:")) {
            Optional<Instant> eventDate = calendarDate(email.subject(), currentYear);
            return eventDate.isPresent() && eventDate.get().isBefore(now.minus(CALENDAR_BUFFER));
        }

        return false;
    }

    /**
     * "@ Tue Nov 18, 2025 7pm" → 2025-11-18T19:00Z. Year defaults to the current one.
     */
    static Optional<Instant> calendarDate(String subject, int defaultYear) {
        Matcher m = CALENDAR_DATE.matcher(subject);
        if (!m.find()) {
            return Optional.empty();
        }

        Optional<Month> month = parseMonth(m.group(1));
        if (month.isEmpty()) {
            return Optional.empty();
        }

        try {
            int day = Integer.parseInt(m.group(2));
            int year = m.group(3) != null ? Integer.parseInt(m.group(3)) : defaultYear;
            int hour = 0;
            if (m.group(4) != null && m.group(5) != null) {
                hour = Integer.parseInt(m.group(4));
                boolean pm = m.group(5).equalsIgnoreCase("pm");
                if (pm && hour != 12) {
                    hour += 12;
                } else if (!pm && hour == 12) {
                    hour = 0;
                }
            }
            return Optional.of(LocalDate.of(year, month.get(), day)
                .atTime(hour, 0)
                .toInstant(ZoneOffset.UTC));
        } catch (RuntimeException e) {
            log.debug("[ExpiredEmailFilter] Could not build event date from '{}': {}", m.group(), e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<Instant> startsInTime(String text, Instant sentAt) {
        if (sentAt == null) {
            return Optional.empty();
        }
        try {
            Matcher hours = STARTS_IN_HOURS.matcher(text);
            if (hours.find()) {
                return Optional.of(sentAt.plus(Duration.ofHours(Long.parseLong(hours.group(1)))));
            }
            Matcher days = STARTS_IN_DAYS.matcher(text);
            if (days.find()) {
                return Optional.of(sentAt.plus(Duration.ofDays(Long.parseLong(days.group(1)))));
            }
            Matcher minutes = STARTS_IN_MINUTES.matcher(text);
            if (minutes.find()) {
                return Optional.of(sentAt.plus(Duration.ofMinutes(Long.parseLong(minutes.group(1)))));
            }
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            log.debug("[ExpiredEmailFilter] Ignoring out-of-range 'starts in' offset: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseSendDate(String date) {
        String value = date.trim();
        try {
            if (Character.isDigit(value.charAt(0))) {
                return Optional.of(TimestampParser.parse(value));
            }
            // Mail headers: "Tue, 18 Nov 2025 10:00:00 -0800"
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Month> parseMonth(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.length() < 3) {
            return Optional.empty();
        }
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            if (full.equals(lower) || full.substring(0, 3).equals(lower) || (lower.equals("sept") && month == Month.SEPTEMBER)) {
                return Optional.of(month);
            }
        }
        return Optional.empty();
    }
}
