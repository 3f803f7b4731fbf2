package io.mailq.service.dedup;

import io.mailq.domain.model.DeadlineEntity;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.EventEntity;
import io.mailq.domain.model.FlightEntity;
import io.mailq.domain.model.NotificationEntity;
import io.mailq.domain.model.PromoEntity;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deduplication signatures: entities with equal signatures describe the same thing.
 *
 * Parts are trimmed and lower-cased; null parts become "".
 */
public final class EntitySignatures {

    private static final int EMAIL_ID_PREFIX = 20;
    private static final int MIN_NORMALIZED_SUBJECT = 3;

    // Status phrases that differ between updates about the same shipment or account event
    private static final List<Pattern> STATUS_PHRASES = List.of(
        phrase("\\bdelivered\\b"),
        phrase("\\bout for delivery\\b"),
        phrase("\\bshipped\\b"),
        phrase("\\barriving\\s+(soon|today|tomorrow)?\\b"),
        phrase("\\barriving\\b"),
        phrase("\\brate your experience\\b"),
        phrase("\\breview\\s+request\\b"),
        phrase("\\breview\\b"),
        phrase("\\bconfirm\\b"),
        phrase("\\btrack\\b"),
        phrase("\\bhas been\\b"),
        phrase("\\bwill be\\b"),
        phrase("\\bis\\s+(now|ready|available)\\b"),
        phrase("\\bnow\\b")
    );
    private static final Pattern PUNCTUATION_DEBRIS = Pattern.compile("[,;]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private EntitySignatures() {}

    public static String signatureOf(Entity entity) {
        return switch (entity.type()) {
            case FLIGHT -> {
                FlightEntity flight = (FlightEntity) entity;
                yield "flight_" + join(flight.airline(), flight.flightNumber(), flight.departureTime());
            }
            case EVENT -> {
                EventEntity event = (EventEntity) entity;
                yield "event_" + join(event.title(), event.eventTime());
            }
            case DEADLINE -> {
                DeadlineEntity deadline = (DeadlineEntity) entity;
                yield "deadline_" + join(deadline.title(), deadline.dueDate(), deadline.fromWhom());
            }
            case PROMO -> {
                PromoEntity promo = (PromoEntity) entity;
                yield "promo_" + join(promo.merchant(), promo.offer());
            }
            case NOTIFICATION -> notificationSignature((NotificationEntity) entity);
            case REMINDER, RECEIPT, NEWSLETTER, UNKNOWN ->
                normalize(entity.type().wireValue()) + "_" + normalize(entity.sourceSubject());
        };
    }

    /**
     * Subject with status phrases removed, so "Your order has shipped" and
     * "Your order delivered" collapse together. Falls back to the plain subject
     * when stripping leaves fewer than 3 characters.
     */
    public static String normalizeNotificationSubject(String subject) {
        String original = normalize(subject);
        String stripped = original;
        for (Pattern phrase : STATUS_PHRASES) {
            stripped = phrase.matcher(stripped).replaceAll("");
        }
        stripped = PUNCTUATION_DEBRIS.matcher(stripped).replaceAll("");
        stripped = WHITESPACE.matcher(stripped.trim()).replaceAll(" ");
        return stripped.length() < MIN_NORMALIZED_SUBJECT ? original : stripped;
    }

    private static String notificationSignature(NotificationEntity notification) {
        String emailId = normalize(notification.sourceEmailId());
        if (emailId.length() > EMAIL_ID_PREFIX) {
            emailId = emailId.substring(0, EMAIL_ID_PREFIX);
        }
        return "notification_" + normalize(notification.category())
            + "_" + emailId
            + "_" + normalizeNotificationSubject(notification.sourceSubject());
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('_');
            }
            sb.append(normalize(parts[i]));
        }
        return sb.toString();
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static Pattern phrase(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
