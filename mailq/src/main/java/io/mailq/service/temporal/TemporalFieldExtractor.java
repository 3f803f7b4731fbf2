package io.mailq.service.temporal;

import io.mailq.domain.model.DeadlineEntity;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.EventEntity;
import io.mailq.domain.model.NotificationEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Reads the time window and notification signals from an entity.
 *
 * Events: eventTime / eventEndTime. Deadlines: dueDate. Everything else is ABSENT.
 * A malformed end time is dropped; a malformed start time yields MALFORMED.
 */
public final class TemporalFieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(TemporalFieldExtractor.class);

    private TemporalFieldExtractor() {}

    public static TemporalExtraction extract(Entity entity) {
        if (entity instanceof EventEntity event) {
            return window(entity, event.eventTime(), event.eventEndTime());
        }
        if (entity instanceof DeadlineEntity deadline) {
            return window(entity, deadline.dueDate(), null);
        }
        return TemporalExtraction.absent();
    }

    public static NotificationSignals signals(NotificationEntity notification) {
        if (!notification.hasOtpOrShippingFields() && isBlank(notification.deliveredAt())) {
            return NotificationSignals.NONE;
        }

        int malformed = 0;
        Instant otpExpiresAt = null;
        if (!isBlank(notification.otpExpiresAt())) {
            try {
                otpExpiresAt = TimestampParser.parse(notification.otpExpiresAt());
            } catch (DateTimeParseException e) {
                malformed++;
                log.warn("[TemporalFieldExtractor] Malformed otp_expires_at '{}' on email {}",
                    notification.otpExpiresAt(), notification.sourceEmailId());
            }
        }

        Instant deliveredAt = null;
        if (!isBlank(notification.deliveredAt())) {
            try {
                deliveredAt = TimestampParser.parse(notification.deliveredAt());
            } catch (DateTimeParseException e) {
                malformed++;
                log.warn("[TemporalFieldExtractor] Malformed delivered_at '{}' on email {}",
                    notification.deliveredAt(), notification.sourceEmailId());
            }
        }

        return new NotificationSignals(otpExpiresAt, notification.shipStatus(), deliveredAt, malformed);
    }

    private static TemporalExtraction window(Entity entity, String startText, String endText) {
        if (isBlank(startText)) {
            return TemporalExtraction.absent();
        }

        Instant start;
        try {
            start = TimestampParser.parse(startText);
        } catch (DateTimeParseException e) {
            log.warn("[TemporalFieldExtractor] Malformed start time '{}' on {} from email {}",
                startText, entity.type(), entity.sourceEmailId());
            return TemporalExtraction.malformed(e.getMessage());
        }

        Instant end = null;
        if (!isBlank(endText)) {
            try {
                end = TimestampParser.parse(endText);
            } catch (DateTimeParseException e) {
                log.debug("[TemporalFieldExtractor] Ignoring malformed end time '{}' from email {}",
                    endText, entity.sourceEmailId());
            }
        }
        return TemporalExtraction.present(start, end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
