package io.mailq.infrastructure.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mailq.domain.model.DeadlineEntity;
import io.mailq.domain.model.Entity;
import io.mailq.domain.model.EntitySource;
import io.mailq.domain.model.EntityType;
import io.mailq.domain.model.EventEntity;
import io.mailq.domain.model.FlightEntity;
import io.mailq.domain.model.GenericEntity;
import io.mailq.domain.model.Importance;
import io.mailq.domain.model.NotificationEntity;
import io.mailq.domain.model.PromoEntity;
import io.mailq.domain.model.ReminderEntity;
import io.mailq.domain.model.ShipStatus;
import io.mailq.service.temporal.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extractor JSON ⇄ entities.
 *
 * INPUT: JSON array of objects, snake_case fields, discriminated by "type".
 * Unknown types become {@link GenericEntity} (UNKNOWN), unknown fields are ignored.
 * Missing importance means routine; an unrecognized one is kept as null (routine downstream).
 *
 * OUTPUT: same shape plus the enrichment audit fields.
 */
public final class EntityJsonCodec {
    private static final Logger log = LoggerFactory.getLogger(EntityJsonCodec.class);

    private final ObjectMapper mapper;

    public EntityJsonCodec() {
        this(new ObjectMapper());
    }

    public EntityJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Entity> readEntities(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EntityCodecException("Malformed entity JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new EntityCodecException("Expected a JSON array of entities");
        }

        List<Entity> entities = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new EntityCodecException("Entity at index " + index + " is not an object");
            }
            try {
                entities.add(readEntity(node));
            } catch (IllegalArgumentException e) {
                throw new EntityCodecException("Invalid entity at index " + index + ": " + e.getMessage(), e);
            }
            index++;
        }
        return entities;
    }

    public String writeEntities(List<Entity> entities) {
        ArrayNode array = mapper.createArrayNode();
        for (Entity entity : entities) {
            array.add(writeEntity(entity));
        }
        try {
            return mapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new EntityCodecException("Could not serialize entities", e);
        }
    }

    Entity readEntity(JsonNode node) {
        EntityType type = EntityType.fromWire(text(node, "type"));
        EntitySource source = new EntitySource(
            text(node, "source_email_id"),
            text(node, "source_thread_id"),
            text(node, "source_subject"),
            text(node, "source_snippet"),
            timestamp(node)
        );
        double confidence = node.has("confidence") ? node.get("confidence").asDouble() : 0.0;
        Importance importance = importance(node, source.emailId());

        return switch (type) {
            case FLIGHT -> new FlightEntity(source, confidence, importance,
                text(node, "airline"),
                text(node, "flight_number"),
                text(node, "departure_time"),
                text(node, "confirmation_code"));
            case EVENT -> new EventEntity(source, confidence, importance,
                text(node, "title"),
                text(node, "event_time"),
                text(node, "event_end_time"),
                text(node, "location"),
                text(node, "organizer"));
            case DEADLINE -> new DeadlineEntity(source, confidence, importance,
                text(node, "title"),
                text(node, "due_date"),
                text(node, "amount"),
                text(node, "from_whom"));
            case REMINDER -> new ReminderEntity(source, confidence, importance,
                text(node, "from_sender"),
                text(node, "action"),
                text(node, "deadline"));
            case PROMO -> new PromoEntity(source, confidence, importance,
                text(node, "merchant"),
                text(node, "offer"),
                text(node, "expiry"),
                text(node, "product_category"));
            case NOTIFICATION -> new NotificationEntity(source, confidence, importance,
                text(node, "category"),
                text(node, "message"),
                node.has("action_required") && node.get("action_required").asBoolean(),
                text(node, "otp_expires_at"),
                ShipStatus.fromWire(text(node, "ship_status")),
                text(node, "delivered_at"),
                text(node, "tracking_number"));
            case RECEIPT, NEWSLETTER, UNKNOWN -> new GenericEntity(type, source, confidence, importance);
        };
    }

    ObjectNode writeEntity(Entity entity) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", entity.type().wireValue());
        node.put("confidence", entity.confidence());
        node.put("source_email_id", entity.sourceEmailId());
        node.put("source_thread_id", entity.sourceThreadId());
        node.put("source_subject", entity.sourceSubject());
        node.put("source_snippet", entity.sourceSnippet());
        node.put("timestamp", entity.timestamp() != null ? entity.timestamp().toString() : null);
        node.put("importance", wire(entity.importance()));

        if (entity instanceof FlightEntity flight) {
            node.put("airline", flight.airline());
            node.put("flight_number", flight.flightNumber());
            node.put("departure_time", flight.departureTime());
            node.put("confirmation_code", flight.confirmationCode());
        } else if (entity instanceof EventEntity event) {
            node.put("title", event.title());
            node.put("event_time", event.eventTime());
            node.put("event_end_time", event.eventEndTime());
            node.put("location", event.location());
            node.put("organizer", event.organizer());
        } else if (entity instanceof DeadlineEntity deadline) {
            node.put("title", deadline.title());
            node.put("due_date", deadline.dueDate());
            node.put("amount", deadline.amount());
            node.put("from_whom", deadline.fromWhom());
        } else if (entity instanceof ReminderEntity reminder) {
            node.put("from_sender", reminder.fromSender());
            node.put("action", reminder.action());
            node.put("deadline", reminder.deadline());
        } else if (entity instanceof PromoEntity promo) {
            node.put("merchant", promo.merchant());
            node.put("offer", promo.offer());
            node.put("expiry", promo.expiry());
            node.put("product_category", promo.productCategory());
        } else if (entity instanceof NotificationEntity notification) {
            node.put("category", notification.category());
            node.put("message", notification.message());
            node.put("action_required", notification.actionRequired());
            node.put("otp_expires_at", notification.otpExpiresAt());
            node.put("ship_status", notification.shipStatus() != null ? notification.shipStatus().wireValue() : null);
            node.put("delivered_at", notification.deliveredAt());
            node.put("tracking_number", notification.trackingNumber());
        }

        // Enrichment audit
        node.put("stored_importance", wire(entity.storedImportance()));
        node.put("resolved_importance", wire(entity.resolvedImportance()));
        node.put("decay_reason", entity.decayReason());
        node.put("was_modified", entity.wasModified());
        node.put("digest_section", entity.digestSection() != null ? entity.digestSection().name() : null);
        node.put("hide_in_digest", entity.hideInDigest());
        return node;
    }

    private static Importance importance(JsonNode node, String emailId) {
        String raw = text(node, "importance");
        if (raw == null) {
            return Importance.ROUTINE;
        }
        Optional<Importance> parsed = Importance.fromWire(raw);
        if (parsed.isEmpty()) {
            log.warn("[EntityJsonCodec] Unknown importance '{}' on entity from email {}", raw, emailId);
            return null;
        }
        return parsed.get();
    }

    private static Instant timestamp(JsonNode node) {
        String raw = text(node, "timestamp");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return TimestampParser.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("[EntityJsonCodec] Ignoring malformed timestamp '{}'", raw);
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String wire(Importance importance) {
        return importance != null ? importance.wireValue() : null;
    }
}
