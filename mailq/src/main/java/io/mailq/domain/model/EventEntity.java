package io.mailq.domain.model;

/**
 * Calendar event, class, appointment or reservation.
 *
 * Times are the extractor's ISO-8601 text; parsing happens during enrichment.
 */
public final class EventEntity extends Entity {
    private final String title;
    private final String eventTime;
    private final String eventEndTime;
    private final String location;
    private final String organizer;

    public EventEntity(
        EntitySource source,
        double confidence,
        Importance importance,
        String title,
        String eventTime,
        String eventEndTime,
        String location,
        String organizer
    ) {
        super(EntityType.EVENT, source, confidence, importance);
        this.title = title;
        this.eventTime = eventTime;
        this.eventEndTime = eventEndTime;
        this.location = location;
        this.organizer = organizer;
    }

    public String title() {
        return title;
    }

    public String eventTime() {
        return eventTime;
    }

    public String eventEndTime() {
        return eventEndTime;
    }

    public String location() {
        return location;
    }

    public String organizer() {
        return organizer;
    }
}
