package io.mailq.domain.model;

/**
 * Flight itinerary or status update.
 */
public final class FlightEntity extends Entity {
    private final String airline;
    private final String flightNumber;
    private final String departureTime;     // as extracted, e.g. "Tue Oct 28, 5:00 PM"
    private final String confirmationCode;

    public FlightEntity(
        EntitySource source,
        double confidence,
        Importance importance,
        String airline,
        String flightNumber,
        String departureTime,
        String confirmationCode
    ) {
        super(EntityType.FLIGHT, source, confidence, importance);
        this.airline = airline;
        this.flightNumber = flightNumber;
        this.departureTime = departureTime;
        this.confirmationCode = confirmationCode;
    }

    public String airline() {
        return airline;
    }

    public String flightNumber() {
        return flightNumber;
    }

    public String departureTime() {
        return departureTime;
    }

    public String confirmationCode() {
        return confirmationCode;
    }
}
