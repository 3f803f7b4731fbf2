package io.mailq.domain.model;

public final class ReminderEntity extends Entity {
    private final String fromSender;
    private final String action;    // "schedule a cleaning", "renew license"
    private final String deadline;

    public ReminderEntity(
        EntitySource source,
        double confidence,
        Importance importance,
        String fromSender,
        String action,
        String deadline
    ) {
        super(EntityType.REMINDER, source, confidence, importance);
        this.fromSender = fromSender;
        this.action = action;
        this.deadline = deadline;
    }

    public String fromSender() {
        return fromSender;
    }

    public String action() {
        return action;
    }

    public String deadline() {
        return deadline;
    }
}
