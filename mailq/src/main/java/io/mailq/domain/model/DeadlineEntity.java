package io.mailq.domain.model;

/**
 * Bill, payment or task with a due date. Deadlines are a point in time (no end).
 */
public final class DeadlineEntity extends Entity {
    private final String title;
    private final String dueDate;
    private final String amount;    // "$145.00"
    private final String fromWhom;  // "PG&E", "Landlord"

    public DeadlineEntity(
        EntitySource source,
        double confidence,
        Importance importance,
        String title,
        String dueDate,
        String amount,
        String fromWhom
    ) {
        super(EntityType.DEADLINE, source, confidence, importance);
        this.title = title;
        this.dueDate = dueDate;
        this.amount = amount;
        this.fromWhom = fromWhom;
    }

    public String title() {
        return title;
    }

    public String dueDate() {
        return dueDate;
    }

    public String amount() {
        return amount;
    }

    public String fromWhom() {
        return fromWhom;
    }
}
