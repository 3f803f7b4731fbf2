package io.mailq.domain.model;

/**
 * Entity without subtype fields: receipts, newsletters and unrecognized types.
 */
public final class GenericEntity extends Entity {

    public GenericEntity(EntityType type, EntitySource source, double confidence, Importance importance) {
        super(type, source, confidence, importance);
        switch (type) {
            case RECEIPT, NEWSLETTER, UNKNOWN -> { }
            default -> throw new IllegalArgumentException("Use the dedicated entity class for " + type);
        }
    }
}
