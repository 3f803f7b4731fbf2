package io.mailq.domain.model;

public final class PromoEntity extends Entity {
    private final String merchant;
    private final String offer;             // "25% off", "$20 off $50"
    private final String expiry;
    private final String productCategory;

    public PromoEntity(
        EntitySource source,
        double confidence,
        Importance importance,
        String merchant,
        String offer,
        String expiry,
        String productCategory
    ) {
        super(EntityType.PROMO, source, confidence, importance);
        this.merchant = merchant;
        this.offer = offer;
        this.expiry = expiry;
        this.productCategory = productCategory;
    }

    public String merchant() {
        return merchant;
    }

    public String offer() {
        return offer;
    }

    public String expiry() {
        return expiry;
    }

    public String productCategory() {
        return productCategory;
    }
}
