package io.mailq.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured record extracted from an email.
 *
 * LIFECYCLE:
 * - Created by the extractor with the upstream model's importance
 * - Importance may be replaced once by the bridge decision of its source email
 * - Audit fields set once by enrichment
 * - Filtered (never edited) by deduplication, read-only afterwards
 *
 * Audit fields are null/false until {@link #recordResolution} runs.
 */
public abstract class Entity {

    private final EntityType type;
    private final EntitySource source;
    private final double confidence;
    private Importance importance;

    // Enrichment audit
    private Importance storedImportance;
    private Importance resolvedImportance;
    private String decayReason;
    private boolean wasModified;
    private DigestSection digestSection;
    private boolean hideInDigest;

    protected Entity(EntityType type, EntitySource source, double confidence, Importance importance) {
        this.type = Objects.requireNonNull(type, "type");
        this.source = Objects.requireNonNull(source, "source");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
        this.confidence = confidence;
        this.importance = importance;
    }

    public EntityType type() {
        return type;
    }

    public EntitySource source() {
        return source;
    }

    public String sourceEmailId() {
        return source.emailId();
    }

    public String sourceThreadId() {
        return source.threadId();
    }

    public String sourceSubject() {
        return source.subject();
    }

    public String sourceSnippet() {
        return source.snippet();
    }

    public Instant timestamp() {
        return source.timestamp();
    }

    public double confidence() {
        return confidence;
    }

    /**
     * Importance stored by the upstream model, null when it was not recognized.
     */
    public Importance importance() {
        return importance;
    }

    /**
     * Replace the upstream importance with the bridge decision for the source email.
     */
    public void applyImportance(Importance importance) {
        if (isEnriched()) {
            throw new IllegalStateException("Importance is frozen after enrichment: " + sourceEmailId());
        }
        this.importance = importance;
    }

    /**
     * Record the outcome of temporal resolution.
     */
    public void recordResolution(
        Importance storedImportance,
        Importance resolvedImportance,
        String decayReason,
        boolean wasModified,
        DigestSection digestSection,
        boolean hideInDigest
    ) {
        this.storedImportance = Objects.requireNonNull(storedImportance, "storedImportance");
        this.resolvedImportance = Objects.requireNonNull(resolvedImportance, "resolvedImportance");
        this.decayReason = decayReason;
        this.wasModified = wasModified;
        this.digestSection = Objects.requireNonNull(digestSection, "digestSection");
        this.hideInDigest = hideInDigest;
    }

    public boolean isEnriched() {
        return resolvedImportance != null;
    }

    public Importance storedImportance() {
        return storedImportance;
    }

    public Importance resolvedImportance() {
        return resolvedImportance;
    }

    public String decayReason() {
        return decayReason;
    }

    public boolean wasModified() {
        return wasModified;
    }

    public DigestSection digestSection() {
        return digestSection;
    }

    public boolean hideInDigest() {
        return hideInDigest;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{email=" + sourceEmailId()
            + ", thread=" + sourceThreadId()
            + ", importance=" + importance
            + ", resolved=" + resolvedImportance
            + ", section=" + digestSection
            + ", hidden=" + hideInDigest + "}";
    }
}
