package io.mailq.domain.model;

/**
 * Digest bucket an entity is rendered into.
 */
public enum DigestSection {
    TODAY,          // critical
    COMING_UP,      // time_sensitive
    WORTH_KNOWING;  // routine

    /**
     * Total mapping from resolved importance to section.
     */
    public static DigestSection forImportance(Importance importance) {
        return switch (importance) {
            case CRITICAL -> TODAY;
            case TIME_SENSITIVE -> COMING_UP;
            case ROUTINE -> WORTH_KNOWING;
        };
    }
}
