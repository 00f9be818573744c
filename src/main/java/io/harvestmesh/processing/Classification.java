package io.harvestmesh.processing;

import java.util.Locale;

/**
 * Closed set of results one processing attempt can report.
 */
public enum Classification {
    BLOCKED_HARD,
    RATE_LIMITED_UNRESOLVED,
    /**
     * A challenge was solved; the real outcome is carried in {@link ProcessingOutcome#then()}.
     */
    RATE_LIMITED_RESOLVED,
    CONTENT_FOUND,
    CONTENT_REMOVED,
    EXTRACTION_FAILED,
    UNEXPECTED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Classification fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("classification must not be blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
