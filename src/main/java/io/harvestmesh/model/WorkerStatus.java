package io.harvestmesh.model;

import java.util.Locale;

public enum WorkerStatus {
    ACTIVE,
    STOPPED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkerStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("WorkerStatus value must not be blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
