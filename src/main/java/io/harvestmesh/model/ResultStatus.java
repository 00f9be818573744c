package io.harvestmesh.model;

import java.util.Locale;

public enum ResultStatus {
    SUCCESS,
    UNAVAILABLE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResultStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ResultStatus value must not be blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
