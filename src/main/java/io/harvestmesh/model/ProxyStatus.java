package io.harvestmesh.model;

import java.util.Locale;

public enum ProxyStatus {
    AVAILABLE,
    LOCKED,
    BLOCKED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProxyStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ProxyStatus value must not be blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
