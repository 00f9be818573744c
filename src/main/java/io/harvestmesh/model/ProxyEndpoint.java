package io.harvestmesh.model;

/**
 * Parsed proxy connection string. Accepted forms are {@code host:port} and
 * {@code host:port:user:pass}.
 */
public record ProxyEndpoint(String host, int port, String username, String password) {
    private static final String MASK = "***";

    public static ProxyEndpoint parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("proxy must not be blank");
        }
        String[] parts = raw.trim().split(":", -1);
        if (parts.length != 2 && parts.length != 4) {
            throw new IllegalArgumentException("Invalid proxy format: '" + masked(raw) + "', expected host:port:user:pass");
        }
        String host = parts[0].trim();
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Invalid proxy host: '" + masked(raw) + "'");
        }
        int port;
        try {
            port = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid proxy port: '" + masked(raw) + "'", e);
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("Proxy port out of range: '" + masked(raw) + "'");
        }
        if (parts.length == 2) {
            return new ProxyEndpoint(host, port, null, null);
        }
        return new ProxyEndpoint(host, port, parts[2], parts[3]);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public String server() {
        return "http://" + host + ":" + port;
    }

    public String connection() {
        if (!hasCredentials()) {
            return host + ":" + port;
        }
        return host + ":" + port + ":" + username + ":" + password;
    }

    public String masked() {
        if (!hasCredentials()) {
            return host + ":" + port;
        }
        return host + ":" + port + ":" + username + ":" + MASK;
    }

    /**
     * Masks the password segment of a raw connection string without validating it.
     */
    public static String masked(String raw) {
        if (raw == null) {
            return null;
        }
        String[] parts = raw.split(":", -1);
        if (parts.length < 4) {
            return raw;
        }
        return parts[0] + ":" + parts[1] + ":" + parts[2] + ":" + MASK;
    }
}
