package io.harvestmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.harvestmesh.model.ProxyEndpoint;
import io.harvestmesh.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps credentials out of the event log. Values under secret-looking keys are replaced, proxy
 * connection strings lose their password segment, and long opaque tokens are replaced.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern PROXY_WITH_CREDENTIALS = Pattern.compile("^[^:\\s]+:\\d{1,5}:[^:\\s]*:[^\\s]*$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-.]{32,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            String masked = maskedText(text);
            return masked.equals(text) ? input : Jsons.mapper().getNodeFactory().textNode(masked);
        }
        return input;
    }

    public static String maskedText(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        if (PROXY_WITH_CREDENTIALS.matcher(v).matches()) {
            return ProxyEndpoint.masked(v);
        }
        if (likelySecretValue(v)) {
            return MASK;
        }
        return value;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String v) {
        if (!OPAQUE_TOKEN.matcher(v).matches()) {
            return false;
        }
        return v.chars().anyMatch(Character::isDigit) && v.chars().anyMatch(Character::isLetter);
    }
}
