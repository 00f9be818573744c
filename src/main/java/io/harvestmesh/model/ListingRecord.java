package io.harvestmesh.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured fields extracted from one item page. Every field may be null.
 */
public record ListingRecord(
        String title,
        String description,
        Map<String, String> characteristics,
        BigDecimal price,
        String publishedAt,
        String sellerName,
        String sellerProfileUrl,
        String locationAddress,
        String locationMetro,
        String locationRegion,
        Integer viewsTotal
) {
    public ListingRecord {
        characteristics = characteristics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(characteristics));
    }

    public static ListingRecord empty() {
        return new ListingRecord(null, null, Map.of(), null, null, null, null, null, null, null, null);
    }
}
