package io.harvestmesh.storage;

import io.harvestmesh.config.HarvestMeshConfig;
import io.harvestmesh.model.ListingRecord;
import io.harvestmesh.model.ResultRow;
import io.harvestmesh.model.ResultStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ResultStoreTest {

    @Test
    void secondUpsertOverwritesSingleRow() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-results-upsert-");
        try {
            ResultStore results = new ResultStore(initDatabase(root));
            long now = Instant.now().toEpochMilli();
            Map<String, String> characteristics = new LinkedHashMap<>();
            characteristics.put("Rooms", "2");
            characteristics.put("Floor", "5/9");
            ListingRecord first = new ListingRecord("Flat", "Sunny", characteristics, new BigDecimal("125000.50"),
                    "2025-10-01", "Anna", "https://example.org/u/1", "Main st 1", "Central", "North", 17);

            ResultStore.UpsertOutcome inserted = results.upsert(42L, first, ResultStatus.SUCCESS, null, "w-a", 0, now);
            Assertions.assertTrue(inserted.inserted());

            ListingRecord second = new ListingRecord("Flat, renovated", null, Map.of("Rooms", "3"), null,
                    null, null, null, null, null, null, null);
            ResultStore.UpsertOutcome updated = results.upsert(42L, second, ResultStatus.SUCCESS, null, "w-b", 1, now + 1_000L);
            Assertions.assertFalse(updated.inserted());
            Assertions.assertEquals(1, results.count());

            ResultRow row = results.find(42L).orElseThrow();
            Assertions.assertEquals("Flat, renovated", row.record().title());
            Assertions.assertNull(row.record().description());
            Assertions.assertNull(row.record().price());
            Assertions.assertEquals(Map.of("Rooms", "3"), row.record().characteristics());
            Assertions.assertEquals("w-b", row.workerId());
            Assertions.assertEquals(1, row.attempts());
            Assertions.assertEquals(now, row.createdAtMs());
            Assertions.assertEquals(now + 1_000L, row.updatedAtMs());
            Assertions.assertEquals(now + 1_000L, row.processedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storesAllListingFields() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-results-fields-");
        try {
            ResultStore results = new ResultStore(initDatabase(root));
            long now = Instant.now().toEpochMilli();
            Map<String, String> characteristics = new LinkedHashMap<>();
            characteristics.put("Area", "54 m2");
            characteristics.put("Balcony", "yes");
            ListingRecord record = new ListingRecord("House", "Garden", characteristics, new BigDecimal("99.90"),
                    "2025-09-30T10:00", "Boris", "https://example.org/u/2", "Oak st 4", "Riverside", "South", 1_204);
            results.upsert(7L, record, ResultStatus.SUCCESS, null, "w-a", 2, now);

            ResultRow row = results.find(7L).orElseThrow();
            Assertions.assertEquals(record, row.record());
            Assertions.assertEquals(List.of("Area", "Balcony"), List.copyOf(row.record().characteristics().keySet()));
            Assertions.assertEquals(ResultStatus.SUCCESS, row.status());
            Assertions.assertNull(row.failureReason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unavailableResultHasEmptyRecord() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-results-unavailable-");
        try {
            ResultStore results = new ResultStore(initDatabase(root));
            long now = Instant.now().toEpochMilli();
            results.upsert(9L, null, ResultStatus.UNAVAILABLE, null, "w-a", 0, now);

            ResultRow row = results.find(9L).orElseThrow();
            Assertions.assertEquals(ResultStatus.UNAVAILABLE, row.status());
            Assertions.assertEquals(ListingRecord.empty(), row.record());
            Assertions.assertTrue(results.find(10L).isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> results.upsert(11L, null, null, null, "w-a", 0, now));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database initDatabase(Path root) {
        Database db = new Database(HarvestMeshConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
