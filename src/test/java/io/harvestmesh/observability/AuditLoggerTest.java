package io.harvestmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.harvestmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void appendsOneMaskedJsonObjectPerLine() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-audit-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("events.log"));
            audit.log(AuditLogger.AuditEvent.of("proxy.claim", "w-a", "proxy:1", "ok",
                    Map.of("proxy", "p.example:8000:user:secret", "uses_count", 2)));
            audit.log(AuditLogger.AuditEvent.forTask("task.retry", "w-a", "pending", 5L, 42L,
                    Map.of("classification", "extraction_failed")));

            List<String> lines = Files.readAllLines(audit.file(), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());

            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            Assertions.assertEquals("proxy.claim", first.path("action").asText());
            Assertions.assertEquals("p.example:8000:user:***", first.path("details").path("proxy").asText());
            Assertions.assertEquals(2, first.path("details").path("uses_count").asInt());
            Assertions.assertFalse(lines.get(0).contains("secret"));
            Assertions.assertTrue(first.path("task_id").isNull());

            JsonNode second = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("task:5", second.path("resource").asText());
            Assertions.assertEquals(5L, second.path("task_id").asLong());
            Assertions.assertEquals(42L, second.path("item_id").asLong());
            Assertions.assertFalse(second.path("timestamp").asText().isBlank());
        } finally {
            deleteRecursively(root);
        }
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
