package io.harvestmesh.storage;

import io.harvestmesh.config.HarvestMeshConfig;
import io.harvestmesh.model.ProxyLease;
import io.harvestmesh.model.ProxyStatus;
import io.harvestmesh.model.ProxyView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

final class ProxyPoolTest {

    @Test
    void claimsLeastUsedProxyFirst() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-proxy-order-");
        try {
            ProxyPool pool = new ProxyPool(initDatabase(root), 3);
            long now = Instant.now().toEpochMilli();
            Assertions.assertEquals(2, pool.addAll(List.of("p1.example:8000:u1:s1", "p2.example:8000:u2:s2"), now));

            ProxyLease first = pool.claim("w-a", now + 1L).orElseThrow();
            Assertions.assertEquals("p1.example:8000:u1:s1", first.proxy());
            Assertions.assertEquals(1, first.usesCount());
            Assertions.assertEquals("w-a", first.workerId());
            Assertions.assertTrue(pool.release(first.proxyId(), "w-a", now + 2L));

            ProxyLease second = pool.claim("w-a", now + 3L).orElseThrow();
            Assertions.assertEquals("p2.example:8000:u2:s2", second.proxy());

            ProxyView released = pool.get(first.proxyId()).orElseThrow();
            Assertions.assertEquals(ProxyStatus.AVAILABLE.value(), released.status());
            Assertions.assertNull(released.lockedBy());
            Assertions.assertNull(released.lockedAtMs());
            Assertions.assertEquals(now + 2L, released.lastUsedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proxyReachingThresholdIsNeverClaimedAgain() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-proxy-block-");
        try {
            ProxyPool pool = new ProxyPool(initDatabase(root), 3);
            long now = Instant.now().toEpochMilli();
            pool.add("blocked.example:3128:user:secret", now);
            pool.add("spare.example:3128:user:secret", now);
            long blockedId = pool.findByConnection("blocked.example:3128:user:secret").orElseThrow().proxyId();

            for (int i = 1; i <= 3; i++) {
                ProxyLease lease = pool.claim("w-a", now + i).orElseThrow();
                if (lease.proxyId() != blockedId) {
                    Assertions.assertTrue(pool.release(lease.proxyId(), "w-a", now + i));
                    lease = pool.claim("w-a", now + i).orElseThrow();
                }
                Assertions.assertEquals(blockedId, lease.proxyId());
                ProxyPool.BlockOutcome block = pool.markBlocked(lease.proxyId(), "w-a", now + i);
                Assertions.assertTrue(block.applied());
                Assertions.assertTrue(block.heldByCaller());
                Assertions.assertEquals(i, block.blocksCount());
                Assertions.assertEquals(i == 3 ? ProxyStatus.BLOCKED : ProxyStatus.AVAILABLE, block.status());
            }

            ProxyView blocked = pool.get(blockedId).orElseThrow();
            Assertions.assertEquals(ProxyStatus.BLOCKED.value(), blocked.status());
            Assertions.assertNull(blocked.lockedBy());

            for (int i = 0; i < 5; i++) {
                ProxyLease lease = pool.claim("w-b", now + 10L + i).orElseThrow();
                Assertions.assertNotEquals(blockedId, lease.proxyId());
                pool.release(lease.proxyId(), "w-b", now + 10L + i);
            }
            Assertions.assertFalse(pool.markBlocked(blockedId, "w-a", now + 20L).applied());
            Assertions.assertEquals(3, pool.get(blockedId).orElseThrow().blocksCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void blockFromNonHolderKeepsTheLease() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-proxy-foreign-block-");
        try {
            ProxyPool pool = new ProxyPool(initDatabase(root), 3);
            long now = Instant.now().toEpochMilli();
            pool.add("10.1.1.1:8080", now);
            ProxyLease lease = pool.claim("w-a", now + 1L).orElseThrow();

            ProxyPool.BlockOutcome block = pool.markBlocked(lease.proxyId(), "w-b", now + 2L);
            Assertions.assertTrue(block.applied());
            Assertions.assertFalse(block.heldByCaller());
            Assertions.assertEquals(ProxyStatus.LOCKED, block.status());
            Assertions.assertEquals("w-a", pool.get(lease.proxyId()).orElseThrow().lockedBy());

            Assertions.assertFalse(pool.release(lease.proxyId(), "w-b", now + 3L));
            Assertions.assertTrue(pool.release(lease.proxyId(), "w-a", now + 3L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLocksAreReclaimedUnlessHolderTouchesThem() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-proxy-stale-");
        try {
            ProxyPool pool = new ProxyPool(initDatabase(root), 3);
            long now = Instant.now().toEpochMilli();
            pool.add("live.example:8080", now);
            pool.add("silent.example:8080", now);
            ProxyLease live = pool.claim("w-live", now).orElseThrow();
            ProxyLease silent = pool.claim("w-silent", now).orElseThrow();

            Assertions.assertEquals(1, pool.touchHeldBy("w-live", now + 1_000L));
            Assertions.assertEquals(1, pool.reclaimStale(now + 500L));

            Assertions.assertEquals(ProxyStatus.LOCKED.value(), pool.get(live.proxyId()).orElseThrow().status());
            ProxyView reclaimed = pool.get(silent.proxyId()).orElseThrow();
            Assertions.assertEquals(ProxyStatus.AVAILABLE.value(), reclaimed.status());
            Assertions.assertNull(reclaimed.lockedBy());
            Assertions.assertFalse(pool.release(silent.proxyId(), "w-silent", now + 600L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void addValidatesAndDeduplicatesConnections() throws Exception {
        Path root = Files.createTempDirectory("harvestmesh-test-proxy-add-");
        try {
            ProxyPool pool = new ProxyPool(initDatabase(root), 3);
            long now = Instant.now().toEpochMilli();
            Assertions.assertTrue(pool.add("host.example:8080:user:pass", now));
            Assertions.assertFalse(pool.add(" host.example:8080:user:pass ", now));
            Assertions.assertThrows(IllegalArgumentException.class, () -> pool.add("host.example", now));
            Assertions.assertThrows(IllegalArgumentException.class, () -> pool.add("host.example:http:user:pass", now));
            Assertions.assertThrows(IllegalArgumentException.class, () -> new ProxyPool(initDatabase(root), 0));
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
