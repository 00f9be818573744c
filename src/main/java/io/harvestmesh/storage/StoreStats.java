package io.harvestmesh.storage;

import io.harvestmesh.model.ProxyStatus;
import io.harvestmesh.model.TaskStatus;
import io.harvestmesh.model.WorkerStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only counters for the {@code status} command.
 */
public final class StoreStats {
    private final Database database;

    public StoreStats(Database database) {
        this.database = database;
    }

    public Snapshot load(long nowMs, long staleTaskMs, long staleProxyLockMs, long deadWorkerMs) {
        Map<String, Integer> tasks = zeroFilled(TaskStatus.values());
        tasks.putAll(groupCount("tasks"));
        Map<String, Integer> proxies = zeroFilled(ProxyStatus.values());
        proxies.putAll(groupCount("proxies"));
        Map<String, Integer> workers = zeroFilled(WorkerStatus.values());
        workers.putAll(groupCount("workers"));

        Health health = new Health(
                count("SELECT COUNT(1) FROM tasks WHERE status=? AND last_attempt_at_ms<=?",
                        TaskStatus.PROCESSING.value(), nowMs - staleTaskMs),
                count("SELECT COUNT(1) FROM proxies WHERE status=? AND locked_at_ms<=?",
                        ProxyStatus.LOCKED.value(), nowMs - staleProxyLockMs),
                count("SELECT COUNT(1) FROM workers WHERE status=? AND last_heartbeat_ms<=?",
                        WorkerStatus.ACTIVE.value(), nowMs - deadWorkerMs)
        );
        return new Snapshot(tasks, proxies, workers, count("SELECT COUNT(1) FROM results", null, 0L), health);
    }

    private static Map<String, Integer> zeroFilled(Enum<?>[] statuses) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Enum<?> s : statuses) {
            out.put(s.name().toLowerCase(Locale.ROOT), 0);
        }
        return out;
    }

    private Map<String, Integer> groupCount(String table) {
        String sql = "SELECT status, COUNT(1) AS c FROM " + table + " GROUP BY status";
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getInt(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to collect stats: " + table + ".status", e);
        }
    }

    private int count(String sql, String status, long cutoffMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (status != null) {
                ps.setString(1, status);
                ps.setLong(2, cutoffMs);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to collect health stats", e);
        }
    }

    public record Snapshot(
            Map<String, Integer> tasks,
            Map<String, Integer> proxies,
            Map<String, Integer> workers,
            int results,
            Health health
    ) {
    }

    /**
     * Resources past their staleness threshold that the reaper has not swept yet.
     */
    public record Health(int stuckTasks, int stuckProxies, int deadWorkers) {
        public boolean healthy() {
            return stuckTasks == 0 && stuckProxies == 0 && deadWorkers == 0;
        }
    }
}
