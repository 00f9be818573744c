package io.harvestmesh.storage;

import io.harvestmesh.model.ProxyEndpoint;
import io.harvestmesh.model.ProxyLease;
import io.harvestmesh.model.ProxyStatus;
import io.harvestmesh.model.ProxyView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Least-used-first proxy rotation over the {@code proxies} relation.
 *
 * <p>{@code blocked} is terminal: the block count only grows and a blocked row is never
 * eligible for {@link #claim(String, long)} again.
 */
public final class ProxyPool {
    private static final String COLUMNS =
            "id,proxy,status,locked_by,locked_at_ms,uses_count,blocks_count,last_used_at_ms";

    private final Database database;
    private final int blockThreshold;
    private final LeaseManager<ProxyLease> leases;

    public ProxyPool(Database database, int blockThreshold) {
        if (blockThreshold < 1) {
            throw new IllegalArgumentException("blockThreshold must be >= 1");
        }
        this.database = database;
        this.blockThreshold = blockThreshold;
        this.leases = new LeaseManager<>(database, new LeaseManager.LeaseSpec<>(
                "proxy",
                "proxies",
                "status='" + ProxyStatus.AVAILABLE.value() + "'",
                "uses_count ASC, id ASC",
                "status='" + ProxyStatus.LOCKED.value() + "',locked_by=?,locked_at_ms=?,"
                        + "uses_count=uses_count+1,last_used_at_ms=?",
                (ps, holder, nowMs) -> {
                    ps.setString(1, holder);
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    return 4;
                },
                "id,proxy,locked_by,locked_at_ms,uses_count,blocks_count",
                rs -> new ProxyLease(
                        rs.getLong("id"),
                        rs.getString("proxy"),
                        rs.getString("locked_by"),
                        rs.getLong("locked_at_ms"),
                        rs.getInt("uses_count"),
                        rs.getInt("blocks_count")
                )
        ));
    }

    public int blockThreshold() {
        return blockThreshold;
    }

    public Optional<ProxyLease> claim(String workerId, long nowMs) {
        return leases.claim(workerId, nowMs);
    }

    /**
     * @return false when the caller no longer holds the proxy
     */
    public boolean release(long proxyId, String workerId, long nowMs) {
        String sql = "UPDATE proxies SET status=?,locked_by=NULL,locked_at_ms=NULL,last_used_at_ms=? "
                + "WHERE id=? AND status=? AND locked_by=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ProxyStatus.AVAILABLE.value());
            ps.setLong(2, nowMs);
            ps.setLong(3, proxyId);
            ps.setString(4, ProxyStatus.LOCKED.value());
            ps.setString(5, workerId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release proxy", e);
        }
    }

    /**
     * Counts one block against the proxy. Once the count reaches the threshold the proxy is
     * blocked and its holder cleared; below it, the proxy goes back to {@code available} when
     * the caller was the holder and is otherwise left as it is.
     */
    public BlockOutcome markBlocked(long proxyId, String workerId, long nowMs) {
        String update = "UPDATE proxies SET blocks_count=blocks_count+1,"
                + "status=CASE WHEN blocks_count+1>=? THEN ? WHEN ? THEN ? ELSE status END,"
                + "locked_by=CASE WHEN blocks_count+1>=? OR ? THEN NULL ELSE locked_by END,"
                + "locked_at_ms=CASE WHEN blocks_count+1>=? OR ? THEN NULL ELSE locked_at_ms END,"
                + "last_used_at_ms=CASE WHEN ? THEN ? ELSE last_used_at_ms END "
                + "WHERE id=? AND status<>?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update)) {
                Optional<ProxyView> before = readProxy(c, proxyId);
                if (before.isEmpty() || ProxyStatus.BLOCKED.value().equals(before.get().status())) {
                    c.commit();
                    return BlockOutcome.notApplied(proxyId);
                }
                boolean held = ProxyStatus.LOCKED.value().equals(before.get().status())
                        && Objects.equals(workerId, before.get().lockedBy());
                ps.setInt(1, blockThreshold);
                ps.setString(2, ProxyStatus.BLOCKED.value());
                ps.setBoolean(3, held);
                ps.setString(4, ProxyStatus.AVAILABLE.value());
                ps.setInt(5, blockThreshold);
                ps.setBoolean(6, held);
                ps.setInt(7, blockThreshold);
                ps.setBoolean(8, held);
                ps.setBoolean(9, held);
                ps.setLong(10, nowMs);
                ps.setLong(11, proxyId);
                ps.setString(12, ProxyStatus.BLOCKED.value());
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return BlockOutcome.notApplied(proxyId);
                }
                ProxyView after = readProxy(c, proxyId)
                        .orElseThrow(() -> new IllegalStateException("proxy vanished: " + proxyId));
                c.commit();
                return new BlockOutcome(proxyId, true, held, ProxyStatus.fromValue(after.status()), after.blocksCount());
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to mark proxy blocked", e);
        }
    }

    /**
     * Refreshes the lock time of every proxy held by a live worker.
     */
    public int touchHeldBy(String workerId, long nowMs) {
        String sql = "UPDATE proxies SET locked_at_ms=? WHERE status=? AND locked_by=? AND locked_at_ms<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, ProxyStatus.LOCKED.value());
            ps.setString(3, workerId);
            ps.setLong(4, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to refresh held proxies", e);
        }
    }

    /**
     * @return true when a new row was inserted, false for a duplicate connection string
     */
    public boolean add(String connection, long nowMs) {
        return addAll(List.of(connection), nowMs) == 1;
    }

    public int addAll(Collection<String> connections, long nowMs) {
        if (connections == null || connections.isEmpty()) {
            return 0;
        }
        List<String> normalized = connections.stream()
                .map(raw -> ProxyEndpoint.parse(raw).connection())
                .toList();
        String sql = "INSERT OR IGNORE INTO proxies(proxy,status,uses_count,blocks_count,created_at_ms) VALUES(?,?,0,0,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int inserted = 0;
                for (String connection : normalized) {
                    ps.setString(1, connection);
                    ps.setString(2, ProxyStatus.AVAILABLE.value());
                    ps.setLong(3, nowMs);
                    inserted += ps.executeUpdate();
                }
                c.commit();
                return inserted;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to add proxies", e);
        }
    }

    /**
     * Returns proxies locked at or before {@code cutoffMs} to the pool. Only silent holders hit
     * this: live workers keep their lock time fresh through {@link #touchHeldBy(String, long)}.
     */
    public int reclaimStale(long cutoffMs) {
        String sql = "UPDATE proxies SET status=?,locked_by=NULL,locked_at_ms=NULL WHERE status=? AND locked_at_ms<=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ProxyStatus.AVAILABLE.value());
            ps.setString(2, ProxyStatus.LOCKED.value());
            ps.setLong(3, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed stale proxy reclaim", e);
        }
    }

    public Optional<ProxyView> get(long proxyId) {
        try (Connection c = database.openConnection()) {
            return readProxy(c, proxyId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load proxy", e);
        }
    }

    public Optional<ProxyView> findByConnection(String connection) {
        String sql = "SELECT " + COLUMNS + " FROM proxies WHERE proxy=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ProxyEndpoint.parse(connection).connection());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProxy(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load proxy", e);
        }
    }

    private Optional<ProxyView> readProxy(Connection c, long proxyId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM proxies WHERE id=?")) {
            ps.setLong(1, proxyId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProxy(rs)) : Optional.empty();
            }
        }
    }

    private static ProxyView mapProxy(ResultSet rs) throws SQLException {
        long locked = rs.getLong("locked_at_ms");
        Long lockedAt = rs.wasNull() ? null : locked;
        long lastUsed = rs.getLong("last_used_at_ms");
        Long lastUsedAt = rs.wasNull() ? null : lastUsed;
        return new ProxyView(
                rs.getLong("id"),
                rs.getString("proxy"),
                rs.getString("status"),
                rs.getString("locked_by"),
                lockedAt,
                rs.getInt("uses_count"),
                rs.getInt("blocks_count"),
                lastUsedAt
        );
    }

    /**
     * @param heldByCaller whether the caller held the proxy when the block was counted
     */
    public record BlockOutcome(long proxyId, boolean applied, boolean heldByCaller, ProxyStatus status, int blocksCount) {
        public static BlockOutcome notApplied(long proxyId) {
            return new BlockOutcome(proxyId, false, false, null, 0);
        }

        public boolean blocked() {
            return applied && status == ProxyStatus.BLOCKED;
        }
    }
}
