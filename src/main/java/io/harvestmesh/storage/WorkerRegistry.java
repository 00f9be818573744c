package io.harvestmesh.storage;

import io.harvestmesh.model.WorkerStatus;
import io.harvestmesh.model.WorkerView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public final class WorkerRegistry {
    private static final String COLUMNS =
            "worker_id,status,tasks_processed,tasks_failed,started_at_ms,last_heartbeat_ms";

    private final Database database;

    public WorkerRegistry(Database database) {
        this.database = database;
    }

    /**
     * Inserts an active worker row, or refreshes the heartbeat of an existing one.
     */
    public HeartbeatOutcome register(String workerId, long nowMs) {
        requireWorkerId(workerId);
        return heartbeat(workerId, nowMs);
    }

    /**
     * Moves the heartbeat forward and marks the worker active. A heartbeat older than the stored
     * one is ignored, so the stored value never goes backwards.
     */
    public HeartbeatOutcome heartbeat(String workerId, long nowMs) {
        requireWorkerId(workerId);
        String select = "SELECT status,last_heartbeat_ms FROM workers WHERE worker_id=?";
        String insert = "INSERT INTO workers(worker_id,status,tasks_processed,tasks_failed,started_at_ms,last_heartbeat_ms) "
                + "VALUES(?,?,0,0,?,?)";
        String update = "UPDATE workers SET status=?,last_heartbeat_ms=? WHERE worker_id=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSel = c.prepareStatement(select);
                 PreparedStatement psIns = c.prepareStatement(insert);
                 PreparedStatement psUp = c.prepareStatement(update)) {
                psSel.setString(1, workerId);
                try (ResultSet rs = psSel.executeQuery()) {
                    if (!rs.next()) {
                        psIns.setString(1, workerId);
                        psIns.setString(2, WorkerStatus.ACTIVE.value());
                        psIns.setLong(3, nowMs);
                        psIns.setLong(4, nowMs);
                        psIns.executeUpdate();
                        c.commit();
                        return new HeartbeatOutcome(true, true, null, WorkerStatus.ACTIVE);
                    }
                    WorkerStatus previous = WorkerStatus.fromValue(rs.getString("status"));
                    long lastHeartbeat = rs.getLong("last_heartbeat_ms");
                    if (nowMs < lastHeartbeat) {
                        c.commit();
                        return new HeartbeatOutcome(false, false, previous, previous);
                    }
                    psUp.setString(1, WorkerStatus.ACTIVE.value());
                    psUp.setLong(2, nowMs);
                    psUp.setString(3, workerId);
                    psUp.executeUpdate();
                    c.commit();
                    return new HeartbeatOutcome(true, false, previous, WorkerStatus.ACTIVE);
                }
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed worker heartbeat: " + workerId, e);
        }
    }

    public boolean recordOutcome(String workerId, boolean success) {
        String sql = success
                ? "UPDATE workers SET tasks_processed=tasks_processed+1 WHERE worker_id=?"
                : "UPDATE workers SET tasks_failed=tasks_failed+1 WHERE worker_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workerId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record worker outcome: " + workerId, e);
        }
    }

    /**
     * Graceful exit of one worker.
     */
    public boolean markStopped(String workerId) {
        String sql = "UPDATE workers SET status=? WHERE worker_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, WorkerStatus.STOPPED.value());
            ps.setString(2, workerId);
            ps.setString(3, WorkerStatus.ACTIVE.value());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to stop worker: " + workerId, e);
        }
    }

    /**
     * Marks active workers whose last heartbeat is at or before {@code cutoffMs} as stopped.
     * Their tasks and proxies are reclaimed by the time-based sweeps, not here.
     */
    public int markDead(long cutoffMs) {
        String sql = "UPDATE workers SET status=? WHERE status=? AND last_heartbeat_ms<=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, WorkerStatus.STOPPED.value());
            ps.setString(2, WorkerStatus.ACTIVE.value());
            ps.setLong(3, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed dead worker sweep", e);
        }
    }

    public Optional<WorkerView> get(String workerId) {
        String sql = "SELECT " + COLUMNS + " FROM workers WHERE worker_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new WorkerView(
                        rs.getString("worker_id"),
                        rs.getString("status"),
                        rs.getInt("tasks_processed"),
                        rs.getInt("tasks_failed"),
                        rs.getLong("started_at_ms"),
                        rs.getLong("last_heartbeat_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load worker: " + workerId, e);
        }
    }

    private static void requireWorkerId(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
    }

    /**
     * @param previousStatus null when the row was created by this call
     */
    public record HeartbeatOutcome(boolean updated, boolean created, WorkerStatus previousStatus, WorkerStatus currentStatus) {
    }
}
