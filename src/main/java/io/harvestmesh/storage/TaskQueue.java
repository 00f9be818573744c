package io.harvestmesh.storage;

import io.harvestmesh.config.HarvestMeshConfig;
import io.harvestmesh.model.TaskLease;
import io.harvestmesh.model.TaskStatus;
import io.harvestmesh.model.TaskView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Oldest-first task queue over the {@code tasks} relation.
 *
 * <p>Claiming does not consume an attempt. Attempts are consumed by
 * {@link #recordAttemptFailure(long, String, long)} and by stale-lease reclamation, and a task
 * whose attempts reach its maximum becomes {@code failed} for good.
 */
public final class TaskQueue {
    private static final String COLUMNS =
            "id,item_id,status,worker_id,attempts,max_attempts,created_at_ms,last_attempt_at_ms,completed_at_ms";

    private final Database database;
    private final int defaultMaxAttempts;
    private final LeaseManager<TaskLease> leases;

    public TaskQueue(Database database) {
        this(database, HarvestMeshConfig.DEFAULT_MAX_TASK_ATTEMPTS);
    }

    /**
     * @param defaultMaxAttempts attempt budget of tasks enqueued without an explicit one
     */
    public TaskQueue(Database database, int defaultMaxAttempts) {
        if (defaultMaxAttempts < 1) {
            throw new IllegalArgumentException("defaultMaxAttempts must be >= 1");
        }
        this.database = database;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.leases = new LeaseManager<>(database, new LeaseManager.LeaseSpec<>(
                "task",
                "tasks",
                "status='" + TaskStatus.PENDING.value() + "'",
                "created_at_ms ASC, id ASC",
                "status='" + TaskStatus.PROCESSING.value() + "',worker_id=?,last_attempt_at_ms=?",
                (ps, holder, nowMs) -> {
                    ps.setString(1, holder);
                    ps.setLong(2, nowMs);
                    return 3;
                },
                "id,item_id,attempts,max_attempts,worker_id,last_attempt_at_ms",
                rs -> new TaskLease(
                        rs.getLong("id"),
                        rs.getLong("item_id"),
                        rs.getInt("attempts"),
                        rs.getInt("max_attempts"),
                        rs.getString("worker_id"),
                        rs.getLong("last_attempt_at_ms")
                )
        ));
    }

    public Optional<TaskLease> claim(String workerId, long nowMs) {
        return leases.claim(workerId, nowMs);
    }

    /**
     * Marks the task completed. Applies while the caller still owns it, or when the reaper
     * already handed it back to {@code pending} and nobody re-claimed it yet.
     *
     * @return false when another worker owns the task or it is already terminal
     */
    public boolean recordSuccess(long taskId, String workerId, long nowMs) {
        String sql = "UPDATE tasks SET status=?,worker_id=NULL,completed_at_ms=? "
                + "WHERE id=? AND ((status=? AND worker_id=?) OR status=?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.COMPLETED.value());
            ps.setLong(2, nowMs);
            ps.setLong(3, taskId);
            ps.setString(4, TaskStatus.PROCESSING.value());
            ps.setString(5, workerId);
            ps.setString(6, TaskStatus.PENDING.value());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record task success", e);
        }
    }

    /**
     * Consumes one attempt and hands the task back to the queue, or fails it once the attempts
     * reach the maximum. Fenced on ownership: a worker whose lease was reclaimed gets a
     * {@code staleLease} outcome and nothing changes.
     */
    public AttemptOutcome recordAttemptFailure(long taskId, String workerId, long nowMs) {
        String update = "UPDATE tasks SET attempts=attempts+1,worker_id=NULL,"
                + "status=CASE WHEN attempts+1>=max_attempts THEN ? ELSE ? END "
                + "WHERE id=? AND status=? AND worker_id=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setString(1, TaskStatus.FAILED.value());
                ps.setString(2, TaskStatus.PENDING.value());
                ps.setLong(3, taskId);
                ps.setString(4, TaskStatus.PROCESSING.value());
                ps.setString(5, workerId);
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return AttemptOutcome.staleLease(taskId);
                }
                TaskView after = readTask(c, taskId)
                        .orElseThrow(() -> new IllegalStateException("task vanished: " + taskId));
                c.commit();
                return new AttemptOutcome(taskId, true, TaskStatus.fromValue(after.status()), after.attempts(), after.maxAttempts());
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to record task attempt failure", e);
        }
    }

    /**
     * Returns a claimed task to the queue without consuming an attempt.
     */
    public boolean release(long taskId, String workerId) {
        String sql = "UPDATE tasks SET status=?,worker_id=NULL WHERE id=? AND status=? AND worker_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.PENDING.value());
            ps.setLong(2, taskId);
            ps.setString(3, TaskStatus.PROCESSING.value());
            ps.setString(4, workerId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release task", e);
        }
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public boolean enqueue(long itemId, long nowMs) {
        return enqueue(itemId, defaultMaxAttempts, nowMs);
    }

    public int enqueueAll(Collection<Long> itemIds, long nowMs) {
        return enqueueAll(itemIds, defaultMaxAttempts, nowMs);
    }

    /**
     * @return true when a new row was inserted, false when the item id is already queued
     */
    public boolean enqueue(long itemId, int maxAttempts, long nowMs) {
        return enqueueAll(List.of(itemId), maxAttempts, nowMs) == 1;
    }

    /**
     * Inserts pending tasks in one transaction, skipping item ids that already exist. Items of
     * one batch keep their iteration order in the queue.
     *
     * @return number of inserted rows
     */
    public int enqueueAll(Collection<Long> itemIds, int maxAttempts, long nowMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (itemIds == null || itemIds.isEmpty()) {
            return 0;
        }
        String sql = "INSERT OR IGNORE INTO tasks(item_id,status,worker_id,attempts,max_attempts,created_at_ms) "
                + "VALUES(?,?,NULL,0,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int inserted = 0;
                for (Long itemId : itemIds) {
                    if (itemId == null) {
                        throw new IllegalArgumentException("itemId must not be null");
                    }
                    ps.setLong(1, itemId);
                    ps.setString(2, TaskStatus.PENDING.value());
                    ps.setInt(3, maxAttempts);
                    ps.setLong(4, nowMs);
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
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to enqueue tasks", e);
        }
    }

    /**
     * Reclaims processing tasks whose last attempt started at or before {@code cutoffMs}. Each
     * reclaim consumes one attempt, so a task that keeps killing its worker still converges to
     * {@code failed}. Candidates are re-checked against the scanned lease, so a task that was
     * finished or re-claimed between scan and update is left alone.
     */
    public List<ReclaimedTask> reclaimStale(long cutoffMs, int limit) {
        String sel = "SELECT id,item_id,worker_id,last_attempt_at_ms FROM tasks "
                + "WHERE status=? AND last_attempt_at_ms<=? ORDER BY last_attempt_at_ms ASC LIMIT ?";
        List<ReclaimedTask> candidates = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sel)) {
            ps.setString(1, TaskStatus.PROCESSING.value());
            ps.setLong(2, cutoffMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(new ReclaimedTask(
                            rs.getLong("id"),
                            rs.getLong("item_id"),
                            rs.getString("worker_id"),
                            rs.getLong("last_attempt_at_ms"),
                            null,
                            0
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed stale task scan", e);
        }

        List<ReclaimedTask> reclaimed = new ArrayList<>();
        String update = "UPDATE tasks SET attempts=attempts+1,worker_id=NULL,"
                + "status=CASE WHEN attempts+1>=max_attempts THEN ? ELSE ? END "
                + "WHERE id=? AND status=? AND worker_id=? AND last_attempt_at_ms=?";
        for (ReclaimedTask cnd : candidates) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try (PreparedStatement ps = c.prepareStatement(update)) {
                    ps.setString(1, TaskStatus.FAILED.value());
                    ps.setString(2, TaskStatus.PENDING.value());
                    ps.setLong(3, cnd.taskId());
                    ps.setString(4, TaskStatus.PROCESSING.value());
                    ps.setString(5, cnd.previousWorkerId());
                    ps.setLong(6, cnd.lastAttemptAtMs());
                    if (ps.executeUpdate() == 0) {
                        c.commit();
                        continue;
                    }
                    TaskView after = readTask(c, cnd.taskId())
                            .orElseThrow(() -> new IllegalStateException("task vanished: " + cnd.taskId()));
                    c.commit();
                    reclaimed.add(new ReclaimedTask(
                            cnd.taskId(),
                            cnd.itemId(),
                            cnd.previousWorkerId(),
                            cnd.lastAttemptAtMs(),
                            TaskStatus.fromValue(after.status()),
                            after.attempts()
                    ));
                } catch (Exception e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (Exception e) {
                throw new RuntimeException("Failed stale task reclaim", e);
            }
        }
        return reclaimed;
    }

    /**
     * Fails pending tasks that already used up their attempts.
     */
    public int failExhausted() {
        String sql = "UPDATE tasks SET status=? WHERE status=? AND attempts>=max_attempts";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.FAILED.value());
            ps.setString(2, TaskStatus.PENDING.value());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed exhausted task sweep", e);
        }
    }

    public Optional<TaskView> get(long taskId) {
        try (Connection c = database.openConnection()) {
            return readTask(c, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task", e);
        }
    }

    public Optional<TaskView> findByItemId(long itemId) {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE item_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task", e);
        }
    }

    private Optional<TaskView> readTask(Connection c, long taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE id=?")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        }
    }

    private static TaskView mapTask(ResultSet rs) throws SQLException {
        long lastAttempt = rs.getLong("last_attempt_at_ms");
        Long lastAttemptAt = rs.wasNull() ? null : lastAttempt;
        long completed = rs.getLong("completed_at_ms");
        Long completedAt = rs.wasNull() ? null : completed;
        return new TaskView(
                rs.getLong("id"),
                rs.getLong("item_id"),
                rs.getString("status"),
                rs.getString("worker_id"),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                rs.getLong("created_at_ms"),
                lastAttemptAt,
                completedAt
        );
    }

    public record AttemptOutcome(long taskId, boolean applied, TaskStatus status, int attempts, int maxAttempts) {
        public static AttemptOutcome staleLease(long taskId) {
            return new AttemptOutcome(taskId, false, null, 0, 0);
        }

        public boolean failed() {
            return applied && status == TaskStatus.FAILED;
        }
    }

    /**
     * @param status state after reclamation, null for scan candidates
     */
    public record ReclaimedTask(
            long taskId,
            long itemId,
            String previousWorkerId,
            long lastAttemptAtMs,
            TaskStatus status,
            int attempts
    ) {
    }
}
