package io.harvestmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Claims one row out of an ordered, filtered candidate set and marks it owned by the caller,
 * all inside a single {@code BEGIN IMMEDIATE} transaction.
 *
 * <p>The candidate scan and the conditional update share the eligibility predicate, so a row
 * that stopped being eligible is skipped rather than overwritten. Each committed claim targets
 * exactly one row and no two committed claims target the same row.
 *
 * @param <T> lease view returned to the caller
 */
public final class LeaseManager<T> {
    static final int CANDIDATE_WINDOW = 8;

    private final Database database;
    private final LeaseSpec<T> spec;
    private final String selectCandidates;
    private final String claimUpdate;
    private final String selectClaimed;

    public LeaseManager(Database database, LeaseSpec<T> spec) {
        this.database = database;
        this.spec = spec;
        this.selectCandidates = "SELECT id FROM " + spec.table()
                + " WHERE " + spec.eligibility()
                + " ORDER BY " + spec.ordering()
                + " LIMIT ?";
        this.claimUpdate = "UPDATE " + spec.table()
                + " SET " + spec.claimAssignments()
                + " WHERE id=? AND " + spec.eligibility();
        this.selectClaimed = "SELECT " + spec.columns() + " FROM " + spec.table() + " WHERE id=?";
    }

    public String name() {
        return spec.name();
    }

    /**
     * @return the leased row, or empty when no eligible row exists
     */
    public Optional<T> claim(String holder, long nowMs) {
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("lease holder must not be blank");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement candidates = c.prepareStatement(selectCandidates);
                 PreparedStatement update = c.prepareStatement(claimUpdate);
                 PreparedStatement read = c.prepareStatement(selectClaimed)) {
                candidates.setInt(1, CANDIDATE_WINDOW);
                List<Long> ids = new ArrayList<>(CANDIDATE_WINDOW);
                try (ResultSet rs = candidates.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getLong(1));
                    }
                }
                for (long id : ids) {
                    int next = spec.binder().bind(update, holder, nowMs);
                    update.setLong(next, id);
                    if (update.executeUpdate() != 1) {
                        continue;
                    }
                    read.setLong(1, id);
                    T leased;
                    try (ResultSet rs = read.executeQuery()) {
                        if (!rs.next()) {
                            throw new IllegalStateException(spec.name() + " row vanished during claim: " + id);
                        }
                        leased = spec.mapper().map(rs);
                    }
                    c.commit();
                    return Optional.of(leased);
                }
                c.commit();
                return Optional.empty();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to claim " + spec.name(), e);
        }
    }

    @FunctionalInterface
    public interface ClaimBinder {
        /**
         * Binds the placeholders of {@link LeaseSpec#claimAssignments()} starting at index 1.
         *
         * @return the next free parameter index
         */
        int bind(PreparedStatement ps, String holder, long nowMs) throws SQLException;
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * SQL fragments describing one leasable relation. The relation must have an {@code id}
     * primary key.
     */
    public record LeaseSpec<T>(
            String name,
            String table,
            String eligibility,
            String ordering,
            String claimAssignments,
            ClaimBinder binder,
            String columns,
            RowMapper<T> mapper
    ) {
    }
}
