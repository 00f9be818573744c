package io.harvestmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.harvestmesh.model.ListingRecord;
import io.harvestmesh.model.ResultRow;
import io.harvestmesh.model.ResultStatus;
import io.harvestmesh.util.Jsons;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Terminal outcomes keyed by item id. Writing the same item twice overwrites the fields and
 * moves {@code updated_at_ms} forward, leaving exactly one row.
 */
public final class ResultStore {
    private static final TypeReference<LinkedHashMap<String, String>> CHARACTERISTICS = new TypeReference<>() {
    };

    private final Database database;

    public ResultStore(Database database) {
        this.database = database;
    }

    public UpsertOutcome upsert(long itemId, ListingRecord record, ResultStatus status, String failureReason,
                                String workerId, int attempts, long nowMs) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        ListingRecord r = record == null ? ListingRecord.empty() : record;
        String exists = "SELECT 1 FROM results WHERE item_id=?";
        String upsert = """
                INSERT INTO results(
                    item_id,title,description,characteristics,price,published_at,seller_name,seller_profile_url,
                    location_address,location_metro,location_region,views_total,status,failure_reason,worker_id,
                    attempts,processed_at_ms,created_at_ms,updated_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(item_id) DO UPDATE SET
                    title=excluded.title,
                    description=excluded.description,
                    characteristics=excluded.characteristics,
                    price=excluded.price,
                    published_at=excluded.published_at,
                    seller_name=excluded.seller_name,
                    seller_profile_url=excluded.seller_profile_url,
                    location_address=excluded.location_address,
                    location_metro=excluded.location_metro,
                    location_region=excluded.location_region,
                    views_total=excluded.views_total,
                    status=excluded.status,
                    failure_reason=excluded.failure_reason,
                    worker_id=excluded.worker_id,
                    attempts=excluded.attempts,
                    processed_at_ms=excluded.processed_at_ms,
                    updated_at_ms=MAX(results.updated_at_ms, excluded.updated_at_ms)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psExists = c.prepareStatement(exists);
                 PreparedStatement ps = c.prepareStatement(upsert)) {
                psExists.setLong(1, itemId);
                boolean existed;
                try (ResultSet rs = psExists.executeQuery()) {
                    existed = rs.next();
                }
                ps.setLong(1, itemId);
                ps.setString(2, r.title());
                ps.setString(3, r.description());
                ps.setString(4, Jsons.toCompactJson(r.characteristics()));
                ps.setString(5, r.price() == null ? null : r.price().toPlainString());
                ps.setString(6, r.publishedAt());
                ps.setString(7, r.sellerName());
                ps.setString(8, r.sellerProfileUrl());
                ps.setString(9, r.locationAddress());
                ps.setString(10, r.locationMetro());
                ps.setString(11, r.locationRegion());
                if (r.viewsTotal() == null) {
                    ps.setNull(12, Types.INTEGER);
                } else {
                    ps.setInt(12, r.viewsTotal());
                }
                ps.setString(13, status.value());
                ps.setString(14, failureReason);
                ps.setString(15, workerId);
                ps.setInt(16, attempts);
                ps.setLong(17, nowMs);
                ps.setLong(18, nowMs);
                ps.setLong(19, nowMs);
                ps.executeUpdate();
                c.commit();
                return new UpsertOutcome(itemId, !existed);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to upsert result: " + itemId, e);
        }
    }

    public Optional<ResultRow> find(long itemId) {
        String sql = """
                SELECT item_id,title,description,characteristics,price,published_at,seller_name,seller_profile_url,
                       location_address,location_metro,location_region,views_total,status,failure_reason,worker_id,
                       attempts,processed_at_ms,created_at_ms,updated_at_ms
                FROM results WHERE item_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                int views = rs.getInt("views_total");
                Integer viewsTotal = rs.wasNull() ? null : views;
                String price = rs.getString("price");
                ListingRecord record = new ListingRecord(
                        rs.getString("title"),
                        rs.getString("description"),
                        readCharacteristics(rs.getString("characteristics")),
                        price == null ? null : new BigDecimal(price),
                        rs.getString("published_at"),
                        rs.getString("seller_name"),
                        rs.getString("seller_profile_url"),
                        rs.getString("location_address"),
                        rs.getString("location_metro"),
                        rs.getString("location_region"),
                        viewsTotal
                );
                return Optional.of(new ResultRow(
                        rs.getLong("item_id"),
                        record,
                        ResultStatus.fromValue(rs.getString("status")),
                        rs.getString("failure_reason"),
                        rs.getString("worker_id"),
                        rs.getInt("attempts"),
                        rs.getLong("processed_at_ms"),
                        rs.getLong("created_at_ms"),
                        rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load result: " + itemId, e);
        }
    }

    public int count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM results");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count results", e);
        }
    }

    private static Map<String, String> readCharacteristics(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(json, CHARACTERISTICS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid characteristics JSON in results table", e);
        }
    }

    public record UpsertOutcome(long itemId, boolean inserted) {
    }
}
