package com.customer.identity.store.jdbc;

import com.customer.identity.store.StoreException;
import com.customer.identity.sync.SyncCursor;
import com.customer.identity.sync.SyncCursorRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of {@link SyncCursorRepository}, keyed on {@code sync_cursors.source_type}.
 */
public class JdbcSyncCursorRepository implements SyncCursorRepository {

    private static final String COLUMNS = """
            source_type, cursor_value::text AS cursor_value, last_success_at, last_error, items_synced, updated_at""";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper mapper;

    public JdbcSyncCursorRepository(JdbcTemplate jdbcTemplate, ObjectMapper mapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mapper = mapper;
    }

    @Override
    public Optional<SyncCursor> find(String sourceType) {
        List<SyncCursor> rows = DataAccessGuard.call("findSyncCursor", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sync_cursors WHERE source_type = ?",
                ps -> ps.setString(1, sourceType),
                (rs, rowNum) -> cursor(rs)));
        return rows.stream().findFirst();
    }

    @Override
    public List<SyncCursor> findAll() {
        return DataAccessGuard.call("findAllSyncCursors", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sync_cursors ORDER BY source_type",
                (rs, rowNum) -> cursor(rs)));
    }

    @Override
    public void upsert(String sourceType, JsonNode cursorValue, long itemsSyncedDelta, String error, Instant now) {
        String sql = """
                INSERT INTO sync_cursors (source_type, cursor_value, last_success_at, last_error, items_synced, updated_at)
                VALUES (?, ?::jsonb, ?, ?, ?, ?)
                ON CONFLICT (source_type) DO UPDATE SET
                    cursor_value = EXCLUDED.cursor_value,
                    last_success_at = CASE WHEN EXCLUDED.last_error IS NULL
                                           THEN EXCLUDED.last_success_at
                                           ELSE sync_cursors.last_success_at END,
                    last_error = EXCLUDED.last_error,
                    items_synced = sync_cursors.items_synced + EXCLUDED.items_synced,
                    updated_at = EXCLUDED.updated_at
                """;
        Timestamp timestamp = Timestamp.from(now);
        DataAccessGuard.run("upsertSyncCursor", () -> jdbcTemplate.update(sql, ps -> {
            ps.setString(1, sourceType);
            ps.setString(2, cursorValue != null ? cursorValue.toString() : null);
            ps.setTimestamp(3, error == null ? timestamp : null);
            ps.setString(4, error);
            ps.setLong(5, itemsSyncedDelta);
            ps.setTimestamp(6, timestamp);
        }));
    }

    @Override
    public void recordError(String sourceType, String error, Instant now) {
        String sql = """
                INSERT INTO sync_cursors (source_type, last_error, items_synced, updated_at)
                VALUES (?, ?, 0, ?)
                ON CONFLICT (source_type) DO UPDATE SET
                    last_error = EXCLUDED.last_error,
                    updated_at = EXCLUDED.updated_at
                """;
        DataAccessGuard.run("recordSyncCursorError", () -> jdbcTemplate.update(sql, ps -> {
            ps.setString(1, sourceType);
            ps.setString(2, error);
            ps.setTimestamp(3, Timestamp.from(now));
        }));
    }

    private SyncCursor cursor(ResultSet rs) throws SQLException {
        String json = rs.getString("cursor_value");
        JsonNode value;
        try {
            value = json != null ? mapper.readTree(json) : null;
        } catch (JsonProcessingException e) {
            throw new StoreException("Unreadable cursor value for " + rs.getString("source_type"), e);
        }
        return new SyncCursor(
                rs.getString("source_type"),
                value,
                CustomerRows.instant(rs, "last_success_at"),
                rs.getString("last_error"),
                rs.getLong("items_synced"),
                CustomerRows.instant(rs, "updated_at"));
    }
}
