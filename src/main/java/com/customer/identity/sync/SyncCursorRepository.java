package com.customer.identity.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage of sync cursors, one row per source key.
 */
public interface SyncCursorRepository {

    Optional<SyncCursor> find(String sourceType);

    List<SyncCursor> findAll();

    /**
     * Upserts the cursor. {@code itemsSyncedDelta} is added to the stored count. The cursor value
     * always moves to {@code cursorValue}. With {@code error == null} the success timestamp moves
     * to {@code now} and any previous error is cleared; otherwise the error is stored and the
     * success timestamp is kept.
     */
    void upsert(String sourceType, JsonNode cursorValue, long itemsSyncedDelta, String error, Instant now);

    /**
     * Stores {@code error} on the cursor row without touching anything else, creating the row
     * when needed.
     */
    void recordError(String sourceType, String error, Instant now);
}
