package com.customer.identity.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Checkpoint of an incremental sync for one source key.
 *
 * @param sourceType    source key, e.g. {@code marketplace_order}
 * @param cursorValue   opaque, source-specific position; {@code null} before the first batch
 * @param lastSuccessAt completion time of the last batch without record errors
 * @param lastError     error of the most recent batch, {@code null} when it was clean
 * @param itemsSynced   records synced since the cursor was created
 * @param updatedAt     time of the last write
 */
public record SyncCursor(
        String sourceType,
        JsonNode cursorValue,
        Instant lastSuccessAt,
        String lastError,
        long itemsSynced,
        Instant updatedAt
) {

    public boolean hasError() {
        return lastError != null;
    }
}
