package com.customer.identity.store.memory;

import com.customer.identity.sync.SyncCursor;
import com.customer.identity.sync.SyncCursorRepository;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SyncCursorRepository}.
 * Upserts are atomic per source key through {@link ConcurrentHashMap#compute}.
 */
public class InMemorySyncCursorRepository implements SyncCursorRepository {

    private final Map<String, SyncCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncCursor> find(String sourceType) {
        return Optional.ofNullable(cursors.get(sourceType));
    }

    @Override
    public List<SyncCursor> findAll() {
        return cursors.values().stream()
                .sorted((a, b) -> a.sourceType().compareTo(b.sourceType()))
                .toList();
    }

    @Override
    public void upsert(String sourceType, JsonNode cursorValue, long itemsSyncedDelta, String error, Instant now) {
        cursors.compute(sourceType, (key, current) -> {
            long items = (current != null ? current.itemsSynced() : 0L) + itemsSyncedDelta;
            Instant lastSuccess = error == null ? now : (current != null ? current.lastSuccessAt() : null);
            JsonNode value = cursorValue != null ? cursorValue.deepCopy() : null;
            return new SyncCursor(key, value, lastSuccess, error, items, now);
        });
    }

    @Override
    public void recordError(String sourceType, String error, Instant now) {
        cursors.compute(sourceType, (key, current) -> current == null
                ? new SyncCursor(key, null, null, error, 0L, now)
                : new SyncCursor(key, current.cursorValue(), current.lastSuccessAt(), error,
                current.itemsSynced(), now));
    }
}
