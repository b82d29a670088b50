package com.customer.identity.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-source checkpoints of incremental syncs.
 *
 * <p>The cursor value is opaque to this class; callers store whatever position their source
 * understands (a page token, a last id, an updated-at watermark) and read it back with the same
 * type. {@code itemsSynced} only ever accumulates. The success timestamp moves only on clean
 * batches, but the cursor value always moves to the supplied position, so a batch with a failing
 * record still advances past it.</p>
 */
public class SyncCursorStore {
    private static final Logger log = LoggerFactory.getLogger(SyncCursorStore.class);

    private final SyncCursorRepository repository;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SyncCursorStore(SyncCursorRepository repository, ObjectMapper mapper) {
        this(repository, mapper, Clock.systemUTC());
    }

    public SyncCursorStore(SyncCursorRepository repository, ObjectMapper mapper, Clock clock) {
        this.repository = repository;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Optional<SyncCursor> getCursor(String sourceType) {
        return repository.find(requireSourceType(sourceType));
    }

    public List<SyncCursor> getAllCursors() {
        return repository.findAll();
    }

    /**
     * Reads the stored position as {@code type}; empty before the first batch.
     *
     * @throws IllegalStateException if the stored value cannot be read as {@code type}
     */
    public <T> Optional<T> getCursorValue(String sourceType, Class<T> type) {
        Optional<JsonNode> value = getCursor(sourceType)
                .map(SyncCursor::cursorValue)
                .filter(node -> !node.isNull());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.treeToValue(value.get(), type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cursor of " + sourceType + " is not a " + type.getSimpleName(), e);
        }
    }

    /**
     * Moves the cursor to {@code value} and adds {@code itemsSyncedDelta} to its counter.
     *
     * @param error summary of the batch's record failures, {@code null} for a clean batch
     */
    public void updateCursor(String sourceType, Object value, long itemsSyncedDelta, String error) {
        requireSourceType(sourceType);
        if (itemsSyncedDelta < 0) {
            throw new IllegalArgumentException("itemsSyncedDelta must not be negative");
        }
        JsonNode node = value == null ? null : mapper.valueToTree(value);
        repository.upsert(sourceType, node, itemsSyncedDelta, error, clock.instant());
        log.debug("sync.cursor_updated sourceType={} delta={} error={}", sourceType, itemsSyncedDelta, error != null);
    }

    /**
     * Records a failure without moving the cursor.
     */
    public void recordError(String sourceType, String error) {
        Objects.requireNonNull(error, "error is required");
        repository.recordError(requireSourceType(sourceType), error, clock.instant());
        log.debug("sync.cursor_error sourceType={} error={}", sourceType, error);
    }

    private static String requireSourceType(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) {
            throw new IllegalArgumentException("sourceType is required");
        }
        return sourceType;
    }
}
