package com.customer.identity.health;

import com.customer.identity.sync.SyncCursor;
import com.customer.identity.sync.SyncCursorStore;

import java.util.List;

/**
 * Reports DEGRADED while any source's most recent batch ended with an error.
 */
public class SyncCursorHealthCheck implements HealthCheck {

    private final SyncCursorStore cursorStore;

    public SyncCursorHealthCheck(SyncCursorStore cursorStore) {
        this.cursorStore = cursorStore;
    }

    @Override
    public String getName() {
        return "syncCursors";
    }

    @Override
    public HealthStatus check() {
        List<SyncCursor> cursors = cursorStore.getAllCursors();
        List<String> failing = cursors.stream()
                .filter(SyncCursor::hasError)
                .map(SyncCursor::sourceType)
                .toList();

        HealthStatus base = failing.isEmpty()
                ? HealthStatus.up()
                : HealthStatus.degraded("Sources with errors: " + String.join(", ", failing));
        return base
                .withDetail("sources", cursors.size())
                .withDetail("failing", failing);
    }
}
