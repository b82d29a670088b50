package com.customer.identity.sync;

import com.customer.identity.core.model.ResolutionAction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome counts of one sync run (or one page of it). Each run owns its own instance; the
 * orchestrator sums them with {@link #add(SyncMetrics)}. Not thread-safe.
 */
public class SyncMetrics {

    private long fetched;
    private long created;
    private long updated;
    private long linked;
    private long unlinked;
    private long ambiguous;
    private long errors;

    public void recordFetched(int count) {
        fetched += count;
    }

    public void recordOutcome(ResolutionAction action) {
        switch (action) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case LINKED -> linked++;
            case AMBIGUOUS -> ambiguous++;
        }
    }

    /**
     * A record without any identifying signal; it is left unlinked without calling the resolver.
     */
    public void recordUnlinked() {
        unlinked++;
    }

    public void recordError() {
        errors++;
    }

    public SyncMetrics add(SyncMetrics other) {
        fetched += other.fetched;
        created += other.created;
        updated += other.updated;
        linked += other.linked;
        unlinked += other.unlinked;
        ambiguous += other.ambiguous;
        errors += other.errors;
        return this;
    }

    /**
     * Records handled without an error.
     */
    public long succeeded() {
        return created + updated + linked + unlinked + ambiguous;
    }

    public long getFetched() {
        return fetched;
    }

    public long getCreated() {
        return created;
    }

    public long getUpdated() {
        return updated;
    }

    public long getLinked() {
        return linked;
    }

    public long getUnlinked() {
        return unlinked;
    }

    public long getAmbiguous() {
        return ambiguous;
    }

    public long getErrors() {
        return errors;
    }

    public Map<String, Long> toMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        map.put("fetched", fetched);
        map.put("created", created);
        map.put("updated", updated);
        map.put("linked", linked);
        map.put("unlinked", unlinked);
        map.put("ambiguous", ambiguous);
        map.put("errors", errors);
        return map;
    }

    @Override
    public String toString() {
        return "SyncMetrics" + toMap();
    }
}
