package com.customer.identity.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rows touched by a merge, per table.
 *
 * @param repointed  rows whose customer id now names the primary
 * @param deleted    rows deleted because the primary already owned one (one-per-customer tables)
 * @param customersDeleted losing customer rows removed
 */
public record MergeCounts(Map<String, Integer> repointed, Map<String, Integer> deleted, int customersDeleted) {

    public MergeCounts {
        repointed = Collections.unmodifiableMap(new LinkedHashMap<>(repointed));
        deleted = Collections.unmodifiableMap(new LinkedHashMap<>(deleted));
    }

    public int repointedIn(String table) {
        return repointed.getOrDefault(table, 0);
    }
}
