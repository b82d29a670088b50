package com.customer.identity.sync;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an orchestrated sync across several sources.
 *
 * @param results  completed runs, in execution order
 * @param failures error message of every aborted source, by source type
 * @param totals   counts summed over completed runs and the partial counts of aborted ones
 */
public record SyncSummary(List<SyncRunResult> results, Map<String, String> failures, SyncMetrics totals) {

    public SyncSummary {
        results = List.copyOf(results);
        failures = Map.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Whether any record was left for a human to assign.
     */
    public boolean reviewRequired() {
        return totals.getAmbiguous() > 0;
    }
}
