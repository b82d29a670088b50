package com.customer.identity.metrics;

import com.customer.identity.core.model.Provider;
import com.customer.identity.core.model.ResolutionAction;
import com.customer.identity.search.SearchMode;
import com.customer.identity.sync.SyncMetrics;

import java.time.Duration;

/**
 * Metrics that go nowhere.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(Provider provider, ResolutionAction action, Duration duration) {
    }

    @Override
    public void recordSearch(SearchMode mode, Duration duration, int hits) {
    }

    @Override
    public void incrementSearchFallback() {
    }

    @Override
    public void incrementMerge(int customersMerged) {
    }

    @Override
    public void incrementMergeRejected() {
    }

    @Override
    public void recordSyncBatch(String sourceType, SyncMetrics batch) {
    }

    @Override
    public void incrementSyncFailure(String sourceType) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
