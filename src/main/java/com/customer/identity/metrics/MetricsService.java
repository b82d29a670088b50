package com.customer.identity.metrics;

import com.customer.identity.core.model.Provider;
import com.customer.identity.core.model.ResolutionAction;
import com.customer.identity.search.SearchMode;
import com.customer.identity.sync.SyncMetrics;

import java.time.Duration;

/**
 * Metrics seam of the library. {@link NoOpMetricsService} is used unless a
 * {@link MicrometerMetricsService} is configured.
 */
public interface MetricsService {

    void recordResolution(Provider provider, ResolutionAction action, Duration duration);

    void recordSearch(SearchMode mode, Duration duration, int hits);

    void incrementSearchFallback();

    void incrementMerge(int customersMerged);

    void incrementMergeRejected();

    /**
     * Adds the counts of one sync page for {@code sourceType}.
     */
    void recordSyncBatch(String sourceType, SyncMetrics batch);

    void incrementSyncFailure(String sourceType);

    void recordCacheHit();

    void recordCacheMiss();
}
