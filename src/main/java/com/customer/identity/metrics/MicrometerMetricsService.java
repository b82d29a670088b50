package com.customer.identity.metrics;

import com.customer.identity.core.model.Provider;
import com.customer.identity.core.model.ResolutionAction;
import com.customer.identity.search.SearchMode;
import com.customer.identity.sync.SyncMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code customer.resolution.duration}: Timer (tags: provider, action)</li>
 *   <li>{@code customer.resolution}: Counter (tags: provider, action)</li>
 *   <li>{@code customer.search.duration}: Timer (tag: mode)</li>
 *   <li>{@code customer.search.hits}: DistributionSummary</li>
 *   <li>{@code customer.search.fallback}: Counter</li>
 *   <li>{@code customer.merge}: Counter</li>
 *   <li>{@code customer.merge.customers}: Counter of losing customers removed</li>
 *   <li>{@code customer.merge.rejected}: Counter</li>
 *   <li>{@code customer.sync.records}: Counter (tags: source, outcome)</li>
 *   <li>{@code customer.sync.failure}: Counter (tag: source)</li>
 *   <li>{@code customer.search.cache.hit} / {@code customer.search.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary searchHitsSummary;
    private final Counter searchFallbackCounter;
    private final Counter mergeCounter;
    private final Counter mergedCustomersCounter;
    private final Counter mergeRejectedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.searchHitsSummary = DistributionSummary.builder("customer.search.hits")
                .description("Number of hits returned per search")
                .register(registry);
        this.searchFallbackCounter = Counter.builder("customer.search.fallback")
                .description("Searches answered by the substring fallback")
                .register(registry);
        this.mergeCounter = Counter.builder("customer.merge")
                .description("Completed customer merges")
                .register(registry);
        this.mergedCustomersCounter = Counter.builder("customer.merge.customers")
                .description("Losing customers removed by merges")
                .register(registry);
        this.mergeRejectedCounter = Counter.builder("customer.merge.rejected")
                .description("Merges rejected before any change")
                .register(registry);
        this.cacheHitCounter = Counter.builder("customer.search.cache.hit")
                .description("Search result cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("customer.search.cache.miss")
                .description("Search result cache misses")
                .register(registry);
    }

    @Override
    public void recordResolution(Provider provider, ResolutionAction action, Duration duration) {
        String key = provider.getCode() + ":" + action.name();
        Timer timer = timerCache.computeIfAbsent("resolve:" + key, k ->
                Timer.builder("customer.resolution.duration")
                        .description("Duration of identity resolution")
                        .tag("provider", provider.getCode())
                        .tag("action", action.name())
                        .register(registry));
        timer.record(duration);

        Counter counter = counterCache.computeIfAbsent("resolve:" + key, k ->
                Counter.builder("customer.resolution")
                        .description("Identity resolutions by outcome")
                        .tag("provider", provider.getCode())
                        .tag("action", action.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSearch(SearchMode mode, Duration duration, int hits) {
        Timer timer = timerCache.computeIfAbsent("search:" + mode.name(), k ->
                Timer.builder("customer.search.duration")
                        .description("Duration of customer searches")
                        .tag("mode", mode.name())
                        .register(registry));
        timer.record(duration);
        searchHitsSummary.record(hits);
    }

    @Override
    public void incrementSearchFallback() {
        searchFallbackCounter.increment();
    }

    @Override
    public void incrementMerge(int customersMerged) {
        mergeCounter.increment();
        mergedCustomersCounter.increment(customersMerged);
    }

    @Override
    public void incrementMergeRejected() {
        mergeRejectedCounter.increment();
    }

    @Override
    public void recordSyncBatch(String sourceType, SyncMetrics batch) {
        batch.toMap().forEach((outcome, count) -> {
            if (count > 0) {
                syncCounter(sourceType, outcome).increment(count);
            }
        });
    }

    @Override
    public void incrementSyncFailure(String sourceType) {
        Counter counter = counterCache.computeIfAbsent("sync-failure:" + sourceType, k ->
                Counter.builder("customer.sync.failure")
                        .description("Sync runs aborted by an infrastructure failure")
                        .tag("source", sourceType)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter syncCounter(String sourceType, String outcome) {
        return counterCache.computeIfAbsent("sync:" + sourceType + ":" + outcome, k ->
                Counter.builder("customer.sync.records")
                        .description("Records processed by sync jobs, by outcome")
                        .tag("source", sourceType)
                        .tag("outcome", outcome)
                        .register(registry));
    }
}
