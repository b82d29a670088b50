package com.customer.identity.search;

import com.customer.identity.api.IdentityOptions;
import com.customer.identity.cache.NoOpSearchResultCache;
import com.customer.identity.cache.SearchResultCache;
import com.customer.identity.logging.LogContext;
import com.customer.identity.metrics.MetricsService;
import com.customer.identity.metrics.NoOpMetricsService;
import com.customer.identity.tracing.NoOpTracingService;
import com.customer.identity.tracing.Span;
import com.customer.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranked customer search.
 *
 * <p>Stage A asks the store for a bounded candidate set using index-friendly filters only
 * (email and phone membership, trigram similarity, full-text match). Stage B scores the
 * candidates with {@link TieredScorer}. If Stage A fails for any reason, the query is answered by
 * a plain substring search over the customer table instead, so search degrades but stays
 * available.</p>
 *
 * <p>Results are cached per normalized query and limit. The engine clears the cache after every
 * merge and every resolution that wrote; rows changed outside this library show up once the
 * entry's time-to-live ({@code CacheConfig.ttlSeconds}) has passed.</p>
 */
public class CustomerSearchService {
    private static final Logger log = LoggerFactory.getLogger(CustomerSearchService.class);

    private final CustomerSearchRepository repository;
    private final TieredScorer scorer;
    private final IdentityOptions options;
    private final SearchResultCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public CustomerSearchService(CustomerSearchRepository repository) {
        this(repository, new TieredScorer(), IdentityOptions.defaults(), new NoOpSearchResultCache(),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public CustomerSearchService(CustomerSearchRepository repository, TieredScorer scorer, IdentityOptions options,
                                 SearchResultCache cache, MetricsService metricsService,
                                 TracingService tracingService) {
        this.repository = repository;
        this.scorer = scorer;
        this.options = options;
        this.cache = cache;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public SearchResult search(String query) {
        return search(query, options.getDefaultSearchLimit());
    }

    /**
     * Searches customers.
     *
     * @param query free text: a name, company, email or phone
     * @param limit maximum number of hits; non-positive means the default, larger than the maximum
     *              is clamped
     */
    public SearchResult search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return SearchResult.empty(query);
        }
        int effectiveLimit = limit <= 0 ? options.getDefaultSearchLimit() : Math.min(limit, options.getMaxSearchLimit());
        CandidateQuery candidateQuery = CandidateQuery.of(query, options.getTrigramThreshold(),
                options.getCandidateLimit());

        Optional<SearchResult> cached = cache.get(candidateQuery.text(), effectiveLimit);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();

        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forSearch(LogContext.generateCorrelationId());
             Span span = tracingService.startSpan("customer.search",
                     Map.of("queryType", candidateQuery.type().name()))) {
            SearchResult result;
            try {
                result = ranked(candidateQuery, effectiveLimit);
                cache.put(candidateQuery.text(), effectiveLimit, result);
            } catch (RuntimeException e) {
                log.warn("search.fallback queryType={} error={}", candidateQuery.type(), e.getMessage());
                span.recordException(e);
                metricsService.incrementSearchFallback();
                result = fallback(candidateQuery, effectiveLimit);
            }

            span.setAttribute("mode", result.mode().name());
            span.setAttribute("hits", result.hits().size());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.recordSearch(result.mode(), Duration.ofNanos(System.nanoTime() - startNanos),
                    result.hits().size());
            log.debug("search.completed queryType={} mode={} hits={}",
                    candidateQuery.type(), result.mode(), result.hits().size());
            return result;
        }
    }

    private SearchResult ranked(CandidateQuery query, int limit) {
        List<SearchCandidate> candidates = repository.findCandidates(query);
        List<SearchHit> hits = scorer.rank(query, candidates, options.getMinScore(), limit);
        log.debug("search.ranked candidates={} hits={}", candidates.size(), hits.size());
        return new SearchResult(query.raw(), query.type(), SearchMode.RANKED, hits);
    }

    private SearchResult fallback(CandidateQuery query, int limit) {
        List<SearchHit> hits = repository.substringSearch(query.type(), query.raw(), limit).stream()
                .map(c -> new SearchHit(c.customer(), 0.0, c.providers()))
                .toList();
        return new SearchResult(query.raw(), query.type(), SearchMode.FALLBACK, hits);
    }
}
