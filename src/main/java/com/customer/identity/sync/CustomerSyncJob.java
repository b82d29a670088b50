package com.customer.identity.sync;

import com.customer.identity.core.model.Provider;
import com.customer.identity.logging.LogContext;
import com.customer.identity.metrics.MetricsService;
import com.customer.identity.metrics.NoOpMetricsService;
import com.customer.identity.resolver.IdentityResolver;
import com.customer.identity.resolver.ResolutionRequest;
import com.customer.identity.resolver.ResolutionResult;
import com.customer.identity.store.StoreException;
import com.customer.identity.tracing.NoOpTracingService;
import com.customer.identity.tracing.Span;
import com.customer.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Incremental sync of one provider source into the customer store.
 *
 * <p>Pages are fetched from the {@link RecordSource} starting at the stored cursor. Each record is
 * resolved and linked one at a time. After every page the cursor moves to the page's next position
 * and its counter grows by the number of records that did not fail.</p>
 *
 * <p>A record that throws is counted as an error and skipped. A {@link StoreException} or a failed
 * page fetch aborts the run instead: the error is written to the cursor row without moving the
 * cursor, and a {@link SyncException} is thrown.</p>
 *
 * @param <R> raw record type
 * @param <C> cursor position type
 */
public class CustomerSyncJob<R, C> implements SyncJob {
    private static final Logger log = LoggerFactory.getLogger(CustomerSyncJob.class);

    private final RecordSource<R, C> source;
    private final IdentityExtractor<R> extractor;
    private final IdentityResolver resolver;
    private final SyncCursorStore cursorStore;
    private final RecordLinker<R> linker;
    private final ReviewTaskSink reviewSink;
    private final Function<R, String> recordKey;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final int pageSize;
    private final int maxPages;

    private CustomerSyncJob(Builder<R, C> builder) {
        this.source = builder.source;
        this.extractor = builder.extractor;
        this.resolver = builder.resolver;
        this.cursorStore = builder.cursorStore;
        this.linker = builder.linker;
        this.reviewSink = builder.reviewSink;
        this.recordKey = builder.recordKey;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.clock = builder.clock;
        this.pageSize = builder.pageSize;
        this.maxPages = builder.maxPages;
    }

    @Override
    public String sourceType() {
        return source.sourceType();
    }

    @Override
    public Provider provider() {
        return source.provider();
    }

    @Override
    public SyncRunResult run() {
        C start = cursorStore.getCursorValue(source.sourceType(), source.positionType()).orElse(null);
        return execute(start, false);
    }

    /**
     * Runs from {@code start} (or from the beginning when {@code null}) regardless of the stored
     * cursor, which is still overwritten after every page. An interrupted full resync therefore
     * resumes incrementally from where it stopped unless restarted with an explicit start.
     */
    public SyncRunResult runFullResync(C start) {
        return execute(start, true);
    }

    private SyncRunResult execute(C start, boolean fullResync) {
        String sourceType = source.sourceType();
        Instant startedAt = clock.instant();
        SyncMetrics total = new SyncMetrics();

        try (LogContext ctx = LogContext.forSync(LogContext.generateCorrelationId(), sourceType)) {
            log.info("sync.starting sourceType={} fullResync={} position={}", sourceType, fullResync, start);

            C position = start;
            boolean hasMore = true;
            int pages = 0;
            while (hasMore && pages < maxPages) {
                SourcePage<R, C> page = processPage(position, total);
                position = page.nextPosition();
                hasMore = page.hasMore();
                pages++;
            }

            if (hasMore) {
                log.warn("sync.page_limit_reached sourceType={} pages={}", sourceType, pages);
            }
            Duration duration = Duration.between(startedAt, clock.instant());
            log.info("sync.completed sourceType={} pages={} metrics={} durationMs={}",
                    sourceType, pages, total.toMap(), duration.toMillis());
            if (total.getAmbiguous() > 0) {
                log.warn("sync.review_required sourceType={} ambiguous={}", sourceType, total.getAmbiguous());
            }
            return new SyncRunResult(sourceType, total, pages, !hasMore, fullResync, duration);
        }
    }

    private SourcePage<R, C> processPage(C position, SyncMetrics total) {
        String sourceType = source.sourceType();
        try (Span span = tracingService.startSpan("customer.sync.page", Map.of("sourceType", sourceType))) {
            SourcePage<R, C> page;
            try {
                page = source.fetch(position, pageSize);
            } catch (RuntimeException e) {
                span.fail(e);
                throw abort("fetch failed: " + e.getMessage(), total, e);
            }

            SyncMetrics batch = new SyncMetrics();
            batch.recordFetched(page.records().size());
            String firstError = null;
            for (R record : page.records()) {
                try {
                    processRecord(record, batch);
                } catch (StoreException e) {
                    span.fail(e);
                    throw abort("store unavailable: " + e.getMessage(), total.add(batch), e);
                } catch (RuntimeException e) {
                    batch.recordError();
                    String key = recordKey.apply(record);
                    if (firstError == null) {
                        firstError = key + ": " + e.getMessage();
                    }
                    log.warn("sync.record_failed sourceType={} record={} error={}", sourceType, key, e.getMessage());
                }
            }

            String error = batch.getErrors() == 0 ? null
                    : batch.getErrors() + " of " + batch.getFetched() + " records failed; first: " + firstError;
            try {
                cursorStore.updateCursor(sourceType, page.nextPosition(), batch.succeeded(), error);
            } catch (StoreException e) {
                span.fail(e);
                throw abort("cursor update failed: " + e.getMessage(), total.add(batch), e);
            }

            metricsService.recordSyncBatch(sourceType, batch);
            total.add(batch);
            span.setAttribute("records", batch.getFetched());
            span.setAttribute("errors", batch.getErrors());
            span.setStatus(Span.SpanStatus.OK);
            log.debug("sync.page_completed sourceType={} metrics={}", sourceType, batch.toMap());
            return page;
        }
    }

    private void processRecord(R record, SyncMetrics batch) {
        Optional<ResolutionRequest> request = extractor.extract(record);
        if (request.isEmpty()) {
            batch.recordUnlinked();
            return;
        }

        ResolutionResult result = resolver.resolve(request.get());
        if (result.isAmbiguous()) {
            reviewSink.submit(new ReviewTask(source.sourceType(), recordKey.apply(record),
                    request.get().getProvider(), result.matchedBy(), result.ambiguousCustomerIds(), clock.instant()));
        } else {
            linker.link(record, result.customerId());
        }
        // Counted once the record is fully handled; a failed link counts as an error only.
        batch.recordOutcome(result.action());
    }

    private SyncException abort(String reason, SyncMetrics partial, RuntimeException cause) {
        String sourceType = source.sourceType();
        log.error("sync.aborted sourceType={} reason={}", sourceType, reason);
        metricsService.incrementSyncFailure(sourceType);
        SyncException exception = new SyncException(sourceType, partial, "Sync of " + sourceType + " aborted: " + reason,
                cause);
        try {
            cursorStore.recordError(sourceType, reason);
        } catch (RuntimeException e) {
            exception.addSuppressed(e);
        }
        return exception;
    }

    public static <R, C> Builder<R, C> builder() {
        return new Builder<>();
    }

    public static class Builder<R, C> {
        private RecordSource<R, C> source;
        private IdentityExtractor<R> extractor;
        private IdentityResolver resolver;
        private SyncCursorStore cursorStore;
        private RecordLinker<R> linker = RecordLinker.none();
        private ReviewTaskSink reviewSink = new InMemoryReviewTaskSink();
        private Function<R, String> recordKey = String::valueOf;
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private Clock clock = Clock.systemUTC();
        private int pageSize = 100;
        private int maxPages = 1_000;

        public Builder<R, C> source(RecordSource<R, C> source) {
            this.source = source;
            return this;
        }

        public Builder<R, C> extractor(IdentityExtractor<R> extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder<R, C> resolver(IdentityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder<R, C> cursorStore(SyncCursorStore cursorStore) {
            this.cursorStore = cursorStore;
            return this;
        }

        public Builder<R, C> linker(RecordLinker<R> linker) {
            this.linker = linker;
            return this;
        }

        public Builder<R, C> reviewSink(ReviewTaskSink reviewSink) {
            this.reviewSink = reviewSink;
            return this;
        }

        /**
         * How records are named in logs, errors and review tasks. Defaults to {@code toString()}.
         */
        public Builder<R, C> recordKey(Function<R, String> recordKey) {
            this.recordKey = recordKey;
            return this;
        }

        public Builder<R, C> metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder<R, C> tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder<R, C> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder<R, C> pageSize(int pageSize) {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive");
            }
            this.pageSize = pageSize;
            return this;
        }

        public Builder<R, C> maxPages(int maxPages) {
            if (maxPages <= 0) {
                throw new IllegalArgumentException("maxPages must be positive");
            }
            this.maxPages = maxPages;
            return this;
        }

        public CustomerSyncJob<R, C> build() {
            Objects.requireNonNull(source, "source is required");
            Objects.requireNonNull(extractor, "extractor is required");
            Objects.requireNonNull(resolver, "resolver is required");
            Objects.requireNonNull(cursorStore, "cursorStore is required");
            Objects.requireNonNull(linker, "linker is required");
            Objects.requireNonNull(reviewSink, "reviewSink is required");
            Objects.requireNonNull(recordKey, "recordKey is required");
            return new CustomerSyncJob<>(this);
        }
    }
}
