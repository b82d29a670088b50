package com.customer.identity.api;

import com.customer.identity.address.AddressFingerprinter;
import com.customer.identity.cache.CacheConfig;
import com.customer.identity.cache.CaffeineSearchResultCache;
import com.customer.identity.cache.NoOpSearchResultCache;
import com.customer.identity.cache.SearchResultCache;
import com.customer.identity.core.model.MergeCandidate;
import com.customer.identity.health.DatabaseHealthCheck;
import com.customer.identity.health.HealthCheckRegistry;
import com.customer.identity.health.HealthStatus;
import com.customer.identity.health.SyncCursorHealthCheck;
import com.customer.identity.merge.CustomerMergeRepository;
import com.customer.identity.merge.DuplicateContactGroup;
import com.customer.identity.merge.MergeEngine;
import com.customer.identity.merge.MergeListener;
import com.customer.identity.merge.MergeResult;
import com.customer.identity.metrics.MetricsService;
import com.customer.identity.metrics.MicrometerMetricsService;
import com.customer.identity.metrics.NoOpMetricsService;
import com.customer.identity.resolver.IdentityResolver;
import com.customer.identity.resolver.ResolutionListener;
import com.customer.identity.resolver.ResolutionRequest;
import com.customer.identity.resolver.ResolutionResult;
import com.customer.identity.search.CustomerSearchRepository;
import com.customer.identity.search.CustomerSearchService;
import com.customer.identity.search.SearchResult;
import com.customer.identity.search.TieredScorer;
import com.customer.identity.store.CustomerRepository;
import com.customer.identity.store.jdbc.JdbcCustomerRepository;
import com.customer.identity.store.jdbc.JdbcCustomerSearchRepository;
import com.customer.identity.store.jdbc.JdbcMergeRepository;
import com.customer.identity.store.jdbc.JdbcSyncCursorRepository;
import com.customer.identity.store.jdbc.SchemaInitializer;
import com.customer.identity.store.memory.InMemoryCustomerStore;
import com.customer.identity.store.memory.InMemorySyncCursorRepository;
import com.customer.identity.sync.CustomerSyncJob;
import com.customer.identity.sync.IdentityExtractor;
import com.customer.identity.sync.RecordSource;
import com.customer.identity.sync.SyncCursor;
import com.customer.identity.sync.SyncCursorRepository;
import com.customer.identity.sync.SyncCursorStore;
import com.customer.identity.tracing.NoOpTracingService;
import com.customer.identity.tracing.OpenTelemetryTracingService;
import com.customer.identity.tracing.TracingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point of the customer identity library.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (CustomerIdentityEngine engine = CustomerIdentityEngine.builder()
 *         .dataSource(dataSource)
 *         .meterRegistry(registry)
 *         .build()) {
 *
 *     ResolutionResult result = engine.resolve(ResolutionRequest.builder(Provider.STOREFRONT)
 *             .externalId("cust_1")
 *             .email("jane@example.com")
 *             .build());
 *
 *     SearchResult hits = engine.search("jane doe", 10);
 * }
 * </pre>
 *
 * <p>With a {@link DataSource} the engine stores everything in PostgreSQL; without one it keeps
 * everything in memory, which suits tests and embedded use. The data source is owned by the
 * caller and is not closed by {@link #close()}.</p>
 */
public class CustomerIdentityEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CustomerIdentityEngine.class);

    private final IdentityOptions options;
    private final IdentityResolver resolver;
    private final CustomerSearchService searchService;
    private final MergeEngine mergeEngine;
    private final SyncCursorStore cursorStore;
    private final CustomerRepository customerRepository;
    private final SearchResultCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final HealthCheckRegistry healthCheckRegistry;
    private final Clock clock;

    private CustomerIdentityEngine(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        ObjectMapper mapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();

        // Initialize repositories
        CustomerSearchRepository searchRepository;
        CustomerMergeRepository mergeRepository;
        SyncCursorRepository cursorRepository;
        if (builder.dataSource != null) {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(builder.dataSource);
            TransactionTemplate transactionTemplate =
                    new TransactionTemplate(new DataSourceTransactionManager(builder.dataSource));
            if (builder.createSchema) {
                new SchemaInitializer(jdbcTemplate).createSchema();
            }
            this.customerRepository = new JdbcCustomerRepository(jdbcTemplate, transactionTemplate, mapper);
            searchRepository = new JdbcCustomerSearchRepository(jdbcTemplate, transactionTemplate);
            mergeRepository = new JdbcMergeRepository(jdbcTemplate, transactionTemplate);
            cursorRepository = new JdbcSyncCursorRepository(jdbcTemplate, mapper);
        } else {
            InMemoryCustomerStore store = new InMemoryCustomerStore(clock);
            this.customerRepository = store;
            searchRepository = store;
            mergeRepository = store;
            cursorRepository = new InMemorySyncCursorRepository();
        }

        // Initialize engines
        this.cache = builder.cacheConfig.enabled()
                ? new CaffeineSearchResultCache(builder.cacheConfig) : new NoOpSearchResultCache();
        this.resolver = new IdentityResolver(customerRepository, new AddressFingerprinter(), options,
                metricsService, tracingService);
        this.searchService = new CustomerSearchService(searchRepository, new TieredScorer(), options, cache,
                metricsService, tracingService);
        this.mergeEngine = new MergeEngine(mergeRepository, customerRepository, options.getReferencingTables(),
                metricsService, tracingService);
        this.cursorStore = new SyncCursorStore(cursorRepository, mapper, clock);

        if (cache instanceof MergeListener mergeListener) {
            mergeEngine.addMergeListener(mergeListener);
        }
        if (cache instanceof ResolutionListener resolutionListener) {
            resolver.addResolutionListener(resolutionListener);
        }

        // Initialize health checks
        this.healthCheckRegistry = new HealthCheckRegistry();
        if (builder.dataSource != null) {
            healthCheckRegistry.register(new DatabaseHealthCheck(builder.dataSource));
        }
        healthCheckRegistry.register(new SyncCursorHealthCheck(cursorStore));

        log.info("engine.initialized storage={} cache={}",
                builder.dataSource != null ? "postgresql" : "memory", builder.cacheConfig.enabled());
    }

    // ========== Resolution API ==========

    /**
     * Resolves a provider record to a customer, creating or linking as needed.
     */
    public ResolutionResult resolve(ResolutionRequest request) {
        return resolver.resolve(request);
    }

    // ========== Search API ==========

    public SearchResult search(String query) {
        return searchService.search(query);
    }

    /**
     * Ranked search over names, companies, emails and phones.
     */
    public SearchResult search(String query, int limit) {
        return searchService.search(query, limit);
    }

    // ========== Merge API ==========

    public List<MergeCandidate> findMergeCandidates(long customerId) {
        return mergeEngine.findMergeCandidates(customerId);
    }

    /**
     * Merges {@code mergeIds} into {@code primaryId}. Invalid requests come back as failed
     * results, never as exceptions.
     */
    public MergeResult mergeCustomers(long primaryId, List<Long> mergeIds) {
        return mergeEngine.mergeCustomers(primaryId, mergeIds);
    }

    /**
     * Groups of customers sharing a primary email or phone, for operator review.
     */
    public List<DuplicateContactGroup> findDuplicateContactGroups(int limit) {
        return mergeEngine.findDuplicateContactGroups(limit);
    }

    public void addMergeListener(MergeListener listener) {
        mergeEngine.addMergeListener(listener);
    }

    // ========== Sync API ==========

    public Optional<SyncCursor> getCursor(String sourceType) {
        return cursorStore.getCursor(sourceType);
    }

    public <T> Optional<T> getCursorValue(String sourceType, Class<T> type) {
        return cursorStore.getCursorValue(sourceType, type);
    }

    public void updateCursor(String sourceType, Object value, long itemsSyncedDelta, String error) {
        cursorStore.updateCursor(sourceType, value, itemsSyncedDelta, error);
    }

    public void recordCursorError(String sourceType, String error) {
        cursorStore.recordError(sourceType, error);
    }

    /**
     * Starts a sync job wired to this engine's resolver, cursor store and observability. The
     * caller adds the linker and review sink it needs and builds the job.
     */
    public <R, C> CustomerSyncJob.Builder<R, C> syncJob(RecordSource<R, C> source, IdentityExtractor<R> extractor) {
        return CustomerSyncJob.<R, C>builder()
                .source(source)
                .extractor(extractor)
                .resolver(resolver)
                .cursorStore(cursorStore)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .pageSize(options.getSyncPageSize())
                .maxPages(options.getSyncMaxPages())
                .clock(clock);
    }

    // ========== Health ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    // ========== Accessors ==========

    public IdentityOptions getOptions() {
        return options;
    }

    public IdentityResolver getResolver() {
        return resolver;
    }

    public CustomerSearchService getSearchService() {
        return searchService;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public SyncCursorStore getCursorStore() {
        return cursorStore;
    }

    public CustomerRepository getCustomerRepository() {
        return customerRepository;
    }

    public SearchResultCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        cache.invalidateAll();
        log.info("engine.closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DataSource dataSource;
        private boolean createSchema = false;
        private IdentityOptions options = IdentityOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();

        /**
         * Stores customers in PostgreSQL. Without a data source the engine runs in memory.
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Runs the bundled DDL on startup. Every statement is idempotent.
         */
        public Builder createSchema(boolean createSchema) {
            this.createSchema = createSchema;
            return this;
        }

        public Builder options(IdentityOptions options) {
            this.options = options;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder meterRegistry(MeterRegistry registry) {
            this.metricsService = new MicrometerMetricsService(registry);
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder openTelemetry(OpenTelemetry openTelemetry) {
            this.tracingService = new OpenTelemetryTracingService(openTelemetry);
            return this;
        }

        /**
         * Mapper used for identity metadata and cursor values.
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CustomerIdentityEngine build() {
            if (options == null) {
                throw new IllegalStateException("IdentityOptions is required");
            }
            if (cacheConfig == null) {
                throw new IllegalStateException("CacheConfig is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new CustomerIdentityEngine(this);
        }
    }
}
