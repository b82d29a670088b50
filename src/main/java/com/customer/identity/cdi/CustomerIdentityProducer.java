package com.customer.identity.cdi;

import com.customer.identity.api.CustomerIdentityEngine;
import com.customer.identity.api.IdentityOptions;
import com.customer.identity.cache.CacheConfig;
import com.customer.identity.merge.MergeEngine;
import com.customer.identity.resolver.IdentityResolver;
import com.customer.identity.search.CustomerSearchService;
import com.customer.identity.sync.SyncCursorStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * CDI producer that wires the customer identity engine from MicroProfile Config properties.
 *
 * <p>The container must provide a {@link DataSource}. A {@link MeterRegistry} and an
 * {@link OpenTelemetry} bean are used when present.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * customer-identity:
 *   schema:
 *     create: true
 *   search:
 *     candidate-limit: 200
 *     trigram-threshold: 0.2
 *     min-score: 0.75
 *     default-limit: 20
 *     max-limit: 50
 *   cache:
 *     enabled: true
 *     max-size: 1000
 *     ttl-seconds: 30
 *   sync:
 *     page-size: 100
 *     max-pages: 1000
 * </pre>
 */
@ApplicationScoped
public class CustomerIdentityProducer {

    private static final Logger log = LoggerFactory.getLogger(CustomerIdentityProducer.class);

    @Inject
    DataSource dataSource;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<OpenTelemetry> openTelemetry;

    // ── Schema ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "customer-identity.schema.create", defaultValue = "false")
    boolean createSchema;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "customer-identity.resolution.address-linking-enabled", defaultValue = "true")
    boolean addressLinkingEnabled;

    // ── Search ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "customer-identity.search.candidate-limit", defaultValue = "200")
    int candidateLimit;

    @Inject
    @ConfigProperty(name = "customer-identity.search.trigram-threshold", defaultValue = "0.2")
    double trigramThreshold;

    @Inject
    @ConfigProperty(name = "customer-identity.search.min-score", defaultValue = "0.75")
    double minScore;

    @Inject
    @ConfigProperty(name = "customer-identity.search.default-limit", defaultValue = "20")
    int defaultSearchLimit;

    @Inject
    @ConfigProperty(name = "customer-identity.search.max-limit", defaultValue = "50")
    int maxSearchLimit;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "customer-identity.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "customer-identity.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "customer-identity.cache.ttl-seconds", defaultValue = "30")
    int cacheTtlSeconds;

    // ── Sync ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "customer-identity.sync.page-size", defaultValue = "100")
    int syncPageSize;

    @Inject
    @ConfigProperty(name = "customer-identity.sync.max-pages", defaultValue = "1000")
    int syncMaxPages;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CustomerIdentityEngine customerIdentityEngine() {
        IdentityOptions options = IdentityOptions.builder()
                .candidateLimit(candidateLimit)
                .trigramThreshold(trigramThreshold)
                .minScore(minScore)
                .maxSearchLimit(maxSearchLimit)
                .defaultSearchLimit(defaultSearchLimit)
                .addressLinkingEnabled(addressLinkingEnabled)
                .syncPageSize(syncPageSize)
                .syncMaxPages(syncMaxPages)
                .build();

        CacheConfig cacheConfig = new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled);

        CustomerIdentityEngine.Builder builder = CustomerIdentityEngine.builder()
                .dataSource(dataSource)
                .createSchema(createSchema)
                .options(options)
                .cacheConfig(cacheConfig);

        if (meterRegistry.isResolvable()) {
            builder.meterRegistry(meterRegistry.get());
        }
        if (openTelemetry.isResolvable()) {
            builder.openTelemetry(openTelemetry.get());
        }

        log.info("Producing CustomerIdentityEngine: createSchema={} cache={} metrics={} tracing={}",
                createSchema, cacheEnabled, meterRegistry.isResolvable(), openTelemetry.isResolvable());
        return builder.build();
    }

    public void closeEngine(@Disposes CustomerIdentityEngine engine) {
        log.info("Closing CustomerIdentityEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public IdentityResolver identityResolver(CustomerIdentityEngine engine) {
        return engine.getResolver();
    }

    @Produces
    @ApplicationScoped
    public CustomerSearchService customerSearchService(CustomerIdentityEngine engine) {
        return engine.getSearchService();
    }

    @Produces
    @ApplicationScoped
    public MergeEngine mergeEngine(CustomerIdentityEngine engine) {
        return engine.getMergeEngine();
    }

    @Produces
    @ApplicationScoped
    public SyncCursorStore syncCursorStore(CustomerIdentityEngine engine) {
        return engine.getCursorStore();
    }
}
