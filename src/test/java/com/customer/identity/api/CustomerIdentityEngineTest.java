package com.customer.identity.api;

import com.customer.identity.cache.CacheConfig;
import com.customer.identity.cache.CaffeineSearchResultCache;
import com.customer.identity.cache.NoOpSearchResultCache;
import com.customer.identity.core.model.MatchMethod;
import com.customer.identity.core.model.Provider;
import com.customer.identity.core.model.ResolutionAction;
import com.customer.identity.health.HealthStatus;
import com.customer.identity.merge.MergeResult;
import com.customer.identity.resolver.ResolutionRequest;
import com.customer.identity.resolver.ResolutionResult;
import com.customer.identity.search.SearchResult;
import com.customer.identity.sync.CustomerSyncJob;
import com.customer.identity.sync.RecordSource;
import com.customer.identity.sync.SourcePage;
import com.customer.identity.sync.SyncRunResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomerIdentityEngine Tests")
class CustomerIdentityEngineTest {

    private SimpleMeterRegistry registry;
    private CustomerIdentityEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = CustomerIdentityEngine.builder()
                .meterRegistry(registry)
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private ResolutionResult resolve(Provider provider, String externalId, String email, String first, String last) {
        return engine.resolve(ResolutionRequest.builder(provider)
                .externalId(externalId)
                .email(email)
                .firstName(first)
                .lastName(last)
                .build());
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Defaults to in-memory storage with a Caffeine cache")
        void defaults() {
            assertInstanceOf(CaffeineSearchResultCache.class, engine.getCache());
            assertNotNull(engine.getResolver());
            assertNotNull(engine.getSearchService());
            assertNotNull(engine.getMergeEngine());
            assertNotNull(engine.getCursorStore());
            assertEquals(IdentityOptions.defaults().getDefaultSearchLimit(), engine.getOptions().getDefaultSearchLimit());
        }

        @Test
        @DisplayName("A disabled cache uses the no-op implementation")
        void disabledCache() {
            try (CustomerIdentityEngine uncached = CustomerIdentityEngine.builder()
                    .cacheConfig(CacheConfig.disabled())
                    .build()) {
                assertInstanceOf(NoOpSearchResultCache.class, uncached.getCache());
            }
        }

        @Test
        @DisplayName("Missing required settings are rejected")
        void requiredSettings() {
            assertThrows(IllegalStateException.class, () -> CustomerIdentityEngine.builder().options(null).build());
            assertThrows(IllegalStateException.class, () -> CustomerIdentityEngine.builder().cacheConfig(null).build());
            assertThrows(IllegalStateException.class, () -> CustomerIdentityEngine.builder().clock(null).build());
        }

        @Test
        @DisplayName("Without a database only the cursor check is registered")
        void healthChecks() {
            assertEquals(1, engine.getHealthCheckRegistry().size());
            HealthStatus health = engine.health();
            assertTrue(health.isUp());
            assertTrue(health.details().containsKey("syncCursors"));
        }
    }

    @Nested
    @DisplayName("End to end")
    class EndToEndTests {

        @Test
        @DisplayName("Records from several providers converge on one customer that search finds")
        void resolveThenSearch() {
            ResolutionResult created = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe");
            ResolutionResult linked = resolve(Provider.ACCOUNTING, "qb_1", "JANE@example.com", null, null);

            assertEquals(ResolutionAction.CREATED, created.action());
            assertEquals(ResolutionAction.LINKED, linked.action());
            assertEquals(MatchMethod.EMAIL, linked.matchedBy());

            SearchResult result = engine.search("jane doe");
            assertEquals(List.of(created.customerId()), result.customerIds());
            assertEquals(2, result.hits().get(0).linkedProviders().size());
        }

        @Test
        @DisplayName("A merge invalidates cached search results")
        void mergeInvalidatesCache() {
            long jane = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe").customerId();
            long janeAgain = resolve(Provider.MARKETPLACE, "mp_1", "jane.doe@example.com", "Jane", "Doe").customerId();

            assertEquals(2, engine.search("jane doe").hits().size());
            assertEquals(1, engine.getCache().getStats().size());

            MergeResult merge = engine.mergeCustomers(jane, List.of(janeAgain));

            assertTrue(merge.isSuccess());
            assertEquals(0, engine.getCache().getStats().size());
            assertEquals(List.of(jane), engine.search("jane doe").customerIds());
        }

        @Test
        @DisplayName("A new customer invalidates cached search results")
        void resolutionInvalidatesCache() {
            long jane = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe").customerId();
            assertEquals(List.of(jane), engine.search("jane doe").customerIds());
            assertEquals(1, engine.getCache().getStats().size());

            long other = resolve(Provider.MARKETPLACE, "mp_1", "jane.doe@example.com", "Jane", "Doe").customerId();

            assertEquals(0, engine.getCache().getStats().size());
            assertTrue(engine.search("jane doe").customerIds().contains(other));
        }

        @Test
        @DisplayName("Merge candidates and duplicate groups are exposed")
        void mergeWorkflow() {
            long jane = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe").customerId();

            assertTrue(engine.findMergeCandidates(jane).isEmpty());
            assertTrue(engine.findDuplicateContactGroups(10).isEmpty());
            assertTrue(engine.mergeCustomers(jane, List.of(jane)).isFailure());
        }
    }

    @Nested
    @DisplayName("Sync")
    class SyncTests {

        record Row(String id, String email) {}

        private final RecordSource<Row, String> source = new RecordSource<>() {
            @Override
            public String sourceType() {
                return "storefront_customer";
            }

            @Override
            public Provider provider() {
                return Provider.STOREFRONT;
            }

            @Override
            public Class<String> positionType() {
                return String.class;
            }

            @Override
            public SourcePage<Row, String> fetch(String position, int pageSize) {
                if (position != null) {
                    return SourcePage.last(List.of(), position);
                }
                return SourcePage.last(List.of(new Row("c_1", "a@example.com"), new Row("c_2", "b@example.com")),
                        "2024-05-01T00:00:00Z");
            }
        };

        @Test
        @DisplayName("Sync jobs built from the engine share its resolver and cursor store")
        void syncJob() {
            CustomerSyncJob<Row, String> job = engine.syncJob(source, (Row row) -> Optional.of(
                            ResolutionRequest.builder(Provider.STOREFRONT).externalId(row.id()).email(row.email()).build()))
                    .recordKey(Row::id)
                    .build();

            SyncRunResult result = job.run();

            assertEquals(2, result.metrics().getCreated());
            assertEquals("2024-05-01T00:00:00Z", engine.getCursorValue("storefront_customer", String.class).orElseThrow());
            assertEquals(2, engine.getCursor("storefront_customer").orElseThrow().itemsSynced());
            assertEquals(2, engine.search("a@example.com").hits().size() + engine.search("b@example.com").hits().size());
        }

        @Test
        @DisplayName("Cursor errors surface in engine health")
        void cursorErrorsInHealth() {
            engine.updateCursor("marketplace_order", Map.of("page", 3), 10, null);
            engine.recordCursorError("marketplace_order", "fetch failed: HTTP 503");

            assertTrue(engine.health().isDegraded());
            assertEquals(10, engine.getCursor("marketplace_order").orElseThrow().itemsSynced());
        }
    }
}
