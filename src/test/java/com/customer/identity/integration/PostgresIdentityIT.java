package com.customer.identity.integration;

import com.customer.identity.api.CustomerIdentityEngine;
import com.customer.identity.core.model.MatchMethod;
import com.customer.identity.core.model.MatchSignal;
import com.customer.identity.core.model.MergeCandidate;
import com.customer.identity.core.model.Provider;
import com.customer.identity.core.model.ResolutionAction;
import com.customer.identity.merge.DuplicateContactGroup;
import com.customer.identity.merge.MergeResult;
import com.customer.identity.resolver.ResolutionRequest;
import com.customer.identity.resolver.ResolutionResult;
import com.customer.identity.search.SearchMode;
import com.customer.identity.search.SearchResult;
import com.customer.identity.sync.SyncCursor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for resolution, search, merge and cursors against a live PostgreSQL.
 */
@Tag("integration")
class PostgresIdentityIT extends AbstractPostgresIntegrationTest {

    public record PagePosition(String pageToken, long lastId) {}

    private CustomerIdentityEngine engine;

    @BeforeEach
    void setUp() {
        engine = createEngine(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private ResolutionResult resolve(Provider provider, String externalId, String email, String first, String last) {
        return engine.resolve(ResolutionRequest.builder(provider)
                .externalId(externalId)
                .email(email)
                .firstName(first)
                .lastName(last)
                .build());
    }

    private Long ownerOf(String table, String id) {
        try (Connection connection = dataSource().getConnection();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT customer_id FROM " + table + " WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    @DisplayName("Should create, re-resolve and link across providers")
    void testResolution() {
        ResolutionResult created = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe");
        ResolutionResult again = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe");
        ResolutionResult linked = resolve(Provider.ACCOUNTING, "qb_1", "JANE@example.com", null, null);

        assertEquals(ResolutionAction.CREATED, created.action());
        assertEquals(ResolutionAction.UPDATED, again.action());
        assertEquals(created.customerId(), again.customerId());
        assertEquals(ResolutionAction.LINKED, linked.action());
        assertEquals(MatchMethod.EMAIL, linked.matchedBy());
        assertEquals(created.customerId(), linked.customerId());

        assertEquals(2, engine.getCustomerRepository().findIdentities(created.customerId()).size());
        assertEquals(created.customerId(), engine.getCustomerRepository()
                .findIdentity(Provider.ACCOUNTING, "qb_1").orElseThrow().getCustomerId());
    }

    @Test
    @DisplayName("Should keep one search document when two identities of a customer change concurrently")
    void testConcurrentIdentityRefresh() throws Exception {
        long customerId = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe").customerId();
        resolve(Provider.ACCOUNTING, "qb_1", "jane@example.com", null, null);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (Connection first = dataSource().getConnection()) {
            first.setAutoCommit(false);
            try (PreparedStatement ps = first.prepareStatement(
                    "UPDATE customer_identities SET email = ? WHERE provider = ? AND external_id = ?")) {
                ps.setString(1, "jane.store@example.com");
                ps.setString(2, Provider.STOREFRONT.getCode());
                ps.setString(3, "sf_1");
                assertEquals(1, ps.executeUpdate());
            }

            // Blocks on the search document row until the first transaction commits.
            Future<?> second = executor.submit(() -> engine.getCustomerRepository().refreshIdentity(
                    Provider.ACCOUNTING, "qb_1", "jane.books@example.com", null, Map.of()));
            Thread.sleep(300);
            assertFalse(second.isDone());

            first.commit();
            second.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        try (Connection connection = dataSource().getConnection();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT all_emails FROM customer_search_documents WHERE customer_id = ?")) {
            ps.setLong(1, customerId);
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                List<Object> emails = Arrays.asList((Object[]) rs.getArray(1).getArray());
                assertTrue(emails.contains("jane.store@example.com"));
                assertTrue(emails.contains("jane.books@example.com"));
                assertFalse(rs.next());
            }
        }
    }

    @Test
    @DisplayName("Should rank search results through the trigram read model")
    void testRankedSearch() {
        long jane = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe").customerId();
        resolve(Provider.STOREFRONT, "sf_2", "bob@example.com", "Bob", "Stone");

        SearchResult byName = engine.search("jane doe");
        SearchResult byEmail = engine.search("jane@example.com");

        assertEquals(SearchMode.RANKED, byName.mode());
        assertEquals(List.of(jane), byName.customerIds());
        assertEquals(List.of(jane), byEmail.customerIds());
        assertTrue(byName.hits().get(0).linkedProviders().contains(Provider.STOREFRONT));
    }

    @Test
    @DisplayName("Should merge duplicates and re-point referencing rows")
    void testMerge() {
        execute("CREATE TABLE IF NOT EXISTS orders (id TEXT PRIMARY KEY, customer_id BIGINT)");
        execute("TRUNCATE orders");

        long primary = resolve(Provider.STOREFRONT, "sf_1", "jane@example.com", "Jane", "Doe").customerId();
        long duplicate = engine.resolve(ResolutionRequest.builder(Provider.MARKETPLACE)
                .externalId("mp_1")
                .phone("(512) 555-0100")
                .firstName("Jane")
                .lastName("Doe")
                .build()).customerId();
        assertNotEquals(primary, duplicate);
        execute("INSERT INTO orders (id, customer_id) VALUES ('order_1', " + duplicate + ")");

        assertTrue(engine.findMergeCandidates(primary).isEmpty());
        assertEquals(2, engine.search("jane doe").hits().size());

        MergeResult result = engine.mergeCustomers(primary, List.of(duplicate));

        assertTrue(result.isSuccess());
        assertEquals(1, result.counts().customersDeleted());
        assertEquals(1, result.counts().repointedIn("customer_identities"));
        assertEquals(1, result.counts().repointedIn("orders"));
        assertEquals(primary, ownerOf("orders", "order_1"));
        assertTrue(engine.getCustomerRepository().findById(duplicate).isEmpty());
        assertEquals(primary, engine.getCustomerRepository()
                .findIdentity(Provider.MARKETPLACE, "mp_1").orElseThrow().getCustomerId());
        assertEquals(List.of(primary), engine.search("jane doe").customerIds());
    }

    @Test
    @DisplayName("Should report shared contacts as merge candidates and duplicate groups")
    void testDuplicates() {
        long first = engine.resolve(ResolutionRequest.builder(Provider.STOREFRONT)
                .externalId("sf_1").phone("512-555-0100").firstName("Jane").build()).customerId();
        long second = engine.resolve(ResolutionRequest.builder(Provider.MARKETPLACE)
                .externalId("mp_1").email("jane@example.com").firstName("Janie").build()).customerId();
        execute("UPDATE customers SET primary_phone = '+15125550100' WHERE id = " + second);

        List<MergeCandidate> candidates = engine.findMergeCandidates(first);
        List<DuplicateContactGroup> groups = engine.findDuplicateContactGroups(10);

        assertEquals(1, candidates.size());
        assertEquals(second, candidates.get(0).customerId());
        assertTrue(candidates.get(0).matchedOn().contains(MatchSignal.PHONE));
        assertEquals(List.of(new DuplicateContactGroup(MatchSignal.PHONE, "+15125550100", List.of(first, second))),
                groups);
    }

    @Test
    @DisplayName("Should persist structured cursor positions and errors")
    void testCursors() {
        engine.updateCursor("marketplace_order", new PagePosition("tok_1", 100L), 100, null);
        engine.updateCursor("marketplace_order", new PagePosition("tok_2", 200L), 49, "1 of 50 records failed");

        SyncCursor cursor = engine.getCursor("marketplace_order").orElseThrow();
        assertEquals(149, cursor.itemsSynced());
        assertEquals("1 of 50 records failed", cursor.lastError());
        assertNotNull(cursor.lastSuccessAt());
        assertEquals(new PagePosition("tok_2", 200L),
                engine.getCursorValue("marketplace_order", PagePosition.class).orElseThrow());
        assertTrue(engine.health().isDegraded());

        engine.updateCursor("marketplace_order", Map.of("pageToken", "tok_3", "lastId", 300), 50, null);
        assertTrue(engine.health().isUp());
        assertEquals(2, engine.getHealthCheckRegistry().size());
    }
}
