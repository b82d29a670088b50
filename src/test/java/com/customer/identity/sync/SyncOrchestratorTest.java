package com.customer.identity.sync;

import com.customer.identity.core.model.Provider;
import com.customer.identity.core.model.ResolutionAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("SyncOrchestrator Tests")
class SyncOrchestratorTest {

    private final List<String> executed = new ArrayList<>();

    private SyncJob job(String sourceType, Provider provider, SyncMetrics metrics) {
        SyncJob job = mock(SyncJob.class);
        when(job.sourceType()).thenReturn(sourceType);
        when(job.provider()).thenReturn(provider);
        when(job.run()).thenAnswer(invocation -> {
            executed.add(sourceType);
            return new SyncRunResult(sourceType, metrics, 1, true, false, Duration.ZERO);
        });
        return job;
    }

    private static SyncMetrics created(int count) {
        SyncMetrics metrics = new SyncMetrics();
        metrics.recordFetched(count);
        for (int i = 0; i < count; i++) {
            metrics.recordOutcome(ResolutionAction.CREATED);
        }
        return metrics;
    }

    @Test
    @DisplayName("Jobs run in authority order regardless of registration order")
    void authorityOrder() {
        SyncOrchestrator orchestrator = new SyncOrchestrator()
                .register(job("fulfillment_shipment", Provider.FULFILLMENT, created(1)))
                .register(job("marketplace_order", Provider.MARKETPLACE, created(1)))
                .register(job("manual_import", Provider.MANUAL, created(1)))
                .register(job("storefront_customer", Provider.STOREFRONT, created(1)))
                .register(job("accounting_customer", Provider.ACCOUNTING, created(1)));

        orchestrator.runAll();

        assertEquals(List.of("accounting_customer", "storefront_customer", "marketplace_order",
                "fulfillment_shipment", "manual_import"), executed);
    }

    @Test
    @DisplayName("Jobs of the same provider keep their registration order")
    void stableWithinProvider() {
        SyncOrchestrator orchestrator = new SyncOrchestrator()
                .register(job("storefront_order", Provider.STOREFRONT, created(1)))
                .register(job("storefront_customer", Provider.STOREFRONT, created(1)));

        assertEquals(List.of("storefront_order", "storefront_customer"),
                orchestrator.executionOrder().stream().map(SyncJob::sourceType).toList());
    }

    @Test
    @DisplayName("A custom authority order is honored")
    void customOrder() {
        SyncOrchestrator orchestrator = new SyncOrchestrator(List.of(Provider.MARKETPLACE, Provider.ACCOUNTING))
                .register(job("accounting_customer", Provider.ACCOUNTING, created(1)))
                .register(job("marketplace_order", Provider.MARKETPLACE, created(1)));

        orchestrator.runAll();

        assertEquals(List.of("marketplace_order", "accounting_customer"), executed);
    }

    @Test
    @DisplayName("An aborted job is reported and the remaining jobs still run")
    void failureIsolation() {
        SyncJob broken = mock(SyncJob.class);
        when(broken.sourceType()).thenReturn("storefront_customer");
        when(broken.provider()).thenReturn(Provider.STOREFRONT);
        when(broken.run()).thenThrow(new SyncException("storefront_customer", created(3),
                "Sync of storefront_customer aborted: store unavailable", null));

        SyncSummary summary = new SyncOrchestrator()
                .register(job("accounting_customer", Provider.ACCOUNTING, created(2)))
                .register(broken)
                .register(job("marketplace_order", Provider.MARKETPLACE, created(4)))
                .runAll();

        assertTrue(summary.hasFailures());
        assertEquals(List.of("accounting_customer", "marketplace_order"), executed);
        assertEquals(2, summary.results().size());
        assertEquals("Sync of storefront_customer aborted: store unavailable",
                summary.failures().get("storefront_customer"));
        assertEquals(9, summary.totals().getCreated());
    }

    @Test
    @DisplayName("Review is required when any job saw an ambiguous record")
    void reviewRequired() {
        SyncMetrics ambiguous = new SyncMetrics();
        ambiguous.recordOutcome(ResolutionAction.AMBIGUOUS);

        SyncSummary summary = new SyncOrchestrator()
                .register(job("accounting_customer", Provider.ACCOUNTING, created(1)))
                .register(job("marketplace_order", Provider.MARKETPLACE, ambiguous))
                .runAll();

        assertFalse(summary.hasFailures());
        assertTrue(summary.reviewRequired());
        assertEquals(1, summary.totals().getAmbiguous());
    }

    @Test
    @DisplayName("Running with no jobs yields an empty summary")
    void noJobs() {
        SyncSummary summary = new SyncOrchestrator().runAll();

        assertTrue(summary.results().isEmpty());
        assertFalse(summary.hasFailures());
        assertFalse(summary.reviewRequired());
    }

    @Test
    @DisplayName("Null jobs are rejected")
    void nullJob() {
        assertThrows(NullPointerException.class, () -> new SyncOrchestrator().register(null));
    }
}
