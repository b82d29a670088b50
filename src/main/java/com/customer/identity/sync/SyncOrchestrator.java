package com.customer.identity.sync;

import com.customer.identity.core.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs sync jobs one after another in authority order, so that sources carrying the most complete
 * customer data create customers before PII-poor sources try to link against them.
 *
 * <p>The order is a policy, not a correctness requirement: running out of order only lowers the
 * match rate. A job that aborts is recorded and the remaining jobs still run.</p>
 */
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    public static final List<Provider> DEFAULT_AUTHORITY_ORDER = List.of(
            Provider.ACCOUNTING, Provider.STOREFRONT, Provider.MARKETPLACE, Provider.FULFILLMENT);

    private final List<Provider> authorityOrder;
    private final List<SyncJob> jobs = new ArrayList<>();

    public SyncOrchestrator() {
        this(DEFAULT_AUTHORITY_ORDER);
    }

    public SyncOrchestrator(List<Provider> authorityOrder) {
        this.authorityOrder = List.copyOf(authorityOrder);
    }

    public SyncOrchestrator register(SyncJob job) {
        jobs.add(Objects.requireNonNull(job, "job is required"));
        return this;
    }

    /**
     * Jobs in execution order: by the rank of their provider, unranked providers last, ties in
     * registration order.
     */
    public List<SyncJob> executionOrder() {
        List<SyncJob> ordered = new ArrayList<>(jobs);
        ordered.sort(Comparator.comparingInt((SyncJob job) -> rank(job.provider())));
        return ordered;
    }

    public SyncSummary runAll() {
        List<SyncRunResult> results = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        SyncMetrics totals = new SyncMetrics();

        for (SyncJob job : executionOrder()) {
            try {
                SyncRunResult result = job.run();
                results.add(result);
                totals.add(result.metrics());
            } catch (SyncException e) {
                failures.put(job.sourceType(), e.getMessage());
                totals.add(e.getPartialMetrics());
                log.error("sync.job_failed sourceType={} error={}", job.sourceType(), e.getMessage());
            }
        }

        log.info("sync.all_completed jobs={} failed={} totals={}", jobs.size(), failures.size(), totals.toMap());
        return new SyncSummary(results, failures, totals);
    }

    private int rank(Provider provider) {
        int index = authorityOrder.indexOf(provider);
        return index >= 0 ? index : authorityOrder.size();
    }
}
