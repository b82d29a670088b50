package com.customer.identity.merge;

import com.customer.identity.api.IdentityOptions;
import com.customer.identity.core.model.MergeCandidate;
import com.customer.identity.logging.LogContext;
import com.customer.identity.metrics.MetricsService;
import com.customer.identity.metrics.NoOpMetricsService;
import com.customer.identity.store.CustomerRepository;
import com.customer.identity.tracing.NoOpTracingService;
import com.customer.identity.tracing.Span;
import com.customer.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Operator-triggered consolidation of duplicate customers.
 *
 * <p>Requests are validated before anything is written: merging a customer into itself, an empty
 * merge set, or an unknown customer id is rejected with a failed {@link MergeResult}. An accepted
 * merge runs as one transaction in the store; listeners are notified after it commits.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final CustomerMergeRepository mergeRepository;
    private final CustomerRepository customerRepository;
    private final List<ReferencingTable> referencingTables;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    public MergeEngine(CustomerMergeRepository mergeRepository, CustomerRepository customerRepository) {
        this(mergeRepository, customerRepository, IdentityOptions.defaults().getReferencingTables(),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public MergeEngine(CustomerMergeRepository mergeRepository, CustomerRepository customerRepository,
                       List<ReferencingTable> referencingTables, MetricsService metricsService,
                       TracingService tracingService) {
        this.mergeRepository = mergeRepository;
        this.customerRepository = customerRepository;
        this.referencingTables = List.copyOf(referencingTables);
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Other customers sharing an email or phone with {@code customerId}. Read-only.
     */
    public List<MergeCandidate> findMergeCandidates(long customerId) {
        return mergeRepository.findMergeCandidates(customerId);
    }

    public List<DuplicateContactGroup> findDuplicateContactGroups(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return mergeRepository.findDuplicateContactGroups(limit);
    }

    /**
     * Merges {@code mergeIds} into {@code primaryId}: every referencing row moves to the primary
     * and the merged customers are deleted, all or nothing.
     */
    public MergeResult mergeCustomers(long primaryId, List<Long> mergeIds) {
        List<Long> losingIds = dedupe(primaryId, mergeIds);

        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(), primaryId);
             Span span = tracingService.startSpan("customer.merge",
                     Map.of("primaryId", Long.toString(primaryId)))) {

            String rejection = validate(primaryId, mergeIds, losingIds);
            if (rejection != null) {
                log.warn("merge.rejected primaryId={} mergeIds={} reason={}", primaryId, mergeIds, rejection);
                metricsService.incrementMergeRejected();
                span.setStatus(Span.SpanStatus.ERROR);
                return MergeResult.failure(primaryId, losingIds, rejection);
            }

            log.info("merge.starting primaryId={} mergeIds={}", primaryId, losingIds);
            MergeCounts counts;
            try {
                counts = mergeRepository.merge(primaryId, losingIds, referencingTables);
            } catch (IllegalStateException e) {
                // A customer disappeared between validation and locking; nothing was changed.
                log.warn("merge.rejected primaryId={} mergeIds={} reason={}", primaryId, losingIds, e.getMessage());
                metricsService.incrementMergeRejected();
                span.setStatus(Span.SpanStatus.ERROR);
                return MergeResult.failure(primaryId, losingIds, e.getMessage());
            } catch (RuntimeException e) {
                log.error("merge.failed primaryId={} mergeIds={} error={}", primaryId, losingIds, e.getMessage());
                span.fail(e);
                throw e;
            }

            span.setAttribute("customersDeleted", counts.customersDeleted());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.incrementMerge(counts.customersDeleted());
            log.info("merge.completed primaryId={} mergeIds={} repointed={} deleted={}",
                    primaryId, losingIds, counts.repointed(), counts.deleted());

            notifyMergeListeners(primaryId, losingIds);
            return MergeResult.success(primaryId, losingIds, counts);
        }
    }

    /**
     * Adds a listener that will be notified after successful merges.
     */
    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    private String validate(long primaryId, List<Long> requested, List<Long> losingIds) {
        if (requested != null && requested.contains(primaryId) && losingIds.isEmpty()) {
            return "Cannot merge customer " + primaryId + " into itself";
        }
        if (losingIds.isEmpty()) {
            return "No customers to merge";
        }
        List<Long> all = new ArrayList<>(losingIds);
        all.add(primaryId);
        Set<Long> existing = customerRepository.findExistingIds(all);
        if (!existing.contains(primaryId)) {
            return "Primary customer not found: " + primaryId;
        }
        List<Long> missing = losingIds.stream().filter(id -> !existing.contains(id)).toList();
        if (!missing.isEmpty()) {
            return "Customers not found: " + missing;
        }
        return null;
    }

    private static List<Long> dedupe(long primaryId, List<Long> mergeIds) {
        if (mergeIds == null) {
            return List.of();
        }
        Set<Long> unique = new LinkedHashSet<>();
        for (Long id : mergeIds) {
            if (id != null && id != primaryId) {
                unique.add(id);
            }
        }
        return List.copyOf(unique);
    }

    private void notifyMergeListeners(long primaryId, List<Long> mergedIds) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(primaryId, mergedIds);
            } catch (RuntimeException e) {
                log.warn("merge.listener_failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
