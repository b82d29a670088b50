package com.customer.identity.resolver;

import com.customer.identity.address.AddressFingerprinter;
import com.customer.identity.api.IdentityOptions;
import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.CustomerIdentity;
import com.customer.identity.core.model.MatchMethod;
import com.customer.identity.core.model.Provider;
import com.customer.identity.logging.LogContext;
import com.customer.identity.metrics.MetricsService;
import com.customer.identity.metrics.NoOpMetricsService;
import com.customer.identity.rules.ContactNormalizer;
import com.customer.identity.store.CreateOutcome;
import com.customer.identity.store.CustomerRepository;
import com.customer.identity.store.IdentityWrite;
import com.customer.identity.store.ProfileUpdate;
import com.customer.identity.tracing.NoOpTracingService;
import com.customer.identity.tracing.Span;
import com.customer.identity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Decides, for every inbound provider record, whether it belongs to a known customer, a new
 * customer, or is ambiguous.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>Exact identity hit on {@code (provider, externalId)}, or on the synthetic
 *       {@code address_hash:<hash>} key when the record has no external id: {@code UPDATED}.</li>
 *   <li>Customers with the same email; only when none exist, customers with the same phone.</li>
 *   <li>When a known external id missed and neither email nor phone matched, identities of the same
 *       provider carrying the same address fingerprint.</li>
 *   <li>No candidate: {@code CREATED}. One: {@code LINKED}. Several: {@code AMBIGUOUS} with no
 *       write at all.</li>
 * </ol>
 *
 * <p>The resolver is stateless. Concurrent first sightings of the same identity key converge on
 * the database's unique index; concurrent first sightings through email or phone alone may create
 * two customers, which {@code findDuplicateContactGroups} surfaces for review.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final String ADDRESS_HASH_KEY = "addressHash";
    static final String HAS_EMAIL_KEY = "hasEmail";

    private final CustomerRepository repository;
    private final AddressFingerprinter fingerprinter;
    private final IdentityOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final List<ResolutionListener> resolutionListeners = new CopyOnWriteArrayList<>();

    public IdentityResolver(CustomerRepository repository) {
        this(repository, new AddressFingerprinter(), IdentityOptions.defaults(),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public IdentityResolver(CustomerRepository repository, AddressFingerprinter fingerprinter,
                            IdentityOptions options, MetricsService metricsService,
                            TracingService tracingService) {
        this.repository = repository;
        this.fingerprinter = fingerprinter;
        this.options = options;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Resolves one record. Ambiguity is reported in the result, never thrown; store failures
     * propagate as {@link com.customer.identity.store.StoreException}.
     */
    public ResolutionResult resolve(ResolutionRequest request) {
        long startNanos = System.nanoTime();
        Provider provider = request.getProvider();

        try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(), provider.getCode());
             Span span = tracingService.startSpan("customer.resolve", Map.of("provider", provider.getCode()))) {
            try {
                ResolutionResult result = doResolve(NormalizedRecord.of(request, fingerprinter));
                span.setAttribute("action", result.action().name());
                span.setAttribute("matchedBy", result.matchedBy().name());
                if (result.customerId() != null) {
                    span.setAttribute("customerId", result.customerId());
                }
                span.setStatus(Span.SpanStatus.OK);

                metricsService.recordResolution(provider, result.action(),
                        Duration.ofNanos(System.nanoTime() - startNanos));
                if (result.isAmbiguous()) {
                    log.warn("customer.ambiguous provider={} matchedBy={} candidates={}",
                            provider.getCode(), result.matchedBy(), result.ambiguousCustomerIds());
                } else {
                    log.info("customer.resolved provider={} action={} customerId={} matchedBy={}",
                            provider.getCode(), result.action(), result.customerId(), result.matchedBy());
                    notifyResolutionListeners(result);
                }
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("customer.resolve_failed provider={} request={} error={}",
                        provider.getCode(), request, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Adds a listener that will be notified after every resolution that wrote to the store.
     */
    public void addResolutionListener(ResolutionListener listener) {
        if (listener != null) {
            resolutionListeners.add(listener);
        }
    }

    private void notifyResolutionListeners(ResolutionResult result) {
        for (ResolutionListener listener : resolutionListeners) {
            try {
                listener.onResolved(result);
            } catch (RuntimeException e) {
                log.warn("customer.listener_failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private ResolutionResult doResolve(NormalizedRecord record) {
        // Step 1: Exact identity hit on the external id, or on the address key when there is none
        if (record.identityKey() != null) {
            Optional<CustomerIdentity> existing = repository.findIdentity(record.provider(), record.identityKey());
            if (existing.isPresent()) {
                return refresh(existing.get(), record);
            }
        }

        // Step 2: Email, then phone
        MatchMethod method = MatchMethod.EMAIL;
        Set<Long> candidates = record.email() != null ? repository.findCustomerIdsByEmail(record.email()) : Set.of();
        if (candidates.isEmpty() && record.phone() != null) {
            method = MatchMethod.PHONE;
            candidates = repository.findCustomerIdsByPhone(record.phone());
        }

        // Step 3: A new external id whose shipping address is already known under this provider
        if (candidates.isEmpty() && record.externalId() != null && record.addressHash() != null
                && options.isAddressLinkingEnabled()) {
            method = MatchMethod.ADDRESS_HASH;
            candidates = repository.findCustomerIdsByAddressHash(record.provider(), record.addressHash());
        }

        // Step 4: Decide
        if (candidates.size() > 1) {
            return ResolutionResult.ambiguous(List.copyOf(candidates), method);
        }
        if (candidates.size() == 1) {
            return link(candidates.iterator().next(), method, record);
        }
        return create(record);
    }

    private ResolutionResult refresh(CustomerIdentity identity, NormalizedRecord record) {
        CustomerIdentity refreshed = repository.refreshIdentity(identity.getProvider(), identity.getExternalId(),
                record.email(), record.phone(), record.metadata());
        repository.updateProfile(refreshed.getCustomerId(), record.profile(), ProfileUpdate.Mode.REFRESH);
        return ResolutionResult.updated(refreshed.getCustomerId(), record.keyMethod());
    }

    private ResolutionResult link(long customerId, MatchMethod method, NormalizedRecord record) {
        IdentityWrite write = repository.linkIdentity(record.toIdentity(customerId));
        if (!write.inserted() && write.identity().getExternalId() != null) {
            // The key was claimed concurrently; the record belongs to whoever owns it now.
            log.debug("identity.link_conflict provider={} externalId={} owner={}",
                    record.provider().getCode(), record.identityKey(), write.identity().getCustomerId());
            return refresh(write.identity(), record);
        }
        repository.updateProfile(customerId, record.profile(), ProfileUpdate.Mode.FILL_MISSING);
        return ResolutionResult.linked(customerId, method);
    }

    private ResolutionResult create(NormalizedRecord record) {
        Customer customer = Customer.builder()
                .primaryEmail(record.email())
                .primaryPhone(record.phone())
                .firstName(record.firstName())
                .lastName(record.lastName())
                .company(record.company())
                .build();

        // The identity table requires an external id, email or phone.
        CustomerIdentity identity = record.hasStorableSignal() ? record.toIdentity(0L) : null;
        if (identity == null) {
            log.debug("customer.create_without_identity provider={}", record.provider().getCode());
        }

        // A keyed record with an address also claims the address key, so later address-only records hit it.
        List<CustomerIdentity> additional = identity != null && record.externalId() != null
                && record.addressHash() != null ? List.of(record.toAddressKeyIdentity(0L)) : List.of();
        CreateOutcome outcome = repository.createWithIdentity(customer, identity, additional);
        if (!outcome.created()) {
            return refresh(outcome.identity(), record);
        }
        return ResolutionResult.created(outcome.customer().getId());
    }

    /**
     * The request after normalization, with the identity key and metadata derived from it.
     */
    record NormalizedRecord(
            Provider provider,
            String externalId,
            String addressHash,
            String email,
            String phone,
            String firstName,
            String lastName,
            String company,
            Map<String, Object> metadata
    ) {

        static NormalizedRecord of(ResolutionRequest request, AddressFingerprinter fingerprinter) {
            String email = ContactNormalizer.normalizeEmail(request.getEmail());
            String phone = ContactNormalizer.normalizePhone(request.getPhone());
            String addressHash = request.getAddress() != null
                    ? fingerprinter.fingerprint(request.getAddress()).orElse(null) : null;

            Map<String, Object> metadata = new LinkedHashMap<>(request.getMetadata());
            if (addressHash != null) {
                metadata.put(ADDRESS_HASH_KEY, addressHash);
            }
            metadata.put(HAS_EMAIL_KEY, email != null);

            return new NormalizedRecord(request.getProvider(), clean(request.getExternalId()), addressHash,
                    email, phone, clean(request.getFirstName()), clean(request.getLastName()),
                    clean(request.getCompany()), metadata);
        }

        /**
         * Unique key of the identity: the external id, else the synthetic address key, else none.
         */
        String identityKey() {
            if (externalId != null) {
                return externalId;
            }
            return addressHash != null ? CustomerIdentity.ADDRESS_HASH_PREFIX + addressHash : null;
        }

        MatchMethod keyMethod() {
            return externalId != null ? MatchMethod.EXTERNAL_ID : MatchMethod.ADDRESS_HASH;
        }

        boolean hasStorableSignal() {
            return identityKey() != null || email != null || phone != null;
        }

        ProfileUpdate profile() {
            return new ProfileUpdate(email, phone, firstName, lastName, company);
        }

        CustomerIdentity toIdentity(long customerId) {
            return CustomerIdentity.builder()
                    .customerId(customerId)
                    .provider(provider)
                    .externalId(identityKey())
                    .email(email)
                    .phone(phone)
                    .metadata(metadata)
                    .build();
        }

        CustomerIdentity toAddressKeyIdentity(long customerId) {
            return CustomerIdentity.builder()
                    .customerId(customerId)
                    .provider(provider)
                    .externalId(CustomerIdentity.ADDRESS_HASH_PREFIX + addressHash)
                    .metadata(Map.of(ADDRESS_HASH_KEY, addressHash, HAS_EMAIL_KEY, email != null))
                    .build();
        }

        private static String clean(String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
