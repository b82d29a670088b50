package com.customer.identity.store.memory;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.CustomerIdentity;
import com.customer.identity.core.model.MatchSignal;
import com.customer.identity.core.model.MergeCandidate;
import com.customer.identity.core.model.Provider;
import com.customer.identity.merge.CustomerMergeRepository;
import com.customer.identity.merge.DuplicateContactGroup;
import com.customer.identity.merge.MergeCounts;
import com.customer.identity.merge.MergeTransaction;
import com.customer.identity.merge.ReferencingTable;
import com.customer.identity.rules.ContactNormalizer;
import com.customer.identity.search.CandidateQuery;
import com.customer.identity.search.CustomerSearchRepository;
import com.customer.identity.search.QueryType;
import com.customer.identity.search.SearchCandidate;
import com.customer.identity.similarity.JaccardSimilarity;
import com.customer.identity.similarity.TrigramSimilarity;
import com.customer.identity.store.CreateOutcome;
import com.customer.identity.store.CustomerRepository;
import com.customer.identity.store.IdentityWrite;
import com.customer.identity.store.ProfileUpdate;
import com.customer.identity.store.StoreException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store backing all customer repositories. Intended for tests and embedded use.
 * Every public method is synchronized, which gives the same atomicity the JDBC store gets from
 * transactions. Search mirrors the SQL read model: trigram similarity stands in for
 * {@code pg_trgm} and token overlap for {@code ts_rank}.
 *
 * <p>Rows of collaborator tables (orders, tickets, ...) are registered with
 * {@link #linkRecord(String, String, long)} so merges have something to re-point.</p>
 */
public class InMemoryCustomerStore implements CustomerRepository, CustomerSearchRepository, CustomerMergeRepository {

    private static final String IDENTITIES_TABLE = "customer_identities";

    private final Map<Long, Customer> customers = new TreeMap<>();
    private final Map<Long, CustomerIdentity> identities = new TreeMap<>();
    private final Map<String, Map<String, Long>> records = new HashMap<>();
    private final AtomicLong customerSequence = new AtomicLong();
    private final AtomicLong identitySequence = new AtomicLong();
    private final TrigramSimilarity trigram = new TrigramSimilarity();
    private final JaccardSimilarity textRank = new JaccardSimilarity();
    private final Clock clock;

    public InMemoryCustomerStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCustomerStore(Clock clock) {
        this.clock = clock;
    }

    // ========== CustomerRepository ==========

    @Override
    public synchronized Optional<Customer> findById(long customerId) {
        return Optional.ofNullable(customers.get(customerId));
    }

    @Override
    public synchronized Set<Long> findExistingIds(Collection<Long> customerIds) {
        Set<Long> existing = new TreeSet<>();
        for (Long id : customerIds) {
            if (id != null && customers.containsKey(id)) {
                existing.add(id);
            }
        }
        return existing;
    }

    @Override
    public synchronized Optional<CustomerIdentity> findIdentity(Provider provider, String externalId) {
        return identities.values().stream()
                .filter(i -> i.getProvider() == provider && Objects.equals(i.getExternalId(), externalId))
                .findFirst();
    }

    @Override
    public synchronized List<CustomerIdentity> findIdentities(long customerId) {
        return identities.values().stream()
                .filter(i -> i.getCustomerId() == customerId)
                .toList();
    }

    @Override
    public synchronized Set<Long> findCustomerIdsByEmail(String email) {
        Set<Long> ids = new TreeSet<>();
        if (email == null) {
            return ids;
        }
        customers.values().stream()
                .filter(c -> email.equals(lower(c.getPrimaryEmail())))
                .forEach(c -> ids.add(c.getId()));
        identities.values().stream()
                .filter(i -> email.equals(lower(i.getEmail())))
                .forEach(i -> ids.add(i.getCustomerId()));
        return ids;
    }

    @Override
    public synchronized Set<Long> findCustomerIdsByPhone(String phone) {
        Set<Long> ids = new TreeSet<>();
        if (phone == null) {
            return ids;
        }
        customers.values().stream()
                .filter(c -> phone.equals(c.getPrimaryPhone()))
                .forEach(c -> ids.add(c.getId()));
        identities.values().stream()
                .filter(i -> phone.equals(i.getPhone()))
                .forEach(i -> ids.add(i.getCustomerId()));
        return ids;
    }

    @Override
    public synchronized Set<Long> findCustomerIdsByAddressHash(Provider provider, String addressHash) {
        Set<Long> ids = new TreeSet<>();
        identities.values().stream()
                .filter(i -> i.getProvider() == provider && addressHash.equals(i.getAddressHash()))
                .forEach(i -> ids.add(i.getCustomerId()));
        return ids;
    }

    @Override
    public synchronized CreateOutcome createWithIdentity(Customer customer, CustomerIdentity identity,
                                                        List<CustomerIdentity> additionalIdentities) {
        if (identity != null && identity.getExternalId() != null) {
            Optional<CustomerIdentity> winner = findIdentity(identity.getProvider(), identity.getExternalId());
            if (winner.isPresent()) {
                Customer owner = requireCustomer(winner.get().getCustomerId());
                return new CreateOutcome(owner, winner.get(), false);
            }
        }

        Instant now = clock.instant();
        Customer created = Customer.builder(customer)
                .id(customerSequence.incrementAndGet())
                .createdAt(now)
                .updatedAt(now)
                .build();
        customers.put(created.getId(), created);
        if (identity == null) {
            return new CreateOutcome(created, null, true);
        }
        CustomerIdentity stored = insertIdentity(CustomerIdentity.builder(identity)
                .customerId(created.getId()).build());
        for (CustomerIdentity extra : additionalIdentities) {
            if (extra.getExternalId() == null || findIdentity(extra.getProvider(), extra.getExternalId()).isEmpty()) {
                insertIdentity(CustomerIdentity.builder(extra).customerId(created.getId()).build());
            }
        }
        return new CreateOutcome(created, stored, true);
    }

    @Override
    public synchronized IdentityWrite linkIdentity(CustomerIdentity identity) {
        requireCustomer(identity.getCustomerId());
        if (identity.getExternalId() != null) {
            Optional<CustomerIdentity> existing = findIdentity(identity.getProvider(), identity.getExternalId());
            if (existing.isPresent()) {
                return new IdentityWrite(existing.get(), false);
            }
            return new IdentityWrite(insertIdentity(identity), true);
        }

        Optional<CustomerIdentity> keyless = identities.values().stream()
                .filter(i -> i.getCustomerId() == identity.getCustomerId()
                        && i.getProvider() == identity.getProvider()
                        && i.getExternalId() == null
                        && Objects.equals(i.getEmail(), identity.getEmail())
                        && Objects.equals(i.getPhone(), identity.getPhone()))
                .findFirst();
        if (keyless.isPresent()) {
            CustomerIdentity refreshed = CustomerIdentity.builder(keyless.get())
                    .metadata(mergeMetadata(keyless.get().getMetadata(), identity.getMetadata()))
                    .updatedAt(clock.instant())
                    .build();
            identities.put(refreshed.getId(), refreshed);
            return new IdentityWrite(refreshed, false);
        }
        return new IdentityWrite(insertIdentity(identity), true);
    }

    @Override
    public synchronized CustomerIdentity refreshIdentity(Provider provider, String externalId,
                                                         String email, String phone, Map<String, Object> metadata) {
        CustomerIdentity current = findIdentity(provider, externalId)
                .orElseThrow(() -> new StoreException("Identity not found: " + provider.getCode() + "/" + externalId));
        CustomerIdentity refreshed = CustomerIdentity.builder(current)
                .email(email != null ? email : current.getEmail())
                .phone(phone != null ? phone : current.getPhone())
                .metadata(mergeMetadata(current.getMetadata(), metadata))
                .updatedAt(clock.instant())
                .build();
        identities.put(refreshed.getId(), refreshed);
        return refreshed;
    }

    @Override
    public synchronized Customer updateProfile(long customerId, ProfileUpdate update, ProfileUpdate.Mode mode) {
        Customer current = requireCustomer(customerId);
        boolean refresh = mode == ProfileUpdate.Mode.REFRESH;
        Customer updated = Customer.builder(current)
                .firstName(pick(current.getFirstName(), update.firstName(), refresh))
                .lastName(pick(current.getLastName(), update.lastName(), refresh))
                .company(pick(current.getCompany(), update.company(), refresh))
                .primaryEmail(pick(current.getPrimaryEmail(), update.email(), false))
                .primaryPhone(pick(current.getPrimaryPhone(), update.phone(), false))
                .updatedAt(clock.instant())
                .build();
        customers.put(customerId, updated);
        return updated;
    }

    // ========== Collaborator tables ==========

    /**
     * Registers (or re-points) a row of a collaborator table, e.g. an order, as owned by a customer.
     */
    public synchronized void linkRecord(String table, String recordId, long customerId) {
        requireCustomer(customerId);
        records.computeIfAbsent(table, t -> new LinkedHashMap<>()).put(recordId, customerId);
    }

    public synchronized Optional<Long> findRecordOwner(String table, String recordId) {
        Map<String, Long> rows = records.get(table);
        return rows == null ? Optional.empty() : Optional.ofNullable(rows.get(recordId));
    }

    public synchronized int customerCount() {
        return customers.size();
    }

    public synchronized int identityCount() {
        return identities.size();
    }

    // ========== CustomerSearchRepository ==========

    @Override
    public synchronized List<SearchCandidate> findCandidates(CandidateQuery query) {
        record Hit(SearchCandidate candidate, boolean exact, double nameSimilarity) {}

        List<Hit> hits = new ArrayList<>();
        for (Customer customer : customers.values()) {
            Set<String> emails = emailsOf(customer);
            Set<String> phoneKeys = phoneKeysOf(customer);
            String name = customer.getFullName().toLowerCase(Locale.ROOT);
            String company = lower(customer.getCompany());

            boolean exact = (!query.email().isEmpty() && emails.contains(query.email()))
                    || (!query.phoneKey().isEmpty() && phoneKeys.contains(query.phoneKey()));
            double nameSimilarity = trigram.compute(name, query.text());
            double companySimilarity = company != null ? trigram.compute(company, query.text()) : 0.0;
            double rank = fullTextRank(customer, query);

            if (exact || nameSimilarity >= query.trigramThreshold()
                    || companySimilarity >= query.trigramThreshold() || rank > 0.0) {
                hits.add(new Hit(new SearchCandidate(customer, List.copyOf(emails), List.copyOf(phoneKeys),
                        providersOf(customer.getId()), rank), exact, nameSimilarity));
            }
        }

        return hits.stream()
                .sorted(Comparator.comparing(Hit::exact).reversed()
                        .thenComparing(Comparator.comparingDouble(Hit::nameSimilarity).reversed())
                        .thenComparing((Hit h) -> h.candidate().customer().getId(), Comparator.reverseOrder()))
                .limit(query.candidateLimit())
                .map(Hit::candidate)
                .toList();
    }

    @Override
    public synchronized List<SearchCandidate> substringSearch(QueryType type, String term, int limit) {
        String needle = term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
        String phoneNeedle = ContactNormalizer.phoneKey(needle);

        List<Customer> matches = new ArrayList<>();
        for (Customer customer : customers.values()) {
            boolean match = switch (type) {
                case EMAIL -> emailsOf(customer).stream().anyMatch(e -> e.contains(needle));
                case PHONE -> phoneKeysOf(customer).stream().anyMatch(k -> k.contains(phoneNeedle));
                case NAME -> contains(customer.getFirstName(), needle)
                        || contains(customer.getLastName(), needle)
                        || customer.getFullName().toLowerCase(Locale.ROOT).contains(needle)
                        || contains(customer.getCompany(), needle);
            };
            if (match) {
                matches.add(customer);
            }
        }

        Comparator<Customer> order = Comparator.<Customer>comparingInt(c -> substringStrength(c, needle))
                .thenComparing(Customer::isVip, Comparator.reverseOrder())
                .thenComparing(Customer::getUpdatedAt, Comparator.reverseOrder())
                .thenComparing(Customer::getId, Comparator.reverseOrder());

        return matches.stream()
                .sorted(order)
                .limit(limit)
                .map(c -> new SearchCandidate(c, List.of(), List.of(), providersOf(c.getId()), 0.0))
                .toList();
    }

    // ========== CustomerMergeRepository ==========

    @Override
    public synchronized List<MergeCandidate> findMergeCandidates(long customerId) {
        Customer primary = customers.get(customerId);
        if (primary == null) {
            return List.of();
        }
        Set<String> emails = new LinkedHashSet<>();
        Set<String> phones = new LinkedHashSet<>();
        collectContacts(primary, emails, phones);

        List<MergeCandidate> candidates = new ArrayList<>();
        for (Customer other : customers.values()) {
            if (other.getId() == customerId) {
                continue;
            }
            Set<String> otherEmails = new LinkedHashSet<>();
            Set<String> otherPhones = new LinkedHashSet<>();
            collectContacts(other, otherEmails, otherPhones);

            Set<MatchSignal> matchedOn = EnumSet.noneOf(MatchSignal.class);
            if (otherEmails.stream().anyMatch(emails::contains)) {
                matchedOn.add(MatchSignal.EMAIL);
            }
            if (otherPhones.stream().anyMatch(phones::contains)) {
                matchedOn.add(MatchSignal.PHONE);
            }
            if (!matchedOn.isEmpty()) {
                candidates.add(new MergeCandidate(other, matchedOn));
            }
        }
        return candidates;
    }

    @Override
    public synchronized MergeCounts merge(long primaryId, List<Long> losingIds, List<ReferencingTable> tables) {
        List<Long> all = new ArrayList<>(losingIds);
        all.add(primaryId);
        if (!customers.keySet().containsAll(all)) {
            throw new IllegalStateException("Customers changed before merge could lock them: expected "
                    + all + " but found " + findExistingIds(all));
        }

        Map<String, Integer> repointed = new LinkedHashMap<>();
        Map<String, Integer> deleted = new LinkedHashMap<>();
        Set<Long> losers = new LinkedHashSet<>(losingIds);

        try (MergeTransaction tx = new MergeTransaction("merge " + primaryId + " <- " + losers)) {
            for (ReferencingTable table : tables) {
                if (IDENTITIES_TABLE.equals(table.table())) {
                    Map<Long, CustomerIdentity> before = new LinkedHashMap<>(identities);
                    tx.execute("repoint " + IDENTITIES_TABLE,
                            () -> repointed.put(IDENTITIES_TABLE, repointIdentities(primaryId, losers)),
                            () -> restoreIdentities(before));
                    continue;
                }
                Map<String, Long> rows = records.get(table.table());
                if (rows == null) {
                    continue;
                }
                Map<String, Long> before = new LinkedHashMap<>(rows);
                tx.execute("repoint " + table.table(),
                        () -> repointRows(table, rows, primaryId, losers, repointed, deleted),
                        () -> {
                            rows.clear();
                            rows.putAll(before);
                        });
            }

            Map<Long, Customer> removed = new LinkedHashMap<>();
            Customer primaryBefore = customers.get(primaryId);
            tx.execute("delete merged customers",
                    () -> {
                        customers.put(primaryId, Customer.builder(primaryBefore).updatedAt(clock.instant()).build());
                        for (Long id : losers) {
                            removed.put(id, customers.remove(id));
                        }
                    },
                    () -> {
                        customers.put(primaryId, primaryBefore);
                        customers.putAll(removed);
                    });
            tx.markSuccess();
            return new MergeCounts(repointed, deleted, removed.size());
        }
    }

    @Override
    public synchronized List<DuplicateContactGroup> findDuplicateContactGroups(int limit) {
        Map<String, List<Long>> byEmail = new TreeMap<>();
        Map<String, List<Long>> byPhone = new TreeMap<>();
        for (Customer customer : customers.values()) {
            String email = lower(customer.getPrimaryEmail());
            if (email != null) {
                byEmail.computeIfAbsent(email, e -> new ArrayList<>()).add(customer.getId());
            }
            if (customer.getPrimaryPhone() != null) {
                byPhone.computeIfAbsent(customer.getPrimaryPhone(), p -> new ArrayList<>()).add(customer.getId());
            }
        }

        List<DuplicateContactGroup> groups = new ArrayList<>();
        byEmail.forEach((value, ids) -> {
            if (ids.size() > 1) {
                groups.add(new DuplicateContactGroup(MatchSignal.EMAIL, value, ids));
            }
        });
        byPhone.forEach((value, ids) -> {
            if (ids.size() > 1) {
                groups.add(new DuplicateContactGroup(MatchSignal.PHONE, value, ids));
            }
        });
        return groups.stream().limit(limit).toList();
    }

    // ========== Internals ==========

    private CustomerIdentity insertIdentity(CustomerIdentity identity) {
        Instant now = clock.instant();
        CustomerIdentity stored = CustomerIdentity.builder(identity)
                .id(identitySequence.incrementAndGet())
                .createdAt(now)
                .updatedAt(now)
                .build();
        identities.put(stored.getId(), stored);
        return stored;
    }

    private int repointIdentities(long primaryId, Set<Long> losers) {
        int moved = 0;
        for (CustomerIdentity identity : List.copyOf(identities.values())) {
            if (losers.contains(identity.getCustomerId())) {
                identities.put(identity.getId(), CustomerIdentity.builder(identity).customerId(primaryId).build());
                moved++;
            }
        }
        return moved;
    }

    private void restoreIdentities(Map<Long, CustomerIdentity> before) {
        identities.clear();
        identities.putAll(before);
    }

    private static void repointRows(ReferencingTable table, Map<String, Long> rows, long primaryId, Set<Long> losers,
                                    Map<String, Integer> repointed, Map<String, Integer> deleted) {
        List<String> loserRows = rows.entrySet().stream()
                .filter(e -> losers.contains(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();

        if (!table.onePerCustomer()) {
            loserRows.forEach(id -> rows.put(id, primaryId));
            repointed.put(table.table(), loserRows.size());
            return;
        }

        boolean primaryHasRow = rows.containsValue(primaryId);
        int moved = 0;
        int removed = 0;
        for (String id : loserRows) {
            if (!primaryHasRow && moved == 0) {
                rows.put(id, primaryId);
                moved++;
            } else {
                rows.remove(id);
                removed++;
            }
        }
        repointed.put(table.table(), moved);
        deleted.put(table.table(), removed);
    }

    private void collectContacts(Customer customer, Set<String> emails, Set<String> phones) {
        addIfPresent(emails, lower(customer.getPrimaryEmail()));
        addIfPresent(phones, customer.getPrimaryPhone());
        for (CustomerIdentity identity : identities.values()) {
            if (identity.getCustomerId() == customer.getId()) {
                addIfPresent(emails, lower(identity.getEmail()));
                addIfPresent(phones, identity.getPhone());
            }
        }
    }

    private Set<String> emailsOf(Customer customer) {
        Set<String> emails = new LinkedHashSet<>();
        collectContacts(customer, emails, new LinkedHashSet<>());
        return emails;
    }

    private Set<String> phoneKeysOf(Customer customer) {
        Set<String> phones = new LinkedHashSet<>();
        collectContacts(customer, new LinkedHashSet<>(), phones);
        Set<String> keys = new LinkedHashSet<>();
        phones.forEach(p -> addIfPresent(keys, ContactNormalizer.phoneKey(p)));
        return keys;
    }

    private Set<Provider> providersOf(long customerId) {
        Set<Provider> providers = EnumSet.noneOf(Provider.class);
        identities.values().stream()
                .filter(i -> i.getCustomerId() == customerId)
                .forEach(i -> providers.add(i.getProvider()));
        return providers;
    }

    /**
     * Token overlap between the query and the customer's searchable text, provided every query
     * token occurs in that text; 0 otherwise.
     */
    private double fullTextRank(Customer customer, CandidateQuery query) {
        if (query.tokens().isEmpty()) {
            return 0.0;
        }
        String document = String.join(" ", nonNull(customer.getFirstName()), nonNull(customer.getLastName()),
                nonNull(customer.getCompany()), nonNull(customer.getPrimaryEmail())).toLowerCase(Locale.ROOT);
        Set<String> documentTokens = new HashSet<>(Arrays.asList(document.split("\\s+")));
        if (!documentTokens.containsAll(query.tokens())) {
            return 0.0;
        }
        return textRank.compute(document, query.text());
    }

    private static int substringStrength(Customer customer, String needle) {
        if (needle.equals(lower(customer.getPrimaryEmail()))) {
            return 0;
        }
        if (contains(customer.getFirstName(), needle)) {
            return 1;
        }
        if (contains(customer.getLastName(), needle)) {
            return 2;
        }
        return 3;
    }

    private Customer requireCustomer(long customerId) {
        Customer customer = customers.get(customerId);
        if (customer == null) {
            throw new StoreException("Customer not found: " + customerId);
        }
        return customer;
    }

    private static Map<String, Object> mergeMetadata(Map<String, Object> current, Map<String, Object> update) {
        Map<String, Object> merged = new LinkedHashMap<>(current);
        if (update != null) {
            merged.putAll(update);
        }
        return merged;
    }

    private static String pick(String current, String supplied, boolean replace) {
        if (supplied == null) {
            return current;
        }
        if (replace || current == null) {
            return supplied;
        }
        return current;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static void addIfPresent(Set<String> target, String value) {
        if (value != null && !value.isEmpty()) {
            target.add(value);
        }
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }
}
