package com.customer.identity.store.jdbc;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.CustomerIdentity;
import com.customer.identity.core.model.Provider;
import com.customer.identity.store.CreateOutcome;
import com.customer.identity.store.CustomerRepository;
import com.customer.identity.store.IdentityWrite;
import com.customer.identity.store.ProfileUpdate;
import com.customer.identity.store.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Types;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.customer.identity.store.jdbc.CustomerRows.CUSTOMER_COLUMNS;
import static com.customer.identity.store.jdbc.CustomerRows.IDENTITY_COLUMNS;

/**
 * PostgreSQL implementation of {@link CustomerRepository}.
 * Identity keys are protected by the partial unique index on
 * {@code customer_identities (provider, external_id)}; concurrent first sightings of the same key
 * converge through {@code ON CONFLICT DO NOTHING}.
 */
public class JdbcCustomerRepository implements CustomerRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcCustomerRepository.class);

    private static final String RETURNING_CUSTOMER = """
            RETURNING id, primary_email, primary_phone, first_name, last_name, company,
                      is_vip, credit_risk_level, created_at, updated_at""";

    private static final String RETURNING_IDENTITY = """
            RETURNING id, customer_id, provider, external_id, email, phone, metadata::text AS metadata,
                      created_at, updated_at""";

    private static final RowMapper<Customer> CUSTOMER = (rs, rowNum) -> CustomerRows.customer(rs);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper mapper;
    private final RowMapper<CustomerIdentity> identityMapper;

    public JdbcCustomerRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                  ObjectMapper mapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.mapper = mapper;
        this.identityMapper = (rs, rowNum) -> CustomerRows.identity(rs, mapper);
    }

    // ========== Lookups ==========

    @Override
    public Optional<Customer> findById(long customerId) {
        return DataAccessGuard.call("findCustomer", () -> selectCustomer(customerId));
    }

    @Override
    public Set<Long> findExistingIds(Collection<Long> customerIds) {
        if (customerIds.isEmpty()) {
            return Set.of();
        }
        return DataAccessGuard.call("findExistingIds", () -> new TreeSet<>(jdbcTemplate.query(
                "SELECT id FROM customers WHERE id = ANY(?)",
                ps -> ps.setArray(1, CustomerRows.bigintArray(ps, customerIds)),
                (rs, rowNum) -> rs.getLong("id"))));
    }

    @Override
    public Optional<CustomerIdentity> findIdentity(Provider provider, String externalId) {
        return DataAccessGuard.call("findIdentity", () -> selectIdentity(provider, externalId));
    }

    @Override
    public List<CustomerIdentity> findIdentities(long customerId) {
        String sql = "SELECT " + IDENTITY_COLUMNS + """

                FROM customer_identities i
                WHERE i.customer_id = ?
                ORDER BY i.id
                """;
        return DataAccessGuard.call("findIdentities",
                () -> jdbcTemplate.query(sql, ps -> ps.setLong(1, customerId), identityMapper));
    }

    @Override
    public Set<Long> findCustomerIdsByEmail(String email) {
        String sql = """
                SELECT id AS customer_id FROM customers WHERE lower(primary_email) = ?
                UNION
                SELECT customer_id FROM customer_identities WHERE lower(email) = ?
                """;
        return DataAccessGuard.call("findCustomerIdsByEmail", () -> new TreeSet<>(jdbcTemplate.query(sql, ps -> {
            ps.setString(1, email);
            ps.setString(2, email);
        }, (rs, rowNum) -> rs.getLong("customer_id"))));
    }

    @Override
    public Set<Long> findCustomerIdsByPhone(String phone) {
        String sql = """
                SELECT id AS customer_id FROM customers WHERE primary_phone = ?
                UNION
                SELECT customer_id FROM customer_identities WHERE phone = ?
                """;
        return DataAccessGuard.call("findCustomerIdsByPhone", () -> new TreeSet<>(jdbcTemplate.query(sql, ps -> {
            ps.setString(1, phone);
            ps.setString(2, phone);
        }, (rs, rowNum) -> rs.getLong("customer_id"))));
    }

    @Override
    public Set<Long> findCustomerIdsByAddressHash(Provider provider, String addressHash) {
        String sql = """
                SELECT DISTINCT customer_id
                FROM customer_identities
                WHERE provider = ?
                  AND (external_id = ? OR metadata->>'addressHash' = ?)
                """;
        return DataAccessGuard.call("findCustomerIdsByAddressHash",
                () -> new TreeSet<>(jdbcTemplate.query(sql, ps -> {
                    ps.setString(1, provider.getCode());
                    ps.setString(2, CustomerIdentity.ADDRESS_HASH_PREFIX + addressHash);
                    ps.setString(3, addressHash);
                }, (rs, rowNum) -> rs.getLong("customer_id"))));
    }

    // ========== Writes ==========

    @Override
    public CreateOutcome createWithIdentity(Customer customer, CustomerIdentity identity,
                                            List<CustomerIdentity> additionalIdentities) {
        return DataAccessGuard.call("createWithIdentity", () -> transactionTemplate.execute(status -> {
            Customer created = insertCustomer(customer);
            if (identity == null) {
                return new CreateOutcome(created, null, true);
            }

            Optional<CustomerIdentity> inserted = insertIdentity(
                    CustomerIdentity.builder(identity).customerId(created.getId()).build());
            if (inserted.isPresent()) {
                for (CustomerIdentity extra : additionalIdentities) {
                    insertIdentity(CustomerIdentity.builder(extra).customerId(created.getId()).build());
                }
                return new CreateOutcome(created, inserted.get(), true);
            }

            // Another writer claimed (provider, externalId) first; our customer row is discarded.
            status.setRollbackOnly();
            log.info("identity.create_conflict provider={} externalId={}",
                    identity.getProvider().getCode(), identity.getExternalId());
            CustomerIdentity winner = selectIdentity(identity.getProvider(), identity.getExternalId())
                    .orElseThrow(() -> new StoreException("Conflicting identity vanished: "
                            + identity.getProvider().getCode() + "/" + identity.getExternalId()));
            Customer owner = selectCustomer(winner.getCustomerId())
                    .orElseThrow(() -> new StoreException("Owner of identity " + winner.getId() + " not found"));
            return new CreateOutcome(owner, winner, false);
        }));
    }

    @Override
    public IdentityWrite linkIdentity(CustomerIdentity identity) {
        return DataAccessGuard.call("linkIdentity", () -> transactionTemplate.execute(status -> {
            if (identity.getExternalId() != null) {
                Optional<CustomerIdentity> inserted = insertIdentity(identity);
                if (inserted.isPresent()) {
                    return new IdentityWrite(inserted.get(), true);
                }
                CustomerIdentity existing = selectIdentity(identity.getProvider(), identity.getExternalId())
                        .orElseThrow(() -> new StoreException("Conflicting identity vanished: "
                                + identity.getProvider().getCode() + "/" + identity.getExternalId()));
                return new IdentityWrite(existing, false);
            }

            Optional<CustomerIdentity> keyless = selectKeylessIdentity(identity);
            if (keyless.isPresent()) {
                String sql = """
                        UPDATE customer_identities
                        SET metadata = metadata || ?::jsonb, updated_at = now()
                        WHERE id = ?
                        """ + RETURNING_IDENTITY;
                CustomerIdentity refreshed = first(jdbcTemplate.query(sql, ps -> {
                    ps.setString(1, CustomerRows.writeJson(mapper, identity.getMetadata()));
                    ps.setLong(2, keyless.get().getId());
                }, identityMapper)).orElseThrow();
                return new IdentityWrite(refreshed, false);
            }
            return new IdentityWrite(insertIdentity(identity).orElseThrow(), true);
        }));
    }

    @Override
    public CustomerIdentity refreshIdentity(Provider provider, String externalId,
                                            String email, String phone, Map<String, Object> metadata) {
        String sql = """
                UPDATE customer_identities
                SET email = COALESCE(?::text, email),
                    phone = COALESCE(?::text, phone),
                    metadata = metadata || ?::jsonb,
                    updated_at = now()
                WHERE provider = ? AND external_id = ?
                """ + RETURNING_IDENTITY;
        return DataAccessGuard.call("refreshIdentity", () -> first(jdbcTemplate.query(sql, ps -> {
            ps.setString(1, email);
            ps.setString(2, phone);
            ps.setString(3, CustomerRows.writeJson(mapper, metadata != null ? metadata : Map.of()));
            ps.setString(4, provider.getCode());
            ps.setString(5, externalId);
        }, identityMapper))).orElseThrow(() -> new StoreException(
                "Identity not found: " + provider.getCode() + "/" + externalId));
    }

    @Override
    public Customer updateProfile(long customerId, ProfileUpdate update, ProfileUpdate.Mode mode) {
        String sql = mode == ProfileUpdate.Mode.REFRESH
                ? """
                  UPDATE customers
                  SET first_name = COALESCE(?::text, first_name),
                      last_name = COALESCE(?::text, last_name),
                      company = COALESCE(?::text, company),
                      primary_email = COALESCE(primary_email, ?::text),
                      primary_phone = COALESCE(primary_phone, ?::text),
                      updated_at = now()
                  WHERE id = ?
                  """ + RETURNING_CUSTOMER
                : """
                  UPDATE customers
                  SET first_name = COALESCE(first_name, ?::text),
                      last_name = COALESCE(last_name, ?::text),
                      company = COALESCE(company, ?::text),
                      primary_email = COALESCE(primary_email, ?::text),
                      primary_phone = COALESCE(primary_phone, ?::text),
                      updated_at = now()
                  WHERE id = ?
                  """ + RETURNING_CUSTOMER;
        return DataAccessGuard.call("updateProfile", () -> first(jdbcTemplate.query(sql, ps -> {
            ps.setString(1, update.firstName());
            ps.setString(2, update.lastName());
            ps.setString(3, update.company());
            ps.setString(4, update.email());
            ps.setString(5, update.phone());
            ps.setLong(6, customerId);
        }, CUSTOMER))).orElseThrow(() -> new StoreException("Customer not found: " + customerId));
    }

    // ========== Statement helpers ==========

    private Optional<Customer> selectCustomer(long customerId) {
        return first(jdbcTemplate.query(
                "SELECT " + CUSTOMER_COLUMNS + " FROM customers c WHERE c.id = ?",
                ps -> ps.setLong(1, customerId),
                CUSTOMER));
    }

    private Optional<CustomerIdentity> selectIdentity(Provider provider, String externalId) {
        String sql = "SELECT " + IDENTITY_COLUMNS + """

                FROM customer_identities i
                WHERE i.provider = ? AND i.external_id = ?
                """;
        return first(jdbcTemplate.query(sql, ps -> {
            ps.setString(1, provider.getCode());
            ps.setString(2, externalId);
        }, identityMapper));
    }

    private Optional<CustomerIdentity> selectKeylessIdentity(CustomerIdentity identity) {
        String sql = "SELECT " + IDENTITY_COLUMNS + """

                FROM customer_identities i
                WHERE i.customer_id = ?
                  AND i.provider = ?
                  AND i.external_id IS NULL
                  AND i.email IS NOT DISTINCT FROM ?::text
                  AND i.phone IS NOT DISTINCT FROM ?::text
                ORDER BY i.id
                LIMIT 1
                """;
        return first(jdbcTemplate.query(sql, ps -> {
            ps.setLong(1, identity.getCustomerId());
            ps.setString(2, identity.getProvider().getCode());
            ps.setString(3, identity.getEmail());
            ps.setString(4, identity.getPhone());
        }, identityMapper));
    }

    private Customer insertCustomer(Customer customer) {
        String sql = """
                INSERT INTO customers (primary_email, primary_phone, first_name, last_name, company,
                                       is_vip, credit_risk_level)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """ + RETURNING_CUSTOMER;
        return first(jdbcTemplate.query(sql, ps -> {
            ps.setString(1, customer.getPrimaryEmail());
            ps.setString(2, customer.getPrimaryPhone());
            ps.setString(3, customer.getFirstName());
            ps.setString(4, customer.getLastName());
            ps.setString(5, customer.getCompany());
            ps.setBoolean(6, customer.isVip());
            if (customer.getCreditRiskLevel() != null) {
                ps.setString(7, customer.getCreditRiskLevel());
            } else {
                ps.setNull(7, Types.VARCHAR);
            }
        }, CUSTOMER)).orElseThrow();
    }

    private Optional<CustomerIdentity> insertIdentity(CustomerIdentity identity) {
        String sql = """
                INSERT INTO customer_identities (customer_id, provider, external_id, email, phone, metadata)
                VALUES (?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (provider, external_id) WHERE external_id IS NOT NULL DO NOTHING
                """ + RETURNING_IDENTITY;
        return first(jdbcTemplate.query(sql, ps -> {
            ps.setLong(1, identity.getCustomerId());
            ps.setString(2, identity.getProvider().getCode());
            ps.setString(3, identity.getExternalId());
            ps.setString(4, identity.getEmail());
            ps.setString(5, identity.getPhone());
            ps.setString(6, CustomerRows.writeJson(mapper, identity.getMetadata()));
        }, identityMapper));
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
