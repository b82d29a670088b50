package com.customer.identity.store.jdbc;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.MatchSignal;
import com.customer.identity.core.model.MergeCandidate;
import com.customer.identity.merge.CustomerMergeRepository;
import com.customer.identity.merge.DuplicateContactGroup;
import com.customer.identity.merge.MergeCounts;
import com.customer.identity.merge.ReferencingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.customer.identity.store.jdbc.CustomerRows.CUSTOMER_COLUMNS;

/**
 * PostgreSQL implementation of {@link CustomerMergeRepository}.
 * A merge runs in one transaction that locks every participating customer row first.
 */
public class JdbcMergeRepository implements CustomerMergeRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcMergeRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcMergeRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<MergeCandidate> findMergeCandidates(long customerId) {
        String sql = """
                WITH signals AS (
                    SELECT lower(primary_email) AS email, primary_phone AS phone FROM customers WHERE id = ?
                    UNION
                    SELECT lower(email), phone FROM customer_identities WHERE customer_id = ?
                ),
                emails AS (SELECT DISTINCT email FROM signals WHERE email IS NOT NULL),
                phones AS (SELECT DISTINCT phone FROM signals WHERE phone IS NOT NULL)
                SELECT * FROM (
                """ + "    SELECT " + CUSTOMER_COLUMNS + """
                ,
                           (lower(c.primary_email) IN (SELECT email FROM emails)
                            OR EXISTS (SELECT 1 FROM customer_identities i
                                       WHERE i.customer_id = c.id AND lower(i.email) IN (SELECT email FROM emails)))
                               AS email_match,
                           (c.primary_phone IN (SELECT phone FROM phones)
                            OR EXISTS (SELECT 1 FROM customer_identities i
                                       WHERE i.customer_id = c.id AND i.phone IN (SELECT phone FROM phones)))
                               AS phone_match
                    FROM customers c
                    WHERE c.id <> ?
                ) matches
                WHERE email_match OR phone_match
                ORDER BY id
                """;
        return DataAccessGuard.call("findMergeCandidates", () -> jdbcTemplate.query(sql, ps -> {
            ps.setLong(1, customerId);
            ps.setLong(2, customerId);
            ps.setLong(3, customerId);
        }, (rs, rowNum) -> {
            Customer customer = CustomerRows.customer(rs);
            Set<MatchSignal> matchedOn = EnumSet.noneOf(MatchSignal.class);
            if (rs.getBoolean("email_match")) {
                matchedOn.add(MatchSignal.EMAIL);
            }
            if (rs.getBoolean("phone_match")) {
                matchedOn.add(MatchSignal.PHONE);
            }
            return new MergeCandidate(customer, matchedOn);
        }));
    }

    @Override
    public MergeCounts merge(long primaryId, List<Long> losingIds, List<ReferencingTable> tables) {
        return DataAccessGuard.call("mergeCustomers", () -> transactionTemplate.execute(status -> {
            List<Long> all = new ArrayList<>(losingIds);
            all.add(primaryId);
            List<Long> locked = jdbcTemplate.query(
                    "SELECT id FROM customers WHERE id = ANY(?) ORDER BY id FOR UPDATE",
                    ps -> ps.setArray(1, CustomerRows.bigintArray(ps, all)),
                    (rs, rowNum) -> rs.getLong("id"));
            if (locked.size() != all.size()) {
                throw new IllegalStateException("Customers changed before merge could lock them: expected "
                        + all + " but found " + locked);
            }

            Map<String, Integer> repointed = new LinkedHashMap<>();
            Map<String, Integer> deleted = new LinkedHashMap<>();
            for (ReferencingTable table : tables) {
                if (!tableExists(table.table())) {
                    log.debug("merge.table_skipped table={} reason=absent", table.table());
                    continue;
                }
                if (table.onePerCustomer()) {
                    mergeOnePerCustomer(table, primaryId, losingIds, repointed, deleted);
                } else {
                    int moved = jdbcTemplate.update(
                            "UPDATE " + table.table() + " SET " + table.column() + " = ? WHERE "
                                    + table.column() + " = ANY(?)",
                            ps -> {
                                ps.setLong(1, primaryId);
                                ps.setArray(2, CustomerRows.bigintArray(ps, losingIds));
                            });
                    repointed.put(table.table(), moved);
                }
            }

            jdbcTemplate.update("UPDATE customers SET updated_at = now() WHERE id = ?",
                    ps -> ps.setLong(1, primaryId));
            int customersDeleted = jdbcTemplate.update("DELETE FROM customers WHERE id = ANY(?)",
                    ps -> ps.setArray(1, CustomerRows.bigintArray(ps, losingIds)));
            return new MergeCounts(repointed, deleted, customersDeleted);
        }));
    }

    @Override
    public List<DuplicateContactGroup> findDuplicateContactGroups(int limit) {
        String sql = """
                SELECT signal, value, ids FROM (
                    SELECT 'EMAIL' AS signal, lower(primary_email) AS value, array_agg(id ORDER BY id) AS ids
                    FROM customers
                    WHERE primary_email IS NOT NULL
                    GROUP BY lower(primary_email)
                    HAVING count(*) > 1
                    UNION ALL
                    SELECT 'PHONE', primary_phone, array_agg(id ORDER BY id)
                    FROM customers
                    WHERE primary_phone IS NOT NULL
                    GROUP BY primary_phone
                    HAVING count(*) > 1
                ) groups
                ORDER BY signal, value
                LIMIT ?
                """;
        return DataAccessGuard.call("findDuplicateContactGroups", () -> jdbcTemplate.query(sql,
                ps -> ps.setInt(1, limit), (rs, rowNum) -> {
            Array ids = rs.getArray("ids");
            List<Long> customerIds = Arrays.stream((Object[]) ids.getArray())
                    .map(v -> ((Number) v).longValue())
                    .toList();
            return new DuplicateContactGroup(MatchSignal.valueOf(rs.getString("signal")),
                    rs.getString("value"), customerIds);
        }));
    }

    private void mergeOnePerCustomer(ReferencingTable table, long primaryId, List<Long> losingIds,
                                     Map<String, Integer> repointed, Map<String, Integer> deleted) {
        String name = table.table();
        String column = table.column();
        boolean primaryHasRow = Boolean.TRUE.equals(jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM " + name + " WHERE " + column + " = ?)",
                Boolean.class, primaryId));

        int moved = 0;
        if (!primaryHasRow) {
            moved = jdbcTemplate.update(
                    "UPDATE " + name + " SET " + column + " = ? WHERE ctid = ("
                            + "SELECT ctid FROM " + name + " WHERE " + column + " = ANY(?) "
                            + "ORDER BY " + column + " LIMIT 1)",
                    ps -> {
                        ps.setLong(1, primaryId);
                        ps.setArray(2, CustomerRows.bigintArray(ps, losingIds));
                    });
        }
        int removed = jdbcTemplate.update(
                "DELETE FROM " + name + " WHERE " + column + " = ANY(?)",
                ps -> ps.setArray(1, CustomerRows.bigintArray(ps, losingIds)));
        repointed.put(name, moved);
        deleted.put(name, removed);
    }

    private boolean tableExists(String table) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(
                "SELECT to_regclass(?) IS NOT NULL", Boolean.class, table));
    }
}
