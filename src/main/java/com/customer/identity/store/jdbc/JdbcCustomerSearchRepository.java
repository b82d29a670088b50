package com.customer.identity.store.jdbc;

import com.customer.identity.core.model.Provider;
import com.customer.identity.search.CandidateQuery;
import com.customer.identity.search.CustomerSearchRepository;
import com.customer.identity.search.QueryType;
import com.customer.identity.search.SearchCandidate;
import com.customer.identity.rules.ContactNormalizer;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.customer.identity.store.jdbc.CustomerRows.CUSTOMER_COLUMNS;

/**
 * PostgreSQL implementation of {@link CustomerSearchRepository}.
 *
 * <p>Candidate retrieval reads the {@code customer_search_documents} read model, which triggers
 * on {@code customers} and {@code customer_identities} keep current. Every filter is backed by a
 * GIN index: array membership for emails and phone keys, {@code pg_trgm} for name and company,
 * and a {@code tsvector} for the combined text. The fallback path only touches the base tables.</p>
 */
public class JdbcCustomerSearchRepository implements CustomerSearchRepository {

    private static final String CANDIDATES_SQL = "SELECT " + CUSTOMER_COLUMNS + """
            ,
                   d.all_emails, d.phone_keys, d.identity_providers,
                   ts_rank(d.tsv, plainto_tsquery('simple', ?)) AS text_rank
            FROM customer_search_documents d
            JOIN customers c ON c.id = d.customer_id
            WHERE (? <> '' AND d.all_emails @> ARRAY[?]::text[])
               OR (? <> '' AND d.phone_keys @> ARRAY[?]::text[])
               OR d.search_name % ?
               OR d.search_company % ?
               OR d.tsv @@ plainto_tsquery('simple', ?)
            ORDER BY ((? <> '' AND d.all_emails @> ARRAY[?]::text[])
                      OR (? <> '' AND d.phone_keys @> ARRAY[?]::text[])) DESC,
                     similarity(d.search_name, ?) DESC,
                     c.id DESC
            LIMIT ?
            """;

    private static final String PROVIDERS_SUBQUERY = """
            ARRAY(SELECT DISTINCT i.provider FROM customer_identities i WHERE i.customer_id = c.id) AS identity_providers""";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcCustomerSearchRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<SearchCandidate> findCandidates(CandidateQuery query) {
        return DataAccessGuard.call("findSearchCandidates", () -> transactionTemplate.execute(status -> {
            // Threshold of the % operator, scoped to this transaction.
            jdbcTemplate.query("SELECT set_config('pg_trgm.similarity_threshold', ?, true)",
                    ps -> ps.setString(1, Double.toString(query.trigramThreshold())),
                    (rs, rowNum) -> rs.getString(1));

            return jdbcTemplate.query(CANDIDATES_SQL, ps -> {
                int i = 1;
                ps.setString(i++, query.text());
                ps.setString(i++, query.email());
                ps.setString(i++, query.email());
                ps.setString(i++, query.phoneKey());
                ps.setString(i++, query.phoneKey());
                ps.setString(i++, query.text());
                ps.setString(i++, query.text());
                ps.setString(i++, query.text());
                ps.setString(i++, query.email());
                ps.setString(i++, query.email());
                ps.setString(i++, query.phoneKey());
                ps.setString(i++, query.phoneKey());
                ps.setString(i++, query.text());
                ps.setInt(i, query.candidateLimit());
            }, (rs, rowNum) -> candidate(rs, rs.getDouble("text_rank")));
        }));
    }

    @Override
    public List<SearchCandidate> substringSearch(QueryType type, String term, int limit) {
        String trimmed = term == null ? "" : term.trim();
        String pattern = "%" + escapeLike(trimmed.toLowerCase(Locale.ROOT)) + "%";

        String where;
        String bindValue;
        switch (type) {
            case EMAIL -> {
                where = """
                        lower(c.primary_email) LIKE ?
                        OR EXISTS (SELECT 1 FROM customer_identities i2
                                   WHERE i2.customer_id = c.id AND lower(i2.email) LIKE ?)""";
                bindValue = pattern;
            }
            case PHONE -> {
                where = """
                        right(regexp_replace(coalesce(c.primary_phone, ''), '\\D', '', 'g'), 10) LIKE ?
                        OR EXISTS (SELECT 1 FROM customer_identities i2
                                   WHERE i2.customer_id = c.id
                                     AND right(regexp_replace(coalesce(i2.phone, ''), '\\D', '', 'g'), 10) LIKE ?)""";
                bindValue = "%" + ContactNormalizer.phoneKey(trimmed) + "%";
            }
            default -> {
                where = """
                        lower(c.first_name) LIKE ?
                        OR lower(c.last_name) LIKE ?
                        OR lower(concat_ws(' ', c.first_name, c.last_name)) LIKE ?
                        OR lower(c.company) LIKE ?""";
                bindValue = pattern;
            }
        }

        String sql = "SELECT " + CUSTOMER_COLUMNS + ",\n       " + PROVIDERS_SUBQUERY
                + "\nFROM customers c\nWHERE (" + where + ")\n" + """
                ORDER BY CASE
                           WHEN lower(c.primary_email) = ? THEN 0
                           WHEN lower(c.first_name) LIKE ? THEN 1
                           WHEN lower(c.last_name) LIKE ? THEN 2
                           ELSE 3
                         END,
                         c.is_vip DESC,
                         c.updated_at DESC,
                         c.id DESC
                LIMIT ?
                """;

        int placeholders = type == QueryType.NAME ? 4 : 2;
        String exact = trimmed.toLowerCase(Locale.ROOT);
        return DataAccessGuard.call("substringSearch", () -> jdbcTemplate.query(sql, ps -> {
            int i = 1;
            for (int p = 0; p < placeholders; p++) {
                ps.setString(i++, bindValue);
            }
            ps.setString(i++, exact);
            ps.setString(i++, pattern);
            ps.setString(i++, pattern);
            ps.setInt(i, limit);
        }, (rs, rowNum) -> candidate(rs, 0.0)));
    }

    private static SearchCandidate candidate(ResultSet rs, double textRank) throws SQLException {
        Set<Provider> providers = EnumSet.noneOf(Provider.class);
        for (String code : strings(rs.getArray("identity_providers"))) {
            providers.add(Provider.fromCode(code));
        }
        List<String> emails = hasColumn(rs, "all_emails") ? strings(rs.getArray("all_emails")) : List.of();
        List<String> phoneKeys = hasColumn(rs, "phone_keys") ? strings(rs.getArray("phone_keys")) : List.of();
        return new SearchCandidate(CustomerRows.customer(rs), emails, phoneKeys, providers, textRank);
    }

    private static List<String> strings(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        List<String> result = new ArrayList<>(values.length);
        Arrays.stream(values).filter(v -> v != null).forEach(v -> result.add(v.toString()));
        return result;
    }

    private static boolean hasColumn(ResultSet rs, String column) throws SQLException {
        var meta = rs.getMetaData();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            if (column.equalsIgnoreCase(meta.getColumnLabel(i))) {
                return true;
            }
        }
        return false;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
