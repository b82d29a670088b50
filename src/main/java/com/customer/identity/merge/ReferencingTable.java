package com.customer.identity.merge;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A table holding a foreign key to {@code customers.id} that a merge must re-point.
 *
 * @param table           table name
 * @param column          customer id column
 * @param onePerCustomer  whether the table allows at most one row per customer; such rows are
 *                        deleted instead of re-pointed when the primary already has one
 */
public record ReferencingTable(String table, String column, boolean onePerCustomer) {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public ReferencingTable {
        Objects.requireNonNull(table, "table is required");
        Objects.requireNonNull(column, "column is required");
        if (!IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        if (!IDENTIFIER.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + column);
        }
    }

    public static ReferencingTable of(String table) {
        return new ReferencingTable(table, "customer_id", false);
    }

    public static ReferencingTable onePerCustomer(String table) {
        return new ReferencingTable(table, "customer_id", true);
    }

    /**
     * Tables re-pointed by default. Tables that do not exist in the database are skipped.
     */
    public static List<ReferencingTable> defaults() {
        return List.of(
                of("customer_identities"),
                of("contacts"),
                of("orders"),
                of("tickets"),
                of("interactions"),
                of("opportunities"),
                of("calls"),
                of("crm_tasks"),
                of("invoices"),
                of("estimates"),
                of("shipments"),
                of("fulfillment_shipments"),
                of("knowledge_sources"),
                onePerCustomer("accounting_snapshots"),
                onePerCustomer("customer_scores"),
                onePerCustomer("customer_search_documents")
        );
    }
}
