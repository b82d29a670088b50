package com.customer.identity.sync;

/**
 * Points the caller's own row (order, shipment, ticket) at the resolved customer.
 */
@FunctionalInterface
public interface RecordLinker<R> {

    void link(R record, long customerId);

    static <R> RecordLinker<R> none() {
        return (record, customerId) -> { };
    }
}
