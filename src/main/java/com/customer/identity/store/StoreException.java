package com.customer.identity.store;

/**
 * Runtime exception raised when the customer store cannot complete an operation,
 * typically because the database is unavailable. Callers treat it as a transient
 * infrastructure failure: the current batch is aborted and the error is recorded.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
