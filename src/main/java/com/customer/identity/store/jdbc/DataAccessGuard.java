package com.customer.identity.store.jdbc;

import com.customer.identity.store.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * Rethrows Spring data access failures as {@link StoreException} so callers of the repository
 * interfaces never see Spring types.
 */
final class DataAccessGuard {

    private DataAccessGuard() {
    }

    static <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException(operation + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    static void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }
}
