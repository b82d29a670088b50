package com.customer.identity.sync;

import com.customer.identity.core.model.Provider;

/**
 * A runnable sync of one provider source.
 */
public interface SyncJob {

    String sourceType();

    Provider provider();

    /**
     * Runs incrementally from the stored cursor.
     *
     * @throws SyncException if the run was aborted
     */
    SyncRunResult run();
}
