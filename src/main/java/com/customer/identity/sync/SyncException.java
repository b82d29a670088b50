package com.customer.identity.sync;

/**
 * A sync run aborted because the store or the source failed. Records processed before the
 * failure are reported through {@link #getPartialMetrics()}.
 */
public class SyncException extends RuntimeException {

    private final String sourceType;
    private final SyncMetrics partialMetrics;

    public SyncException(String sourceType, SyncMetrics partialMetrics, String message, Throwable cause) {
        super(message, cause);
        this.sourceType = sourceType;
        this.partialMetrics = partialMetrics;
    }

    public String getSourceType() {
        return sourceType;
    }

    public SyncMetrics getPartialMetrics() {
        return partialMetrics;
    }
}
