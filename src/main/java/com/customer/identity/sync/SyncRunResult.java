package com.customer.identity.sync;

import java.time.Duration;

/**
 * Summary of one completed sync run.
 *
 * @param sourceType     cursor key of the job
 * @param metrics        outcome counts over all pages
 * @param pagesProcessed pages fetched and persisted
 * @param exhausted      {@code false} when the run stopped at the page limit with more data left
 * @param fullResync     whether the run ignored the stored cursor
 * @param duration       wall-clock duration
 */
public record SyncRunResult(
        String sourceType,
        SyncMetrics metrics,
        int pagesProcessed,
        boolean exhausted,
        boolean fullResync,
        Duration duration
) {
}
