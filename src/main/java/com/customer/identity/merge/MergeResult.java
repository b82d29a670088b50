package com.customer.identity.merge;

import java.util.List;

/**
 * Outcome of a merge request. Rejections are reported here rather than thrown.
 *
 * @param success      whether the merge committed
 * @param primaryId    the surviving customer
 * @param mergedIds    customers merged into the primary (de-duplicated, without the primary)
 * @param counts       rows touched, {@code null} on failure
 * @param errorMessage why the merge was rejected, {@code null} on success
 */
public record MergeResult(
        boolean success,
        long primaryId,
        List<Long> mergedIds,
        MergeCounts counts,
        String errorMessage
) {
    public MergeResult {
        mergedIds = mergedIds != null ? List.copyOf(mergedIds) : List.of();
    }

    public static MergeResult success(long primaryId, List<Long> mergedIds, MergeCounts counts) {
        return new MergeResult(true, primaryId, mergedIds, counts, null);
    }

    public static MergeResult failure(long primaryId, List<Long> mergedIds, String errorMessage) {
        return new MergeResult(false, primaryId, mergedIds, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
