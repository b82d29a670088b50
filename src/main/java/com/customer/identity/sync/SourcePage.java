package com.customer.identity.sync;

import java.util.List;

/**
 * One page of raw records fetched from a provider.
 *
 * @param records      the records, in source order
 * @param nextPosition position to resume from after this page
 * @param hasMore      whether the source has more records after {@code nextPosition}
 * @param <R>          raw record type
 * @param <C>          position type
 */
public record SourcePage<R, C>(List<R> records, C nextPosition, boolean hasMore) {

    public SourcePage {
        records = records != null ? List.copyOf(records) : List.of();
    }

    public static <R, C> SourcePage<R, C> last(List<R> records, C nextPosition) {
        return new SourcePage<>(records, nextPosition, false);
    }
}
