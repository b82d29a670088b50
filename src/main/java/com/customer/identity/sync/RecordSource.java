package com.customer.identity.sync;

import com.customer.identity.core.model.Provider;

/**
 * Paginated access to one kind of provider record, e.g. marketplace orders. Implemented by the
 * provider API clients.
 *
 * @param <R> raw record type
 * @param <C> position type, serialized into the sync cursor with Jackson
 */
public interface RecordSource<R, C> {

    /**
     * Cursor key, e.g. {@code marketplace_order}.
     */
    String sourceType();

    Provider provider();

    Class<C> positionType();

    /**
     * Fetches the page after {@code position}; {@code null} means from the beginning.
     */
    SourcePage<R, C> fetch(C position, int pageSize);
}
