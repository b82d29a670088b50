package com.customer.identity.sync;

import com.customer.identity.resolver.ResolutionRequest;

import java.util.Optional;

/**
 * Maps a raw provider record to the identifying fields the resolver needs.
 * Returns empty for records that carry no identifying signal at all; those are counted as
 * unlinked and never reach the resolver.
 */
@FunctionalInterface
public interface IdentityExtractor<R> {

    Optional<ResolutionRequest> extract(R record);
}
