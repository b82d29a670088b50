package com.customer.identity.api;

import com.customer.identity.merge.ReferencingTable;

import java.util.List;

/**
 * Tuning of resolution, search, merge and sync.
 */
public class IdentityOptions {

    private static final int DEFAULT_CANDIDATE_LIMIT = 200;
    private static final double DEFAULT_TRIGRAM_THRESHOLD = 0.2;
    private static final double DEFAULT_MIN_SCORE = 0.75;
    private static final int DEFAULT_SEARCH_LIMIT = 20;
    private static final int DEFAULT_MAX_SEARCH_LIMIT = 50;
    private static final int DEFAULT_SYNC_PAGE_SIZE = 100;
    private static final int DEFAULT_SYNC_MAX_PAGES = 1_000;

    private final int candidateLimit;
    private final double trigramThreshold;
    private final double minScore;
    private final int defaultSearchLimit;
    private final int maxSearchLimit;
    private final boolean addressLinkingEnabled;
    private final int syncPageSize;
    private final int syncMaxPages;
    private final List<ReferencingTable> referencingTables;

    private IdentityOptions(Builder builder) {
        this.candidateLimit = builder.candidateLimit;
        this.trigramThreshold = builder.trigramThreshold;
        this.minScore = builder.minScore;
        this.defaultSearchLimit = builder.defaultSearchLimit;
        this.maxSearchLimit = builder.maxSearchLimit;
        this.addressLinkingEnabled = builder.addressLinkingEnabled;
        this.syncPageSize = builder.syncPageSize;
        this.syncMaxPages = builder.syncMaxPages;
        this.referencingTables = List.copyOf(builder.referencingTables);
    }

    /**
     * Maximum number of customers retrieved before scoring.
     */
    public int getCandidateLimit() {
        return candidateLimit;
    }

    /**
     * Minimum trigram similarity for a name or company to be retrieved as a candidate.
     */
    public double getTrigramThreshold() {
        return trigramThreshold;
    }

    /**
     * Scored results below this value are discarded.
     */
    public double getMinScore() {
        return minScore;
    }

    public int getDefaultSearchLimit() {
        return defaultSearchLimit;
    }

    public int getMaxSearchLimit() {
        return maxSearchLimit;
    }

    /**
     * Whether a record whose external id is unknown may link to a customer through a shared
     * address fingerprint under the same provider.
     */
    public boolean isAddressLinkingEnabled() {
        return addressLinkingEnabled;
    }

    public int getSyncPageSize() {
        return syncPageSize;
    }

    /**
     * Upper bound of pages fetched by a single sync run.
     */
    public int getSyncMaxPages() {
        return syncMaxPages;
    }

    public List<ReferencingTable> getReferencingTables() {
        return referencingTables;
    }

    public static IdentityOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        private double trigramThreshold = DEFAULT_TRIGRAM_THRESHOLD;
        private double minScore = DEFAULT_MIN_SCORE;
        private int defaultSearchLimit = DEFAULT_SEARCH_LIMIT;
        private int maxSearchLimit = DEFAULT_MAX_SEARCH_LIMIT;
        private boolean addressLinkingEnabled = true;
        private int syncPageSize = DEFAULT_SYNC_PAGE_SIZE;
        private int syncMaxPages = DEFAULT_SYNC_MAX_PAGES;
        private List<ReferencingTable> referencingTables = ReferencingTable.defaults();

        public Builder candidateLimit(int candidateLimit) {
            requirePositive(candidateLimit, "candidateLimit");
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder trigramThreshold(double trigramThreshold) {
            if (trigramThreshold < 0.0 || trigramThreshold > 1.0) {
                throw new IllegalArgumentException("trigramThreshold must be between 0.0 and 1.0");
            }
            this.trigramThreshold = trigramThreshold;
            return this;
        }

        public Builder minScore(double minScore) {
            if (minScore < 0.0) {
                throw new IllegalArgumentException("minScore must not be negative");
            }
            this.minScore = minScore;
            return this;
        }

        public Builder defaultSearchLimit(int defaultSearchLimit) {
            requirePositive(defaultSearchLimit, "defaultSearchLimit");
            this.defaultSearchLimit = defaultSearchLimit;
            return this;
        }

        public Builder maxSearchLimit(int maxSearchLimit) {
            requirePositive(maxSearchLimit, "maxSearchLimit");
            this.maxSearchLimit = maxSearchLimit;
            return this;
        }

        public Builder addressLinkingEnabled(boolean addressLinkingEnabled) {
            this.addressLinkingEnabled = addressLinkingEnabled;
            return this;
        }

        public Builder syncPageSize(int syncPageSize) {
            requirePositive(syncPageSize, "syncPageSize");
            this.syncPageSize = syncPageSize;
            return this;
        }

        public Builder syncMaxPages(int syncMaxPages) {
            requirePositive(syncMaxPages, "syncMaxPages");
            this.syncMaxPages = syncMaxPages;
            return this;
        }

        public Builder referencingTables(List<ReferencingTable> referencingTables) {
            if (referencingTables == null || referencingTables.isEmpty()) {
                throw new IllegalArgumentException("referencingTables must not be empty");
            }
            this.referencingTables = referencingTables;
            return this;
        }

        public IdentityOptions build() {
            if (defaultSearchLimit > maxSearchLimit) {
                throw new IllegalArgumentException("defaultSearchLimit must be <= maxSearchLimit");
            }
            return new IdentityOptions(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
