package com.customer.identity.search;

import com.customer.identity.core.model.Customer;
import com.customer.identity.rules.ContactNormalizer;
import com.customer.identity.similarity.SimilarityAlgorithm;
import com.customer.identity.similarity.TrigramSimilarity;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores search candidates in tiers so that a weaker category can never overtake a stronger one.
 *
 * <ul>
 *   <li>Exact (10-15): full name 15, full name with tokens swapped 14, primary email 13,
 *       phone 12, email known only from an identity 11, one-word query equal to the first or
 *       last name 10.</li>
 *   <li>Partial (5-9): both name tokens are prefixes 7, one-word query is a prefix 5.</li>
 *   <li>Fuzzy (at most 5.5): name similarity up to 3, email similarity up to 1, company
 *       similarity up to 1, full-text rank up to 0.5.</li>
 * </ul>
 * Name components are alternatives (the strongest one counts); everything else is summed.
 */
public class TieredScorer {

    static final double FULL_NAME = 15.0;
    static final double SWAPPED_NAME = 14.0;
    static final double PRIMARY_EMAIL = 13.0;
    static final double PHONE = 12.0;
    static final double SECONDARY_EMAIL = 11.0;
    static final double SINGLE_TOKEN_NAME = 10.0;
    static final double BOTH_TOKEN_PREFIX = 7.0;
    static final double SINGLE_TOKEN_PREFIX = 5.0;

    static final double NAME_SIMILARITY_CAP = 3.0;
    static final double EMAIL_SIMILARITY_CAP = 1.0;
    static final double COMPANY_SIMILARITY_CAP = 1.0;
    static final double TEXT_RANK_CAP = 0.5;

    /**
     * Deterministic order of scored hits: score, VIP, last update and id, all descending.
     */
    public static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparing((SearchHit h) -> h.customer().isVip(), Comparator.reverseOrder())
            .thenComparing((SearchHit h) -> h.customer().getUpdatedAt(), Comparator.reverseOrder())
            .thenComparing(SearchHit::customerId, Comparator.reverseOrder());

    private final SimilarityAlgorithm similarity;

    public TieredScorer() {
        this(new TrigramSimilarity());
    }

    public TieredScorer(SimilarityAlgorithm similarity) {
        this.similarity = similarity;
    }

    public double score(CandidateQuery query, SearchCandidate candidate) {
        return breakdown(query, candidate).total();
    }

    /**
     * Scores every candidate, drops those below {@code minScore} and returns the best {@code limit}.
     */
    public List<SearchHit> rank(CandidateQuery query, List<SearchCandidate> candidates, double minScore, int limit) {
        return candidates.stream()
                .map(c -> new SearchHit(c.customer(), score(query, c), c.providers()))
                .filter(hit -> hit.score() >= minScore)
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    public ScoreBreakdown breakdown(CandidateQuery query, SearchCandidate candidate) {
        Customer customer = candidate.customer();
        String first = lower(customer.getFirstName());
        String last = lower(customer.getLastName());
        String fullName = customer.getFullName().toLowerCase(Locale.ROOT);

        double exactName = exactName(query, first, last, fullName);
        double exact = exactName + exactContact(query, candidate);
        double partial = exactName > 0 ? 0.0 : partialName(query, first, last);

        double nameSimilarity = Math.max(similarity.compute(fullName, query.text()),
                Math.max(similarity.compute(first, query.text()), similarity.compute(last, query.text())));
        double fuzzyName = Math.min(NAME_SIMILARITY_CAP, NAME_SIMILARITY_CAP * nameSimilarity);
        double fuzzyEmail = Math.min(EMAIL_SIMILARITY_CAP,
                similarity.compute(lower(customer.getPrimaryEmail()), query.text()));
        double fuzzyCompany = Math.min(COMPANY_SIMILARITY_CAP,
                similarity.compute(lower(customer.getCompany()), query.text()));
        double textRank = Math.min(TEXT_RANK_CAP, Math.max(0.0, candidate.textRank()));

        return new ScoreBreakdown(exact, partial, fuzzyName + fuzzyEmail + fuzzyCompany + textRank);
    }

    private static double exactName(CandidateQuery query, String first, String last, String fullName) {
        List<String> tokens = query.tokens();
        if (tokens.isEmpty() || fullName.isEmpty()) {
            return 0.0;
        }
        if (fullName.equals(query.text())) {
            return FULL_NAME;
        }
        if (tokens.size() == 2 && tokens.get(0).equals(last) && tokens.get(1).equals(first)) {
            return SWAPPED_NAME;
        }
        if (tokens.size() == 1 && (tokens.get(0).equals(first) || tokens.get(0).equals(last))) {
            return SINGLE_TOKEN_NAME;
        }
        return 0.0;
    }

    private static double exactContact(CandidateQuery query, SearchCandidate candidate) {
        double score = 0.0;
        if (!query.email().isEmpty()) {
            if (query.email().equals(lower(candidate.customer().getPrimaryEmail()))) {
                score = PRIMARY_EMAIL;
            } else if (candidate.emails().contains(query.email())) {
                score = SECONDARY_EMAIL;
            }
        }
        if (!query.phoneKey().isEmpty()) {
            String primaryKey = ContactNormalizer.phoneKey(candidate.customer().getPrimaryPhone());
            if (query.phoneKey().equals(primaryKey) || candidate.phoneKeys().contains(query.phoneKey())) {
                score = Math.max(score, PHONE);
            }
        }
        return score;
    }

    private static double partialName(CandidateQuery query, String first, String last) {
        List<String> tokens = query.tokens();
        if (tokens.size() == 2) {
            boolean inOrder = startsWith(first, tokens.get(0)) && startsWith(last, tokens.get(1));
            boolean swapped = startsWith(last, tokens.get(0)) && startsWith(first, tokens.get(1));
            return inOrder || swapped ? BOTH_TOKEN_PREFIX : 0.0;
        }
        if (tokens.size() == 1 && (startsWith(first, tokens.get(0)) || startsWith(last, tokens.get(0)))) {
            return SINGLE_TOKEN_PREFIX;
        }
        return 0.0;
    }

    private static boolean startsWith(String value, String prefix) {
        return !value.isEmpty() && !prefix.isEmpty() && value.startsWith(prefix);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Score split by tier.
     */
    public record ScoreBreakdown(double exact, double partial, double fuzzy) {

        public double total() {
            return exact + partial + fuzzy;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "ScoreBreakdown{exact=%.2f, partial=%.2f, fuzzy=%.4f, total=%.4f}",
                    exact, partial, fuzzy, total());
        }
    }
}
