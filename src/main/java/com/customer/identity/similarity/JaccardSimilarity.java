package com.customer.identity.similarity;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Word-token Jaccard index, |A ∩ B| / |A ∪ B|. The in-memory store uses it where PostgreSQL
 * would use {@code ts_rank}: to rank a customer's combined search text against the query.
 *
 * <p>Email addresses and phone numbers in {@code +1...} form survive tokenization whole, so
 * {@code jane@example.com} is one token rather than three.</p>
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern SEARCH_TEXT_SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}@.+]+");

    private final Pattern separators;

    public JaccardSimilarity() {
        this(SEARCH_TEXT_SEPARATORS);
    }

    public JaccardSimilarity(Pattern separators) {
        this.separators = separators;
    }

    @Override
    public double compute(String s1, String s2) {
        Set<String> left = tokens(s1);
        Set<String> right = tokens(s2);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        Set<String> shared = new HashSet<>(left);
        shared.retainAll(right);
        Set<String> all = new HashSet<>(left);
        all.addAll(right);
        return (double) shared.size() / all.size();
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(separators.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }
}
