package com.customer.identity.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Trigram similarity with the same semantics as PostgreSQL's {@code pg_trgm similarity()}:
 * the text is lower-cased and split into words on non-alphanumeric characters, each word is
 * padded with two leading spaces and one trailing space, and the score is the number of shared
 * trigrams divided by the number of distinct trigrams in either string.
 */
public class TrigramSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> trigrams1 = trigrams(s1);
        Set<String> trigrams2 = trigrams(s2);
        if (trigrams1.isEmpty() || trigrams2.isEmpty()) {
            return 0.0;
        }

        int shared = 0;
        for (String trigram : trigrams1) {
            if (trigrams2.contains(trigram)) {
                shared++;
            }
        }
        int union = trigrams1.size() + trigrams2.size() - shared;
        return (double) shared / union;
    }

    @Override
    public String getName() {
        return "Trigram";
    }

    static Set<String> trigrams(String text) {
        Set<String> result = new HashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (word.isEmpty()) {
                continue;
            }
            String padded = "  " + word + " ";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                result.add(padded.substring(i, i + 3));
            }
        }
        return result;
    }
}
