package com.customer.identity.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Algorithm Tests")
class SimilarityAlgorithmTest {

    @Nested
    @DisplayName("TrigramSimilarity")
    class TrigramTests {

        private final TrigramSimilarity trigram = new TrigramSimilarity();

        @Test
        @DisplayName("Identical strings score 1.0")
        void identical() {
            assertEquals(1.0, trigram.compute("Jane Doe", "jane doe"), 1e-9);
        }

        @Test
        @DisplayName("Null or empty input scores 0.0")
        void nullInput() {
            assertEquals(0.0, trigram.compute(null, "jane"));
            assertEquals(0.0, trigram.compute("jane", ""));
            assertEquals(0.0, trigram.compute("...", "jane"));
        }

        @Test
        @DisplayName("Should match pg_trgm similarity('word', 'two words')")
        void matchesPostgres() {
            assertEquals(4.0 / 11.0, trigram.compute("word", "two words"), 1e-6);
        }

        @Test
        @DisplayName("Close spellings score between 0 and 1")
        void closeSpelling() {
            double score = trigram.compute("jon smith", "john smith");

            assertTrue(score > 0.5, "score was " + score);
            assertTrue(score < 1.0);
        }

        @Test
        @DisplayName("Unrelated strings score 0.0")
        void unrelated() {
            assertEquals(0.0, trigram.compute("abc", "xyz"));
        }

        @Test
        @DisplayName("Should be symmetric")
        void symmetric() {
            assertEquals(trigram.compute("acme corp", "acme corporation"),
                    trigram.compute("acme corporation", "acme corp"), 1e-12);
        }

        @Test
        @DisplayName("Words should be padded as in pg_trgm")
        void padding() {
            assertTrue(TrigramSimilarity.trigrams("ab").contains("  a"));
            assertTrue(TrigramSimilarity.trigrams("ab").contains("ab "));
            assertEquals(3, TrigramSimilarity.trigrams("ab").size());
        }
    }

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Token overlap over union")
        void overlap() {
            assertEquals(0.5, jaccard.compute("jane doe acme", "jane doe smith"), 1e-9);
        }

        @Test
        @DisplayName("Emails stay a single token")
        void emailToken() {
            assertEquals(1.0, jaccard.compute("jane@example.com", "JANE@example.com"), 1e-9);
        }

        @Test
        @DisplayName("Null input scores 0.0")
        void nullInput() {
            assertEquals(0.0, jaccard.compute(null, "x"));
        }
    }
}
