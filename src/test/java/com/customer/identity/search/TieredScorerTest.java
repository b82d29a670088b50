package com.customer.identity.search;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.Provider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TieredScorer Tests")
class TieredScorerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final TieredScorer scorer = new TieredScorer();

    private static Customer customer(long id, String first, String last) {
        return Customer.builder()
                .id(id)
                .firstName(first)
                .lastName(last)
                .primaryEmail(first != null ? first.toLowerCase() + "@example.com" : null)
                .primaryPhone("+15125550100")
                .company("Acme Corp")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static SearchCandidate candidate(Customer customer, List<String> extraEmails) {
        return new SearchCandidate(customer, extraEmails, List.of(), Set.of(Provider.STOREFRONT), 0.0);
    }

    private static CandidateQuery query(String raw) {
        return CandidateQuery.of(raw, 0.3, 500);
    }

    private TieredScorer.ScoreBreakdown breakdown(String raw, SearchCandidate candidate) {
        return scorer.breakdown(query(raw), candidate);
    }

    @Nested
    @DisplayName("Exact tier")
    class ExactTierTests {

        private final SearchCandidate jane = candidate(customer(1, "Jane", "Doe"), List.of("jd@work.example"));

        @Test
        @DisplayName("Full name scores 15")
        void fullName() {
            assertEquals(15.0, breakdown("Jane  Doe", jane).exact());
        }

        @Test
        @DisplayName("Swapped name tokens score 14")
        void swappedName() {
            assertEquals(14.0, breakdown("doe jane", jane).exact());
        }

        @Test
        @DisplayName("Primary email scores 13")
        void primaryEmail() {
            assertEquals(13.0, breakdown("JANE@example.com", jane).exact());
        }

        @Test
        @DisplayName("Email known only from an identity scores 11")
        void secondaryEmail() {
            assertEquals(11.0, breakdown("jd@work.example", jane).exact());
        }

        @Test
        @DisplayName("Phone in any format scores 12")
        void phone() {
            assertEquals(12.0, breakdown("(512) 555-0100", jane).exact());
            assertEquals(12.0, breakdown("+1 512 555 0100", jane).exact());
        }

        @Test
        @DisplayName("A single token equal to the first or last name scores 10")
        void singleToken() {
            assertEquals(10.0, breakdown("jane", jane).exact());
            assertEquals(10.0, breakdown("DOE", jane).exact());
        }
    }

    @Nested
    @DisplayName("Partial and fuzzy tiers")
    class PartialTierTests {

        private final SearchCandidate jane = candidate(customer(1, "Jane", "Doe"), List.of());

        @Test
        @DisplayName("Both tokens as prefixes score 7")
        void bothTokenPrefix() {
            TieredScorer.ScoreBreakdown result = breakdown("ja do", jane);
            assertEquals(0.0, result.exact());
            assertEquals(7.0, result.partial());
        }

        @Test
        @DisplayName("Prefixes also match in swapped order")
        void bothTokenPrefixSwapped() {
            assertEquals(7.0, breakdown("do ja", jane).partial());
        }

        @Test
        @DisplayName("A single prefix token scores 5")
        void singleTokenPrefix() {
            assertEquals(5.0, breakdown("jan", jane).partial());
        }

        @Test
        @DisplayName("No partial score once an exact name matched")
        void noPartialOnExact() {
            assertEquals(0.0, breakdown("jane", jane).partial());
        }

        @Test
        @DisplayName("Fuzzy score is capped below the partial tier")
        void fuzzyIsCapped() {
            SearchCandidate ranked = new SearchCandidate(customer(2, "Jane", "Doe"), List.of(), List.of(),
                    Set.of(), 10.0);
            TieredScorer.ScoreBreakdown result = breakdown("jane doe", ranked);
            assertTrue(result.fuzzy() <= 5.5, "fuzzy was " + result.fuzzy());
            assertTrue(result.fuzzy() < TieredScorer.BOTH_TOKEN_PREFIX);
        }

        @Test
        @DisplayName("Unrelated queries score close to nothing")
        void unrelated() {
            TieredScorer.ScoreBreakdown result = breakdown("zzqx", jane);
            assertEquals(0.0, result.exact());
            assertEquals(0.0, result.partial());
            assertTrue(result.total() < 1.0);
        }

        @Test
        @DisplayName("Breakdown toString lists every tier")
        void breakdownToString() {
            String text = breakdown("jane doe", jane).toString();
            assertTrue(text.contains("exact=15.00"));
            assertTrue(text.contains("total="));
        }
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Stronger tiers always rank above weaker ones")
        void tierOrder() {
            SearchCandidate exact = candidate(customer(1, "Jane", "Doe"), List.of());
            SearchCandidate partial = candidate(customer(2, "Janet", "Doenitz"), List.of());
            SearchCandidate fuzzy = candidate(customer(3, "Jaine", "Dough"), List.of());

            List<SearchHit> hits = scorer.rank(query("jane doe"), List.of(fuzzy, partial, exact), 0.0, 10);

            assertEquals(List.of(1L, 2L, 3L), hits.stream().map(SearchHit::customerId).toList());
        }

        @Test
        @DisplayName("Hits below the minimum score are dropped")
        void minScore() {
            SearchCandidate exact = candidate(customer(1, "Jane", "Doe"), List.of());
            SearchCandidate unrelated = candidate(customer(2, "Bob", "Smith"), List.of());

            List<SearchHit> hits = scorer.rank(query("jane doe"), List.of(unrelated, exact), 1.0, 10);

            assertEquals(1, hits.size());
            assertEquals(1L, hits.get(0).customerId());
            assertEquals(Set.of(Provider.STOREFRONT), hits.get(0).linkedProviders());
        }

        @Test
        @DisplayName("Ties are broken by VIP, then most recent update, then highest id")
        void tieBreaks() {
            Customer plain = customer(1, "Jane", "Doe");
            Customer vip = Customer.builder(customer(2, "Jane", "Doe")).vip(true).build();
            Customer recent = Customer.builder(customer(3, "Jane", "Doe")).updatedAt(NOW.plusSeconds(60)).build();
            Customer higherId = customer(4, "Jane", "Doe");

            List<SearchHit> hits = scorer.rank(query("jane doe"), List.of(
                    candidate(plain, List.of()), candidate(vip, List.of()),
                    candidate(recent, List.of()), candidate(higherId, List.of())), 0.0, 10);

            assertEquals(List.of(2L, 3L, 4L, 1L), hits.stream().map(SearchHit::customerId).toList());
        }

        @Test
        @DisplayName("Result count is bounded by the limit")
        void limit() {
            List<SearchCandidate> candidates = List.of(
                    candidate(customer(1, "Jane", "Doe"), List.of()),
                    candidate(customer(2, "Jane", "Doe"), List.of()),
                    candidate(customer(3, "Jane", "Doe"), List.of()));

            assertEquals(2, scorer.rank(query("jane doe"), candidates, 0.0, 2).size());
        }
    }
}
