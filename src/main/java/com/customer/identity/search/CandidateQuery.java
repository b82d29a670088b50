package com.customer.identity.search;

import com.customer.identity.rules.ContactNormalizer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Pre-processed query passed to candidate retrieval.
 *
 * @param raw                the query as typed
 * @param text               lower-cased, whitespace-collapsed query
 * @param tokens             the words of {@code text}
 * @param email              the query as an email, or an empty string when it is not one
 * @param phoneKey           last ten digits of the query when it is a phone, otherwise empty
 * @param type               detected query type
 * @param trigramThreshold   minimum trigram similarity for fuzzy name and company retrieval
 * @param candidateLimit     maximum number of candidates returned
 */
public record CandidateQuery(
        String raw,
        String text,
        List<String> tokens,
        String email,
        String phoneKey,
        QueryType type,
        double trigramThreshold,
        int candidateLimit
) {

    public CandidateQuery {
        tokens = List.copyOf(tokens);
    }

    public static CandidateQuery of(String raw, double trigramThreshold, int candidateLimit) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        List<String> tokens = text.isEmpty() ? List.of() : Arrays.asList(text.split(" "));
        QueryType type = QueryType.detect(raw);
        String email = type == QueryType.EMAIL ? text : "";
        String phoneKey = type == QueryType.PHONE ? ContactNormalizer.phoneKey(text) : "";
        return new CandidateQuery(raw, text, tokens, email, phoneKey, type, trigramThreshold, candidateLimit);
    }
}
