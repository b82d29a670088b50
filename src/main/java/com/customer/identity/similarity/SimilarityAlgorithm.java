package com.customer.identity.similarity;

/**
 * String similarity measure used by the in-process ranking stage.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
