package com.record.dedup.similarity;

/**
 * Interface for similarity computation algorithms.
 * All implementations should return a symmetric score between 0.0 (no similarity)
 * and 1.0 (identical). Inputs are expected to be normalized already.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns a cheap upper bound of {@link #compute(String, String)}.
     * Callers may skip the full computation when the bound cannot exceed their
     * threshold. The default bound is 1.0, which never rejects anything.
     */
    default double upperBound(String s1, String s2) {
        return 1.0;
    }

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
