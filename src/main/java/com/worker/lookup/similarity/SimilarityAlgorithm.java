package com.worker.lookup.similarity;

/**
 * Scores how alike two already-normalized strings are.
 * Implementations return a value between 0.0 (nothing in common) and 1.0 (identical).
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
     * Returns the name of this algorithm, used in log lines.
     */
    String getName();
}
