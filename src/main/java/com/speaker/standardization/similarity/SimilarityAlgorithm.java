package com.speaker.standardization.similarity;

/**
 * Interface for similarity computation algorithms.
 * Scores are percentages between 0 (no similarity) and 100 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings as a percentage.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0 and 100
     */
    double percentage(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
