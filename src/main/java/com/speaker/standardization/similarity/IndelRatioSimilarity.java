package com.speaker.standardization.similarity;

/**
 * Normalized Indel similarity (the classic "ratio" of fuzzy string matching).
 * Computes {@code (|s1| + |s2| - indelDistance) / (|s1| + |s2|)}, where the Indel distance
 * counts the insertions and deletions needed to turn one string into the other.
 * Equivalently {@code 2 * LCS / (|s1| + |s2|)}.
 *
 * <p>The comparison is case-sensitive and runs on the raw strings.</p>
 */
public class IndelRatioSimilarity implements SimilarityAlgorithm {

    @Override
    public double percentage(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 100.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }

        int common = longestCommonSubsequence(s1, s2);
        return 100.0 * (2 * common) / total;
    }

    @Override
    public String getName() {
        return "IndelRatio";
    }

    /**
     * Length of the longest common subsequence, O(min(m,n)) space.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        // Ensure s1 is the shorter string for space optimization
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            char c2 = s2.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c2) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
