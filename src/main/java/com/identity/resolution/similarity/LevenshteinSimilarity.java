package com.identity.resolution.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / max(len(a), len(b))}.
 * Two empty strings are identical; an empty string shares nothing with a non-empty one.
 * Null is treated as empty.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String a = s1 != null ? s1 : "";
        String b = s2 != null ? s2 : "";
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - ((double) distance(a, b) / maxLength);
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Classic edit distance, unit cost for insert, delete and substitute.
     * Wagner-Fischer with two rows sized to the shorter string; O(n*m) time.
     */
    public static int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            char c2 = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == c2 ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
