package org.cuepoint.compiler.util;

import java.util.Optional;

/**
 * Edit-distance helpers used for "did you mean" suggestions.
 */
public final class StringSimilarity {

    private StringSimilarity() {
        // Static utility
    }

    /**
     * Computes the Levenshtein distance (insertions, deletions, substitutions) between two strings.
     *
     * @param a The first string.
     * @param b The second string.
     * @return The edit distance.
     */
    public static int levenshtein(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Finds the candidate closest to the input within a maximum distance.
     * Ties go to the candidate encountered first.
     *
     * @param input       The unknown token.
     * @param candidates  The known tokens, in registry order.
     * @param maxDistance The largest distance still worth suggesting.
     * @return The closest candidate, or empty if none is close enough.
     */
    public static Optional<String> closest(String input, Iterable<String> candidates, int maxDistance) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int d = levenshtein(input, candidate);
            if (d <= maxDistance && d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        return Optional.ofNullable(best);
    }
}
