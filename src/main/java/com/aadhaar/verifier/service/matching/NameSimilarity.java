package com.aadhaar.verifier.service.matching;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized edit-distance similarity between personal names, insensitive to case, punctuation,
 * spacing and token order.
 */
public final class NameSimilarity {

    private static final Pattern DROPPED = Pattern.compile("[.'`]");
    private static final Pattern NON_LETTER = Pattern.compile("[^\\p{L}]+");

    private NameSimilarity() {
    }

    /**
     * @return the larger of the raw-order and sorted-token similarities, in [0,1]
     */
    public static double score(String left, String right) {
        String first = canonical(left);
        String second = canonical(right);
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        return Math.max(ratio(first, second), ratio(sortTokens(first), sortTokens(second)));
    }

    static String canonical(String name) {
        if (name == null) {
            return "";
        }
        String upper = DROPPED.matcher(name.toUpperCase(Locale.ROOT)).replaceAll("");
        return NON_LETTER.matcher(upper).replaceAll(" ").trim();
    }

    static String sortTokens(String canonicalName) {
        String[] tokens = canonicalName.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    static double ratio(String left, String right) {
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 0.0;
        }
        return 1.0 - (double) levenshteinDistance(left, right) / longest;
    }

    /**
     * Edit distance over a single reused row; {@code diagonal} carries the value the row held for
     * the previous column before it was overwritten.
     */
    static int levenshteinDistance(String left, String right) {
        int[] row = new int[right.length() + 1];
        for (int j = 0; j < row.length; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            int diagonal = row[0];
            row[0] = i;
            for (int j = 1; j < row.length; j++) {
                int above = row[j];
                int substitution = diagonal + (left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1);
                row[j] = Math.min(substitution, Math.min(above, row[j - 1]) + 1);
                diagonal = above;
            }
        }
        return row[right.length()];
    }
}
