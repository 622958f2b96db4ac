package com.poc.salesingest.service.cleaning;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognises subtotal / grand-total labels, including one-letter typos of "total".
 */
public final class TotalishMatcher {

    private static final Pattern TOTAL_WORD = Pattern.compile("\\b(?:grand\\s*)?(?:sub\\s*)?totals?\\b");
    private static final String TOTAL = "total";

    private TotalishMatcher() {
    }

    public static boolean looksLikeTotal(String value) {
        if (value == null) return false;
        String t = value.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            return false;
        }
        if (TOTAL_WORD.matcher(t).find()) {
            return true;
        }
        return editDistance(t, TOTAL) <= 1;
    }

    /**
     * Levenshtein distance: single-character inserts, deletes and substitutions.
     */
    static int editDistance(String a, String b) {
        int la = a.length();
        int lb = b.length();
        if (la == 0) return lb;
        if (lb == 0) return la;
        int[] prev = new int[lb + 1];
        int[] curr = new int[lb + 1];
        for (int j = 0; j <= lb; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= la; i++) {
            curr[0] = i;
            for (int j = 1; j <= lb; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[lb];
    }
}
