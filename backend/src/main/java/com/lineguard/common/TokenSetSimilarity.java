package com.lineguard.common;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Token-set similarity in [0, 1]: compares the sorted token intersection with each side's remainder and
 * keeps the best normalized indel ratio. Word order and duplicated words do not matter; a name whose tokens
 * are a subset of the other's scores 1.0.
 */
public final class TokenSetSimilarity {

    private TokenSetSimilarity() {
    }

    public static double score(String left, String right) {
        SortedSet<String> a = new TreeSet<>(TextNormalizer.tokens(TextNormalizer.normalize(left)));
        SortedSet<String> b = new TreeSet<>(TextNormalizer.tokens(TextNormalizer.normalize(right)));
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        SortedSet<String> common = new TreeSet<>(a);
        common.retainAll(b);
        SortedSet<String> onlyA = new TreeSet<>(a);
        onlyA.removeAll(common);
        SortedSet<String> onlyB = new TreeSet<>(b);
        onlyB.removeAll(common);

        if (!common.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
            return 1.0;
        }
        String intersection = String.join(" ", common);
        String combinedA = join(intersection, String.join(" ", onlyA));
        String combinedB = join(intersection, String.join(" ", onlyB));

        double best = ratio(combinedA, combinedB);
        if (!intersection.isEmpty()) {
            best = Math.max(best, Math.max(ratio(intersection, combinedA), ratio(intersection, combinedB)));
        }
        return best;
    }

    /**
     * Normalized indel similarity: 1 - (insertions + deletions) / (len(a) + len(b)).
     */
    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) {
            return tail;
        }
        return tail.isEmpty() ? head : head + " " + tail;
    }
}
