package com.kmesh.fusion.text;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fuzzy similarity of two texts in [0, 1].
 *
 * <p>The score is the larger of a token-sort edit ratio and the Jaccard overlap of the token
 * sets. The edit ratio is skipped for very long texts and whenever the length ratio already
 * rules out reaching the caller's threshold.
 */
public final class TextSimilarity {
    private static final int MAX_EDIT_LENGTH = 2000;

    private TextSimilarity() {
    }

    public static double similarity(String a, String b) {
        return similarity(a, b, 0.0);
    }

    public static double similarity(String a, String b, double threshold) {
        List<String> tokensA = TextTokens.tokenize(a);
        List<String> tokensB = TextTokens.tokenize(b);
        if (tokensA.isEmpty() && tokensB.isEmpty()) {
            return 1.0;
        }
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }
        double jaccard = jaccard(tokensA, tokensB);
        String sortedA = sortedJoin(tokensA);
        String sortedB = sortedJoin(tokensB);
        int maxLen = Math.max(sortedA.length(), sortedB.length());
        int minLen = Math.min(sortedA.length(), sortedB.length());
        if (maxLen > MAX_EDIT_LENGTH) {
            return jaccard;
        }
        double lengthBound = (double) minLen / maxLen;
        if (lengthBound < threshold) {
            return jaccard;
        }
        double editRatio = 1.0 - ((double) levenshtein(sortedA, sortedB) / maxLen);
        return Math.max(jaccard, editRatio);
    }

    public static double jaccard(Collection<String> a, Collection<String> b) {
        Set<String> setA = new HashSet<>(a);
        Set<String> setB = new HashSet<>(b);
        if (setA.isEmpty() && setB.isEmpty()) {
            return 1.0;
        }
        int intersection = 0;
        for (String token : setA) {
            if (setB.contains(token)) {
                intersection++;
            }
        }
        int union = setA.size() + setB.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static String sortedJoin(List<String> tokens) {
        List<String> sorted = new ArrayList<>(tokens);
        Collections.sort(sorted);
        return String.join(" ", sorted);
    }
}
