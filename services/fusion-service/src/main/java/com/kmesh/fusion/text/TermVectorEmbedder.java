package com.kmesh.fusion.text;

import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Deterministic hashed term-frequency embedding. Stands in for a content-embedding model when
 * comparing two answers for semantic divergence.
 */
@Component
public class TermVectorEmbedder {
    public static final int DIMENSION = 512;

    public double[] embed(String text) {
        double[] values = new double[DIMENSION];
        for (String token : TextTokens.tokenize(text)) {
            if (token.length() < 2) {
                continue;
            }
            values[Math.floorMod(token.hashCode(), DIMENSION)] += 1.0;
        }
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        if (sumSquares == 0.0) {
            return values;
        }
        double norm = Math.sqrt(sumSquares);
        for (int i = 0; i < DIMENSION; i++) {
            values[i] = values[i] / norm;
        }
        return values;
    }

    public double cosine(String a, String b) {
        return cosine(embed(a), embed(b));
    }

    public static double cosine(double[] a, double[] b) {
        double dot = 0.0;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            dot += a[i] * b[i];
        }
        return dot;
    }

    public static double coverage(Set<String> queryTerms, Set<String> itemTerms) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        int hits = 0;
        for (String term : queryTerms) {
            if (itemTerms.contains(term)) {
                hits++;
            }
        }
        return (double) hits / queryTerms.size();
    }
}
