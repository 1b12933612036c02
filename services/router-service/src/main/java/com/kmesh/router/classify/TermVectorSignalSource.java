package com.kmesh.router.classify;

import com.kmesh.router.registry.DomainDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Statistical signals: cosine similarity between hashed term-frequency vectors of the query and
 * of each domain's descriptor text.
 */
public class TermVectorSignalSource implements DomainSignalSource {
    static final int DIMENSION = 256;

    @Override
    public ClassificationResult classify(String queryText, List<DomainDescriptor> domains, String traceId) {
        double[] query = vector(QueryTerms.tokenize(queryText));
        Set<String> queryTerms = QueryTerms.contentTerms(queryText);
        List<DomainSignal> signals = new ArrayList<>(domains.size());
        for (DomainDescriptor domain : domains) {
            String descriptorText = descriptorText(domain);
            double score = cosine(query, vector(QueryTerms.tokenize(descriptorText)));
            List<String> shared = new ArrayList<>();
            Set<String> domainTerms = QueryTerms.contentTerms(descriptorText);
            for (String term : queryTerms) {
                if (domainTerms.contains(term)) {
                    shared.add(term);
                }
            }
            signals.add(new DomainSignal(domain.getDomainId(), score, shared));
        }
        return ClassificationResult.of(signals);
    }

    @Override
    public String name() {
        return "term_vector";
    }

    static String descriptorText(DomainDescriptor domain) {
        StringBuilder text = new StringBuilder();
        append(text, domain.getDomainId());
        append(text, domain.getName());
        append(text, domain.getDescription());
        if (domain.getKeywords() != null) {
            for (String keyword : domain.getKeywords()) {
                append(text, keyword);
            }
        }
        return text.toString();
    }

    static double[] vector(List<String> tokens) {
        double[] values = new double[DIMENSION];
        for (String token : tokens) {
            values[Math.floorMod(token.hashCode(), DIMENSION)] += 1.0;
        }
        return values;
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < DIMENSION; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return Math.min(1.0, dot / (Math.sqrt(normA) * Math.sqrt(normB)));
    }

    private static void append(StringBuilder text, String value) {
        if (value != null && !value.isBlank()) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(value);
        }
    }
}
