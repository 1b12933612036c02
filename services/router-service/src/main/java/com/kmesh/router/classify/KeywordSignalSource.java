package com.kmesh.router.classify;

import com.kmesh.router.registry.DomainDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule-based signals. A domain's score is the share of its keywords (plus its id and name) found
 * in the query, saturating after three hits.
 */
public class KeywordSignalSource implements DomainSignalSource {
    static final int SATURATION = 3;

    @Override
    public ClassificationResult classify(String queryText, List<DomainDescriptor> domains, String traceId) {
        List<String> queryTokens = QueryTerms.tokenize(queryText);
        List<DomainSignal> signals = new ArrayList<>(domains.size());
        for (DomainDescriptor domain : domains) {
            Set<String> candidates = candidates(domain);
            List<String> matched = new ArrayList<>();
            for (String keyword : candidates) {
                if (QueryTerms.containsPhrase(queryTokens, keyword)) {
                    matched.add(keyword);
                }
            }
            double score = 0.0;
            if (!candidates.isEmpty()) {
                score = Math.min(1.0, (double) matched.size() / Math.min(SATURATION, candidates.size()));
            }
            signals.add(new DomainSignal(domain.getDomainId(), score, matched));
        }
        return ClassificationResult.of(signals);
    }

    @Override
    public String name() {
        return "keyword";
    }

    private static Set<String> candidates(DomainDescriptor domain) {
        Set<String> candidates = new LinkedHashSet<>();
        add(candidates, domain.getDomainId());
        add(candidates, domain.getName());
        if (domain.getKeywords() != null) {
            for (String keyword : domain.getKeywords()) {
                add(candidates, keyword);
            }
        }
        return candidates;
    }

    private static void add(Set<String> candidates, String value) {
        if (value != null && !value.isBlank()) {
            candidates.add(value.trim().toLowerCase(Locale.ROOT));
        }
    }
}
