package com.kmesh.router.routing;

import com.kmesh.router.classify.QueryTerms;
import com.kmesh.router.config.RouterProperties;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Accepts a backend-proposed rewrite only when it is usable. A null result means the agent
 * receives the original query text.
 */
@Component
public class QueryRewriter {
    private final RouterProperties properties;

    public QueryRewriter(RouterProperties properties) {
        this.properties = properties;
    }

    public String rewrite(String originalText, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        if (QueryTerms.tokenize(trimmed).size() > properties.getRewriteTokenBudget()) {
            return null;
        }
        if (originalText != null && normalize(trimmed).equals(normalize(originalText))) {
            return null;
        }
        return trimmed;
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
