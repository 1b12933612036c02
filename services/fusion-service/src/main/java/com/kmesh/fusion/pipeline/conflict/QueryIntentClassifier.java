package com.kmesh.fusion.pipeline.conflict;

import java.util.List;
import java.util.Locale;

/**
 * Infers what kind of answer a query is after, which decides the source-authority order.
 */
public final class QueryIntentClassifier {
    private static final List<String> HISTORICAL_CUES = List.of(
        "why did", "why was", "why were", "decided", "decision", "history", "historically",
        "originally", "back then", "previously", "used to", "was chosen"
    );
    private static final List<String> DESIGN_CUES = List.of(
        "should", "intended", "supposed to", "meant to", "design", "proposal", "requirement", "planned", "expected to"
    );

    private QueryIntentClassifier() {
    }

    public static QueryIntent infer(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return QueryIntent.CURRENT_BEHAVIOR;
        }
        String normalized = " " + queryText.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ") + " ";
        if (containsAny(normalized, HISTORICAL_CUES)) {
            return QueryIntent.HISTORICAL_DECISION;
        }
        if (containsAny(normalized, DESIGN_CUES)) {
            return QueryIntent.INTENDED_DESIGN;
        }
        return QueryIntent.CURRENT_BEHAVIOR;
    }

    private static boolean containsAny(String text, List<String> cues) {
        for (String cue : cues) {
            if (text.contains(" " + cue)) {
                return true;
            }
        }
        return false;
    }
}
