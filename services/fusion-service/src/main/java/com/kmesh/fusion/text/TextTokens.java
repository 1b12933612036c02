package com.kmesh.fusion.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextTokens {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+(?:'[\\p{L}]+)?");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

    private static final Set<String> STOPWORDS = Set.of(
        "a", "an", "the", "and", "or", "of", "to", "in", "on", "at", "for", "by", "with", "from",
        "is", "are", "was", "were", "be", "been", "it", "its", "this", "that", "as", "into",
        "does", "do", "did", "has", "have", "had", "what", "which", "how", "when", "why", "who"
    );

    private static final Set<String> NEGATION_CUES = Set.of(
        "not", "no", "never", "none", "cannot", "without", "neither", "nor",
        "deprecated", "removed", "disabled", "obsolete", "unsupported",
        "doesn't", "don't", "isn't", "aren't", "wasn't", "weren't", "won't",
        "can't", "shouldn't", "didn't", "hasn't", "haven't", "couldn't"
    );

    private TextTokens() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT).replace('’', '\''));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Distinct content-bearing tokens: stopwords, negation cues and pure numbers removed.
     */
    public static Set<String> contentTerms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            if (STOPWORDS.contains(token) || NEGATION_CUES.contains(token) || isNumeric(token)) {
                continue;
            }
            terms.add(token);
        }
        return terms;
    }

    public static boolean isNegated(String text) {
        for (String token : tokenize(text)) {
            if (NEGATION_CUES.contains(token)) {
                return true;
            }
        }
        return false;
    }

    public static Set<String> isoDates(String text) {
        Set<String> dates = new LinkedHashSet<>();
        if (text == null) {
            return dates;
        }
        Matcher matcher = ISO_DATE.matcher(text);
        while (matcher.find()) {
            dates.add(matcher.group(1));
        }
        return dates;
    }

    public static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }

    private static boolean isNumeric(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
