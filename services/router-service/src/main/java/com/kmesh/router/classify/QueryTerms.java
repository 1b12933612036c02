package com.kmesh.router.classify;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class QueryTerms {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final Set<String> STOPWORDS = Set.of(
        "a", "an", "the", "and", "or", "of", "to", "in", "on", "at", "for", "by", "with", "from",
        "is", "are", "was", "were", "be", "it", "this", "that", "as", "do", "does", "did",
        "what", "which", "how", "when", "why", "who", "where", "we", "our", "i", "my", "me"
    );

    private QueryTerms() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    public static Set<String> contentTerms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            if (!STOPWORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    /**
     * True when the phrase occurs in the text as a whole-token sequence.
     */
    public static boolean containsPhrase(List<String> textTokens, String phrase) {
        List<String> phraseTokens = tokenize(phrase);
        if (phraseTokens.isEmpty() || phraseTokens.size() > textTokens.size()) {
            return false;
        }
        for (int start = 0; start + phraseTokens.size() <= textTokens.size(); start++) {
            if (textTokens.subList(start, start + phraseTokens.size()).equals(phraseTokens)) {
                return true;
            }
        }
        return false;
    }
}
