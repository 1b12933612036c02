package com.kmesh.fusion.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextSimilarityTest {

    @Test
    void ignoresCaseAndWordOrder() {
        assertThat(TextSimilarity.similarity("Backoff is exponential", "exponential backoff IS")).isEqualTo(1.0);
    }

    @Test
    void editRatioCatchesSmallSpellingChanges() {
        double similarity = TextSimilarity.similarity(
            "the scheduler flushes buffered metrics every thirty seconds",
            "the scheduler flushes bufferred metrics every thirty seconds"
        );

        assertThat(similarity).isGreaterThan(0.85);
        assertThat(TextSimilarity.jaccard(
            TextTokens.tokenize("the scheduler flushes buffered metrics every thirty seconds"),
            TextTokens.tokenize("the scheduler flushes bufferred metrics every thirty seconds")
        )).isLessThan(0.85);
    }

    @Test
    void jaccardOverDistinctTokens() {
        assertThat(TextSimilarity.jaccard(List.of("a", "b", "b"), List.of("b", "c"))).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(TextSimilarity.jaccard(List.of(), List.of())).isEqualTo(1.0);
    }

    @Test
    void emptyAgainstNonEmptyIsZero() {
        assertThat(TextSimilarity.similarity("", "something")).isEqualTo(0.0);
        assertThat(TextSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
    }
}
