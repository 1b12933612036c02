package com.kmesh.fusion.pipeline;

import static com.kmesh.fusion.pipeline.FusionFixtures.NOW;
import static com.kmesh.fusion.pipeline.FusionFixtures.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScoreNormalizerTest {

    private final ScoreNormalizer normalizer = new ScoreNormalizer();

    @Test
    void scalesEachAgentToItsOwnRange() {
        List<TaggedItem> items = List.of(
            TaggedItem.of(item("a1", "alpha", 0.9, "code", "a.py", NOW), "code-agent", "code", 5L),
            TaggedItem.of(item("a2", "beta", 0.5, "code", "b.py", NOW), "code-agent", "code", 5L),
            TaggedItem.of(item("a3", "gamma", 0.1, "code", "c.py", NOW), "code-agent", "code", 5L),
            TaggedItem.of(item("d1", "delta", 0.3, "docs", "d.md", NOW), "docs-agent", "docs", 5L),
            TaggedItem.of(item("d2", "epsilon", 0.2, "docs", "e.md", NOW), "docs-agent", "docs", 5L)
        );

        List<TaggedItem> normalized = normalizer.normalize(items);

        assertThat(normalized).extracting(TaggedItem::chunkId).containsExactly("a1", "a2", "a3", "d1", "d2");
        assertThat(normalized.get(0).normalized()).isEqualTo(1.0);
        assertThat(normalized.get(1).normalized()).isCloseTo(0.5, within(1e-9));
        assertThat(normalized.get(2).normalized()).isEqualTo(0.0);
        assertThat(normalized.get(3).normalized()).isEqualTo(1.0);
        assertThat(normalized.get(4).normalized()).isEqualTo(0.0);
    }

    @Test
    void tiedOrSingleScoresNormalizeToMidpoint() {
        List<TaggedItem> items = List.of(
            TaggedItem.of(item("c1", "one", 0.4, "conversations", "t1", NOW), "conv-agent", "conversations", 5L),
            TaggedItem.of(item("c2", "two", 0.4, "conversations", "t2", NOW), "conv-agent", "conversations", 5L),
            TaggedItem.of(item("r1", "three", 0.7, "research", "p1", NOW), "research-agent", "research", 5L)
        );

        List<TaggedItem> normalized = normalizer.normalize(items);

        assertThat(normalized).extracting(TaggedItem::normalized).containsExactly(0.5, 0.5, 0.5);
    }

    @Test
    void rawScoresAreKept() {
        List<TaggedItem> normalized = normalizer.normalize(List.of(
            TaggedItem.of(item("a1", "alpha", 0.8, "code", "a.py", NOW), "code-agent", "code", 5L),
            TaggedItem.of(item("a2", "beta", 0.2, "code", "b.py", NOW), "code-agent", "code", 5L)
        ));

        assertThat(normalized).extracting(TaggedItem::rawScore).containsExactly(0.8, 0.2);
    }
}
