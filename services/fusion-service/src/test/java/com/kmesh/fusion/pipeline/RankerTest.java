package com.kmesh.fusion.pipeline;

import static com.kmesh.fusion.pipeline.FusionFixtures.NOW;
import static com.kmesh.fusion.pipeline.FusionFixtures.tagged;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.kmesh.fusion.api.dto.FusedItem;
import com.kmesh.fusion.api.dto.SourceCitation;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RankerTest {
    private static final String TWELVE_WORDS = "the ingest worker batches writes and flushes them every five hundred milliseconds";

    private final Ranker ranker = new Ranker(RankingWeights.from(new FusionProperties().getRanking()));

    @Test
    void composesWeightedScore() {
        TaggedItem item = tagged("code-1", TWELVE_WORDS, 0.6, "code", "src/ingest.py", NOW);

        double score = ranker.score(item, Map.of("code", 0.5), NOW);

        assertThat(score).isCloseTo(0.5 * 0.6 + 0.15 * 1.0 + 0.10 * 0.5 + 0.10 * 1.0, within(1e-9));
    }

    @Test
    void ordersByRankScoreAndAssignsRanks() {
        TaggedItem weak = tagged("docs-1", TWELVE_WORDS, 0.0, "docs", "docs/ingest.md", NOW);
        TaggedItem strong = tagged("code-1", TWELVE_WORDS, 1.0, "code", "src/ingest.py", NOW);
        TaggedItem corroborated = tagged("research-1", TWELVE_WORDS, 0.8, "research", "papers/ingest.pdf", NOW)
            .withCorroboration(new SourceCitation("doc-x", "conv-1", "conversations", "slack/ingest", NOW));

        List<FusedItem> ranked = ranker.rank(List.of(weak, strong, corroborated), Map.of(), NOW);

        assertThat(ranked).extracting(FusedItem::getChunkId).containsExactly("research-1", "code-1", "docs-1");
        assertThat(ranked).extracting(FusedItem::getRank).containsExactly(1, 2, 3);
        assertThat(ranked.get(0).getRankScore()).isGreaterThan(ranked.get(1).getRankScore());
        assertThat(ranked.get(1).getRankScore()).isGreaterThan(ranked.get(2).getRankScore());
        assertThat(ranked.get(0).getCorroboratingCitations()).hasSize(1);
    }

    @Test
    void demotedItemsRankBelowTheirPeers() {
        TaggedItem winner = tagged("code-1", TWELVE_WORDS, 0.5, "code", "src/a.py", NOW);
        TaggedItem loser = tagged("docs-1", TWELVE_WORDS, 0.5, "docs", "docs/a.md", NOW).withPenalty(0.5);

        List<FusedItem> ranked = ranker.rank(List.of(loser, winner), Map.of(), NOW);

        assertThat(ranked).extracting(FusedItem::getChunkId).containsExactly("code-1", "docs-1");
        assertThat(ranked.get(1).isDemoted()).isTrue();
        assertThat(ranked.get(1).getNormalizedScore()).isEqualTo(0.5);
    }

    @Test
    void equalScoresFallBackToStableTiebreakers() {
        TaggedItem b = tagged("b", TWELVE_WORDS, 0.5, "code", "src/b.py", NOW);
        TaggedItem a = tagged("a", TWELVE_WORDS, 0.5, "code", "src/a.py", NOW);

        assertThat(ranker.rank(List.of(b, a), Map.of(), NOW)).extracting(FusedItem::getChunkId).containsExactly("a", "b");
        assertThat(ranker.rank(List.of(a, b), Map.of(), NOW)).extracting(FusedItem::getChunkId).containsExactly("a", "b");
    }

    @Test
    void recencyDecaysExponentially() {
        assertThat(ranker.recency(NOW, NOW)).isEqualTo(1.0);
        assertThat(ranker.recency(NOW.minus(Duration.ofDays(90)), NOW)).isCloseTo(Math.exp(-1.0), within(1e-9));
        assertThat(ranker.recency(NOW.plus(Duration.ofDays(1)), NOW)).isEqualTo(1.0);
    }

    @Test
    void lengthSignalPenalizesFragmentsAndWalls() {
        assertThat(Ranker.lengthSignal("one two three four five six seven eight nine")).isEqualTo(0.2);
        assertThat(Ranker.lengthSignal(TWELVE_WORDS)).isEqualTo(1.0);
        assertThat(Ranker.lengthSignal("word ".repeat(501))).isEqualTo(0.7);
    }

    @Test
    void domainRelevanceUsesSignals() {
        assertThat(Ranker.domainRelevance("docs", Map.of())).isEqualTo(1.0);
        assertThat(Ranker.domainRelevance("docs", null)).isEqualTo(1.0);
        assertThat(Ranker.domainRelevance("docs", Map.of("code", 0.9))).isEqualTo(0.0);
        assertThat(Ranker.domainRelevance("code", Map.of("code", 0.9))).isEqualTo(0.9);
    }
}
