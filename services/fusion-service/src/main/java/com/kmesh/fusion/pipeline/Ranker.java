package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.api.dto.FusedItem;
import com.kmesh.fusion.text.TextTokens;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Stage 5. Weighted composite rank with a deterministic total order. Composite scores that
 * agree to within 1e-6 fall through to raw score, citation recency and domain id.
 */
@Component
public class Ranker {
    private static final double TIE_RESOLUTION = 1e-6;
    private static final int SHORT_TOKENS = 10;
    private static final int LONG_TOKENS = 500;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final RankingWeights weights;

    public Ranker(RankingWeights weights) {
        this.weights = weights;
    }

    public List<FusedItem> rank(List<TaggedItem> items, Map<String, Double> domainSignals, Instant asOf) {
        List<Scored> scored = new ArrayList<>(items.size());
        for (TaggedItem item : items) {
            scored.add(new Scored(item, score(item, domainSignals, asOf)));
        }
        scored.sort(ORDER);

        List<FusedItem> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            ranked.add(toFusedItem(scored.get(i), i + 1));
        }
        return ranked;
    }

    double score(TaggedItem item, Map<String, Double> domainSignals, Instant asOf) {
        double corroboration = item.isCorroborated() ? 1.0 : 0.0;
        return weights.normalizedScore() * item.effectiveScore()
            + weights.corroboration() * corroboration
            + weights.recency() * recency(item.timestamp(), asOf)
            + weights.domainRelevance() * domainRelevance(item.domainId(), domainSignals)
            + weights.length() * lengthSignal(item.content());
    }

    double recency(Instant timestamp, Instant asOf) {
        double days = Math.max(0.0, Duration.between(timestamp, asOf).getSeconds() / SECONDS_PER_DAY);
        return Math.exp(-days / weights.recencyDecayDays());
    }

    /**
     * Signal score of the item's domain. Without any signals (explicit domain selection) every
     * domain counts as fully relevant.
     */
    static double domainRelevance(String domainId, Map<String, Double> domainSignals) {
        if (domainSignals == null || domainSignals.isEmpty()) {
            return 1.0;
        }
        Double signal = domainSignals.get(domainId);
        return signal == null ? 0.0 : signal;
    }

    static double lengthSignal(String content) {
        int tokens = TextTokens.wordCount(content);
        if (tokens < SHORT_TOKENS) {
            return 0.2;
        }
        if (tokens > LONG_TOKENS) {
            return 0.7;
        }
        return 1.0;
    }

    private static final Comparator<Scored> ORDER = Comparator
        .comparingLong((Scored scored) -> Math.round(scored.rankScore / TIE_RESOLUTION)).reversed()
        .thenComparing(Comparator.comparingDouble((Scored scored) -> scored.item.rawScore()).reversed())
        .thenComparing(Comparator.comparing((Scored scored) -> scored.item.timestamp()).reversed())
        .thenComparing(scored -> scored.item.domainId())
        .thenComparing(scored -> scored.item.agentId())
        .thenComparing(scored -> scored.item.chunkId());

    private static FusedItem toFusedItem(Scored scored, int rank) {
        TaggedItem tagged = scored.item;
        FusedItem fused = new FusedItem();
        fused.setRank(rank);
        fused.setChunkId(tagged.chunkId());
        fused.setContent(tagged.content());
        fused.setScore(tagged.rawScore());
        fused.setNormalizedScore(tagged.normalized());
        fused.setRankScore(scored.rankScore);
        fused.setDomainId(tagged.domainId());
        fused.setAgentId(tagged.agentId());
        fused.setCitation(tagged.item().getCitation());
        fused.setCorroboratingCitations(new ArrayList<>(tagged.corroboratingCitations()));
        fused.setDemoted(tagged.isDemoted());
        Map<String, Object> metadata = tagged.item().getMetadata();
        fused.setMetadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
        return fused;
    }

    private static final class Scored {
        private final TaggedItem item;
        private final double rankScore;

        private Scored(TaggedItem item, double rankScore) {
            this.item = item;
            this.rankScore = rankScore;
        }
    }
}
