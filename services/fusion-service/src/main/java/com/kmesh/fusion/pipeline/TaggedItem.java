package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.api.dto.RecallItem;
import com.kmesh.fusion.api.dto.SourceCitation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A recall item with its provenance. The normalized score is assigned once by the
 * normalization stage; later stages express demotion through {@code penalty}.
 */
public record TaggedItem(
    RecallItem item,
    String agentId,
    String domainId,
    long agentLatencyMs,
    Double normalizedScore,
    List<SourceCitation> corroboratingCitations,
    double penalty
) {
    /**
     * Strongest evidence first: normalized score, raw score, newest citation, then ids.
     */
    public static final Comparator<TaggedItem> STRONGEST_FIRST = Comparator
        .comparingDouble(TaggedItem::normalized).reversed()
        .thenComparing(Comparator.comparingDouble(TaggedItem::rawScore).reversed())
        .thenComparing(Comparator.comparing(TaggedItem::timestamp).reversed())
        .thenComparing(TaggedItem::domainId)
        .thenComparing(TaggedItem::agentId)
        .thenComparing(TaggedItem::chunkId);

    public TaggedItem {
        corroboratingCitations = corroboratingCitations == null ? List.of() : List.copyOf(corroboratingCitations);
    }

    public static TaggedItem of(RecallItem item, String agentId, String domainId, long agentLatencyMs) {
        return new TaggedItem(item, agentId, domainId, agentLatencyMs, null, List.of(), 0.0);
    }

    public TaggedItem withNormalizedScore(double score) {
        if (normalizedScore != null) {
            throw new IllegalStateException("normalized score already assigned for chunk " + chunkId());
        }
        return new TaggedItem(item, agentId, domainId, agentLatencyMs, score, corroboratingCitations, penalty);
    }

    public TaggedItem withCorroboration(SourceCitation citation) {
        List<SourceCitation> citations = new ArrayList<>(corroboratingCitations);
        citations.add(citation);
        return new TaggedItem(item, agentId, domainId, agentLatencyMs, normalizedScore, citations, penalty);
    }

    public TaggedItem withPenalty(double value) {
        return new TaggedItem(item, agentId, domainId, agentLatencyMs, normalizedScore, corroboratingCitations, Math.max(penalty, value));
    }

    public String chunkId() {
        return item.getChunkId();
    }

    public String content() {
        return item.getContent();
    }

    public double rawScore() {
        return item.getScore();
    }

    public Instant timestamp() {
        return item.getCitation().getTimestamp();
    }

    public double normalized() {
        if (normalizedScore == null) {
            throw new IllegalStateException("normalized score not assigned for chunk " + chunkId());
        }
        return normalizedScore;
    }

    public double effectiveScore() {
        return normalized() * (1.0 - penalty);
    }

    public boolean isDemoted() {
        return penalty > 0.0;
    }

    public boolean isCorroborated() {
        return !corroboratingCitations.isEmpty();
    }
}
