package com.kmesh.fusion.pipeline.conflict;

import com.kmesh.fusion.api.dto.ConflictRecord;
import com.kmesh.fusion.api.dto.ConflictStrategy;
import com.kmesh.fusion.pipeline.FusionProperties;
import com.kmesh.fusion.pipeline.TaggedItem;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Stage 4. Detects conflict groups and settles each one with the requested strategy. Every
 * group yields exactly one {@link ConflictRecord}; {@code resolved_to} is null only when the
 * outcome is {@link ConflictStrategy#FLAG}.
 */
@Component
public class ConflictResolver {
    private static final Comparator<TaggedItem> NEWEST_FIRST = Comparator
        .comparing(TaggedItem::timestamp).reversed()
        .thenComparing(Comparator.comparingDouble(TaggedItem::normalized).reversed())
        .thenComparing(TaggedItem::domainId)
        .thenComparing(TaggedItem::agentId)
        .thenComparing(TaggedItem::chunkId);

    private final ConflictDetector detector;
    private final FusionProperties properties;

    public ConflictResolver(ConflictDetector detector, FusionProperties properties) {
        this.detector = detector;
        this.properties = properties;
    }

    public ConflictOutcome resolve(List<TaggedItem> items, ConflictStrategy strategy, String queryText) {
        List<ConflictGroup> groups = detector.detect(items, queryText);
        if (groups.isEmpty()) {
            return new ConflictOutcome(items, List.of(), 0);
        }
        FusionProperties.Conflict config = properties.getConflict();
        ConflictStrategy requested = strategy == null ? ConflictStrategy.RECENCY : strategy;
        QueryIntent intent = QueryIntentClassifier.infer(queryText);

        Map<Integer, Double> penalties = new HashMap<>();
        Set<Integer> removed = new HashSet<>();
        List<ConflictRecord> records = new ArrayList<>(groups.size());

        for (ConflictGroup group : groups) {
            List<Integer> ranked = new ArrayList<>(group.members());
            Decision decision = decide(items, ranked, requested, intent, config.getTieWindow());
            records.add(toRecord(items, group, decision));

            List<Integer> losers = ranked.subList(1, ranked.size());
            if (decision.winner != null) {
                for (int loser : losers) {
                    if (config.getLoserPolicy() == LoserPolicy.REMOVE) {
                        removed.add(loser);
                    } else {
                        penalties.merge(loser, config.getDemotionPenalty(), Math::max);
                    }
                }
            } else if (decision.hasNotionalOrder && config.getFlaggedPenalty() > 0.0) {
                for (int loser : losers) {
                    penalties.merge(loser, config.getFlaggedPenalty(), Math::max);
                }
            }
        }

        List<TaggedItem> surviving = new ArrayList<>(items.size());
        int demoted = 0;
        for (int i = 0; i < items.size(); i++) {
            if (removed.contains(i)) {
                continue;
            }
            TaggedItem item = items.get(i);
            Double penalty = penalties.get(i);
            if (penalty != null && penalty > 0.0) {
                item = item.withPenalty(penalty);
                demoted++;
            }
            surviving.add(item);
        }
        return new ConflictOutcome(surviving, records, demoted);
    }

    /**
     * Orders {@code ranked} in place so that index 0 is the winner (or the notional leader of a
     * flagged group) and returns the strategy actually applied.
     */
    private Decision decide(
        List<TaggedItem> items,
        List<Integer> ranked,
        ConflictStrategy strategy,
        QueryIntent intent,
        Duration tieWindow
    ) {
        switch (strategy) {
            case RECENCY:
                ranked.sort(byItem(items, NEWEST_FIRST));
                return Decision.resolved(ConflictStrategy.RECENCY, items.get(ranked.get(0)));
            case CONFIDENCE:
                ranked.sort(byItem(items, TaggedItem.STRONGEST_FIRST));
                return Decision.resolved(ConflictStrategy.CONFIDENCE, items.get(ranked.get(0)));
            case SOURCE_AUTHORITY:
                List<String> order = authorityOrder(intent);
                Comparator<TaggedItem> byAuthority = Comparator
                    .comparingInt((TaggedItem item) -> authorityRank(order, item.domainId()))
                    .thenComparing(TaggedItem.STRONGEST_FIRST);
                ranked.sort(byItem(items, byAuthority));
                return Decision.resolved(ConflictStrategy.SOURCE_AUTHORITY, items.get(ranked.get(0)));
            case RECENCY_THEN_FLAG:
                ranked.sort(byItem(items, NEWEST_FIRST));
                TaggedItem newest = items.get(ranked.get(0));
                TaggedItem runnerUp = items.get(ranked.get(1));
                Duration gap = Duration.between(runnerUp.timestamp(), newest.timestamp()).abs();
                if (gap.compareTo(tieWindow) <= 0) {
                    return Decision.flagged(true);
                }
                return Decision.resolved(ConflictStrategy.RECENCY, newest);
            case FLAG:
            default:
                return Decision.flagged(false);
        }
    }

    private List<String> authorityOrder(QueryIntent intent) {
        Map<QueryIntent, List<String>> authority = properties.getConflict().getAuthority();
        List<String> order = authority == null ? null : authority.get(intent);
        if (order == null && authority != null) {
            order = authority.get(QueryIntent.CURRENT_BEHAVIOR);
        }
        return order == null ? List.of() : order;
    }

    private static int authorityRank(List<String> order, String domainId) {
        int index = order.indexOf(domainId);
        return index < 0 ? order.size() : index;
    }

    private static Comparator<Integer> byItem(List<TaggedItem> items, Comparator<TaggedItem> comparator) {
        return (left, right) -> comparator.compare(items.get(left), items.get(right));
    }

    private static ConflictRecord toRecord(List<TaggedItem> items, ConflictGroup group, Decision decision) {
        ConflictRecord record = new ConflictRecord();
        List<ConflictRecord.Item> members = new ArrayList<>(group.members().size());
        for (int index : group.members()) {
            members.add(toRecordItem(items.get(index)));
        }
        record.setItems(members);
        record.setResolution(decision.applied);
        record.setResolvedTo(decision.winner == null ? null : toRecordItem(decision.winner));
        record.setReasons(group.reasons());
        return record;
    }

    private static ConflictRecord.Item toRecordItem(TaggedItem item) {
        ConflictRecord.Item recordItem = new ConflictRecord.Item();
        recordItem.setChunkId(item.chunkId());
        recordItem.setAgentId(item.agentId());
        recordItem.setDomainId(item.domainId());
        recordItem.setContent(item.content());
        recordItem.setNormalizedScore(item.normalized());
        recordItem.setCitation(item.item().getCitation());
        return recordItem;
    }

    private static final class Decision {
        private final ConflictStrategy applied;
        private final TaggedItem winner;
        private final boolean hasNotionalOrder;

        private Decision(ConflictStrategy applied, TaggedItem winner, boolean hasNotionalOrder) {
            this.applied = applied;
            this.winner = winner;
            this.hasNotionalOrder = hasNotionalOrder;
        }

        static Decision resolved(ConflictStrategy applied, TaggedItem winner) {
            return new Decision(applied, winner, true);
        }

        static Decision flagged(boolean hasNotionalOrder) {
            return new Decision(ConflictStrategy.FLAG, null, hasNotionalOrder);
        }
    }
}
