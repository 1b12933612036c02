package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.pipeline.conflict.LoserPolicy;
import com.kmesh.fusion.pipeline.conflict.QueryIntent;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fusion")
public class FusionProperties {
    private Dedup dedup = new Dedup();
    private Conflict conflict = new Conflict();
    private Ranking ranking = new Ranking();

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Conflict getConflict() {
        return conflict;
    }

    public void setConflict(Conflict conflict) {
        this.conflict = conflict;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public void setRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    public static class Dedup {
        private double threshold = 0.85;
        private int bucketingMinItems = 200;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getBucketingMinItems() {
            return bucketingMinItems;
        }

        public void setBucketingMinItems(int bucketingMinItems) {
            this.bucketingMinItems = bucketingMinItems;
        }
    }

    public static class Conflict {
        private Duration tieWindow = Duration.ofHours(24);
        private LoserPolicy loserPolicy = LoserPolicy.DEMOTE;
        private double demotionPenalty = 0.5;
        private double flaggedPenalty = 0.0;
        private double negationOverlap = 0.6;
        private double temporalOverlap = 0.5;
        private boolean semanticOppositionEnabled = true;
        private double unrelatedFloor = 0.1;
        private double queryCoverage = 0.5;
        private Map<QueryIntent, List<String>> authority = defaultAuthority();

        private static Map<QueryIntent, List<String>> defaultAuthority() {
            Map<QueryIntent, List<String>> orders = new EnumMap<>(QueryIntent.class);
            orders.put(QueryIntent.CURRENT_BEHAVIOR, List.of("code", "docs", "conversations", "research"));
            orders.put(QueryIntent.INTENDED_DESIGN, List.of("docs", "research", "conversations", "code"));
            orders.put(QueryIntent.HISTORICAL_DECISION, List.of("conversations", "docs", "research", "code"));
            return orders;
        }

        public Duration getTieWindow() {
            return tieWindow;
        }

        public void setTieWindow(Duration tieWindow) {
            this.tieWindow = tieWindow;
        }

        public LoserPolicy getLoserPolicy() {
            return loserPolicy;
        }

        public void setLoserPolicy(LoserPolicy loserPolicy) {
            this.loserPolicy = loserPolicy;
        }

        public double getDemotionPenalty() {
            return demotionPenalty;
        }

        public void setDemotionPenalty(double demotionPenalty) {
            this.demotionPenalty = demotionPenalty;
        }

        public double getFlaggedPenalty() {
            return flaggedPenalty;
        }

        public void setFlaggedPenalty(double flaggedPenalty) {
            this.flaggedPenalty = flaggedPenalty;
        }

        public double getNegationOverlap() {
            return negationOverlap;
        }

        public void setNegationOverlap(double negationOverlap) {
            this.negationOverlap = negationOverlap;
        }

        public double getTemporalOverlap() {
            return temporalOverlap;
        }

        public void setTemporalOverlap(double temporalOverlap) {
            this.temporalOverlap = temporalOverlap;
        }

        public boolean isSemanticOppositionEnabled() {
            return semanticOppositionEnabled;
        }

        public void setSemanticOppositionEnabled(boolean semanticOppositionEnabled) {
            this.semanticOppositionEnabled = semanticOppositionEnabled;
        }

        public double getUnrelatedFloor() {
            return unrelatedFloor;
        }

        public void setUnrelatedFloor(double unrelatedFloor) {
            this.unrelatedFloor = unrelatedFloor;
        }

        public double getQueryCoverage() {
            return queryCoverage;
        }

        public void setQueryCoverage(double queryCoverage) {
            this.queryCoverage = queryCoverage;
        }

        public Map<QueryIntent, List<String>> getAuthority() {
            return authority;
        }

        public void setAuthority(Map<QueryIntent, List<String>> authority) {
            this.authority = authority;
        }
    }

    public static class Ranking {
        private double normalizedScoreWeight = 0.50;
        private double corroborationWeight = 0.15;
        private double recencyWeight = 0.15;
        private double domainRelevanceWeight = 0.10;
        private double lengthWeight = 0.10;
        private double recencyDecayDays = 90.0;

        public double getNormalizedScoreWeight() {
            return normalizedScoreWeight;
        }

        public void setNormalizedScoreWeight(double normalizedScoreWeight) {
            this.normalizedScoreWeight = normalizedScoreWeight;
        }

        public double getCorroborationWeight() {
            return corroborationWeight;
        }

        public void setCorroborationWeight(double corroborationWeight) {
            this.corroborationWeight = corroborationWeight;
        }

        public double getRecencyWeight() {
            return recencyWeight;
        }

        public void setRecencyWeight(double recencyWeight) {
            this.recencyWeight = recencyWeight;
        }

        public double getDomainRelevanceWeight() {
            return domainRelevanceWeight;
        }

        public void setDomainRelevanceWeight(double domainRelevanceWeight) {
            this.domainRelevanceWeight = domainRelevanceWeight;
        }

        public double getLengthWeight() {
            return lengthWeight;
        }

        public void setLengthWeight(double lengthWeight) {
            this.lengthWeight = lengthWeight;
        }

        public double getRecencyDecayDays() {
            return recencyDecayDays;
        }

        public void setRecencyDecayDays(double recencyDecayDays) {
            this.recencyDecayDays = recencyDecayDays;
        }
    }
}
