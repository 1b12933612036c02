package com.kmesh.router.fusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.agent.dto.CoverageGap;
import java.util.ArrayList;
import java.util.List;

public class FusionResult {
    @JsonProperty("query_id")
    private String queryId;

    private List<FusedItem> items = new ArrayList<>();
    private String synthesis;
    private List<ConflictRecord> conflicts = new ArrayList<>();

    @JsonProperty("coverage_gaps")
    private List<CoverageGap> coverageGaps = new ArrayList<>();

    @JsonProperty("domains_queried")
    private List<String> domainsQueried = new ArrayList<>();

    @JsonProperty("total_latency_ms")
    private long totalLatencyMs;

    @JsonProperty("trace_id")
    private String traceId;

    private Stats stats = new Stats();

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public List<FusedItem> getItems() {
        return items;
    }

    public void setItems(List<FusedItem> items) {
        this.items = items;
    }

    public String getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(String synthesis) {
        this.synthesis = synthesis;
    }

    public List<ConflictRecord> getConflicts() {
        return conflicts;
    }

    public void setConflicts(List<ConflictRecord> conflicts) {
        this.conflicts = conflicts;
    }

    public List<CoverageGap> getCoverageGaps() {
        return coverageGaps;
    }

    public void setCoverageGaps(List<CoverageGap> coverageGaps) {
        this.coverageGaps = coverageGaps;
    }

    public List<String> getDomainsQueried() {
        return domainsQueried;
    }

    public void setDomainsQueried(List<String> domainsQueried) {
        this.domainsQueried = domainsQueried;
    }

    public long getTotalLatencyMs() {
        return totalLatencyMs;
    }

    public void setTotalLatencyMs(long totalLatencyMs) {
        this.totalLatencyMs = totalLatencyMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public Stats getStats() {
        return stats;
    }

    public void setStats(Stats stats) {
        this.stats = stats;
    }

    public static class Stats {
        @JsonProperty("agents_responded")
        private int agentsResponded;

        @JsonProperty("total_candidates_searched")
        private long totalCandidatesSearched;

        @JsonProperty("duplicates_removed")
        private int duplicatesRemoved;

        @JsonProperty("conflicts_detected")
        private int conflictsDetected;

        @JsonProperty("items_demoted")
        private int itemsDemoted;

        public int getAgentsResponded() {
            return agentsResponded;
        }

        public void setAgentsResponded(int agentsResponded) {
            this.agentsResponded = agentsResponded;
        }

        public long getTotalCandidatesSearched() {
            return totalCandidatesSearched;
        }

        public void setTotalCandidatesSearched(long totalCandidatesSearched) {
            this.totalCandidatesSearched = totalCandidatesSearched;
        }

        public int getDuplicatesRemoved() {
            return duplicatesRemoved;
        }

        public void setDuplicatesRemoved(int duplicatesRemoved) {
            this.duplicatesRemoved = duplicatesRemoved;
        }

        public int getConflictsDetected() {
            return conflictsDetected;
        }

        public void setConflictsDetected(int conflictsDetected) {
            this.conflictsDetected = conflictsDetected;
        }

        public int getItemsDemoted() {
            return itemsDemoted;
        }

        public void setItemsDemoted(int itemsDemoted) {
            this.itemsDemoted = itemsDemoted;
        }
    }
}
