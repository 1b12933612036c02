package com.kmesh.router.fusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.agent.dto.CoverageGap;
import com.kmesh.router.agent.dto.RecallResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FuseRequest {
    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("original_text")
    private String originalText;

    private List<RecallResponse> responses = new ArrayList<>();

    @JsonProperty("coverage_gaps")
    private List<CoverageGap> coverageGaps = new ArrayList<>();

    @JsonProperty("conflict_strategy")
    private ConflictStrategy conflictStrategy = ConflictStrategy.RECENCY;

    private boolean synthesize;

    @JsonProperty("domain_signals")
    private Map<String, Double> domainSignals = new LinkedHashMap<>();

    @JsonProperty("as_of")
    private Instant asOf;

    @JsonProperty("deadline_ms")
    private Integer deadlineMs;

    @JsonProperty("trace_id")
    private String traceId;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getOriginalText() {
        return originalText;
    }

    public void setOriginalText(String originalText) {
        this.originalText = originalText;
    }

    public List<RecallResponse> getResponses() {
        return responses;
    }

    public void setResponses(List<RecallResponse> responses) {
        this.responses = responses == null ? new ArrayList<>() : responses;
    }

    public List<CoverageGap> getCoverageGaps() {
        return coverageGaps;
    }

    public void setCoverageGaps(List<CoverageGap> coverageGaps) {
        this.coverageGaps = coverageGaps == null ? new ArrayList<>() : coverageGaps;
    }

    public ConflictStrategy getConflictStrategy() {
        return conflictStrategy;
    }

    public void setConflictStrategy(ConflictStrategy conflictStrategy) {
        this.conflictStrategy = conflictStrategy == null ? ConflictStrategy.RECENCY : conflictStrategy;
    }

    public boolean isSynthesize() {
        return synthesize;
    }

    public void setSynthesize(boolean synthesize) {
        this.synthesize = synthesize;
    }

    public Map<String, Double> getDomainSignals() {
        return domainSignals;
    }

    public void setDomainSignals(Map<String, Double> domainSignals) {
        this.domainSignals = domainSignals == null ? new LinkedHashMap<>() : domainSignals;
    }

    public Instant getAsOf() {
        return asOf;
    }

    public void setAsOf(Instant asOf) {
        this.asOf = asOf;
    }

    public Integer getDeadlineMs() {
        return deadlineMs;
    }

    public void setDeadlineMs(Integer deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }
}
