package com.kmesh.router.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.fusion.dto.ConflictStrategy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class QueryRequest {
    @JsonProperty("query_text")
    private String queryText;

    @JsonProperty("top_k")
    private Integer topK = 20;

    private List<String> domains;
    private Map<String, Object> filters = new LinkedHashMap<>();
    private boolean synthesize;

    @JsonProperty("conflict_strategy")
    private ConflictStrategy conflictStrategy = ConflictStrategy.RECENCY;

    @JsonProperty("timeout_ms")
    private Integer timeoutMs = 30000;

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    public List<String> getDomains() {
        return domains;
    }

    public void setDomains(List<String> domains) {
        this.domains = domains;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, Object> filters) {
        this.filters = filters == null ? new LinkedHashMap<>() : filters;
    }

    public boolean isSynthesize() {
        return synthesize;
    }

    public void setSynthesize(boolean synthesize) {
        this.synthesize = synthesize;
    }

    public ConflictStrategy getConflictStrategy() {
        return conflictStrategy;
    }

    public void setConflictStrategy(ConflictStrategy conflictStrategy) {
        this.conflictStrategy = conflictStrategy == null ? ConflictStrategy.RECENCY : conflictStrategy;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
