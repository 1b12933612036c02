package com.kmesh.router.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class RecallResponse {
    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("domain_id")
    private String domainId;

    private List<RecallItem> items = new ArrayList<>();

    @JsonProperty("total_searched")
    private long totalSearched;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("trace_id")
    private String traceId;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getDomainId() {
        return domainId;
    }

    public void setDomainId(String domainId) {
        this.domainId = domainId;
    }

    public List<RecallItem> getItems() {
        return items;
    }

    public void setItems(List<RecallItem> items) {
        this.items = items == null ? new ArrayList<>() : items;
    }

    public long getTotalSearched() {
        return totalSearched;
    }

    public void setTotalSearched(long totalSearched) {
        this.totalSearched = totalSearched;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public void setLatencyMs(long latencyMs) {
        this.latencyMs = latencyMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }
}
