package com.kmesh.router.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.classify.DomainSignal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class RoutingPlan {
    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("original_text")
    private String originalText;

    private List<RoutingTarget> targets = new ArrayList<>();
    private List<DomainSignal> signals = new ArrayList<>();
    private boolean broadcast;

    @JsonProperty("created_at")
    private Instant createdAt;

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

    public List<RoutingTarget> getTargets() {
        return targets;
    }

    public void setTargets(List<RoutingTarget> targets) {
        this.targets = targets;
    }

    public List<DomainSignal> getSignals() {
        return signals;
    }

    public void setSignals(List<DomainSignal> signals) {
        this.signals = signals;
    }

    public boolean isBroadcast() {
        return broadcast;
    }

    public void setBroadcast(boolean broadcast) {
        this.broadcast = broadcast;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }
}
