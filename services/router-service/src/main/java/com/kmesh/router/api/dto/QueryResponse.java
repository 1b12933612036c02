package com.kmesh.router.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.fusion.dto.FusionResult;
import com.kmesh.router.routing.RoutingPlan;

public class QueryResponse {
    public static final String STATUS_COMPLETE = "complete";
    public static final String STATUS_PARTIAL = "partial";

    private String status;

    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("trace_id")
    private String traceId;

    private RoutingPlan plan;
    private FusionResult result;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public RoutingPlan getPlan() {
        return plan;
    }

    public void setPlan(RoutingPlan plan) {
        this.plan = plan;
    }

    public FusionResult getResult() {
        return result;
    }

    public void setResult(FusionResult result) {
        this.result = result;
    }
}
