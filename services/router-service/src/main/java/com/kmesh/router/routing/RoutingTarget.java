package com.kmesh.router.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public class RoutingTarget {
    @JsonProperty("domain_id")
    private String domainId;

    @JsonProperty("agent_id")
    private String agentId;

    private double relevance;

    @JsonProperty("rewritten_query")
    private String rewrittenQuery;

    @JsonIgnore
    private String baseUrl;

    public RoutingTarget() {
    }

    public RoutingTarget(String domainId, String agentId, String baseUrl, double relevance) {
        this.domainId = domainId;
        this.agentId = agentId;
        this.baseUrl = baseUrl;
        this.relevance = relevance;
    }

    public String getDomainId() {
        return domainId;
    }

    public void setDomainId(String domainId) {
        this.domainId = domainId;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public double getRelevance() {
        return relevance;
    }

    public void setRelevance(double relevance) {
        this.relevance = relevance;
    }

    public String getRewrittenQuery() {
        return rewrittenQuery;
    }

    public void setRewrittenQuery(String rewrittenQuery) {
        this.rewrittenQuery = rewrittenQuery;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
