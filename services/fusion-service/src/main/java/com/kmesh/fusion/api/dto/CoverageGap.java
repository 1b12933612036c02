package com.kmesh.fusion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CoverageGap {
    @JsonProperty("domain_id")
    private String domainId;

    @JsonProperty("agent_id")
    private String agentId;

    private String reason;

    public CoverageGap() {
    }

    public CoverageGap(String domainId, String agentId, String reason) {
        this.domainId = domainId;
        this.agentId = agentId;
        this.reason = reason;
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

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
