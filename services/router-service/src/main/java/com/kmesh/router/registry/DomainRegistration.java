package com.kmesh.router.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DomainRegistration {
    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("base_url")
    private String baseUrl;

    private AgentStatus status = AgentStatus.STARTING;
    private DomainDescriptor domain;

    public DomainRegistration() {
    }

    public DomainRegistration(String agentId, String baseUrl, AgentStatus status, DomainDescriptor domain) {
        this.agentId = agentId;
        this.baseUrl = baseUrl;
        this.status = status;
        this.domain = domain;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public void setStatus(AgentStatus status) {
        this.status = status;
    }

    public DomainDescriptor getDomain() {
        return domain;
    }

    public void setDomain(DomainDescriptor domain) {
        this.domain = domain;
    }

    public String domainId() {
        return domain == null ? null : domain.getDomainId();
    }
}
