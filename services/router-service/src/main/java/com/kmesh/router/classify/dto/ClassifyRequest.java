package com.kmesh.router.classify.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.registry.DomainDescriptor;
import java.util.ArrayList;
import java.util.List;

public class ClassifyRequest {
    @JsonProperty("query_text")
    private String queryText;
    private List<DomainDescriptor> domains = new ArrayList<>();

    public ClassifyRequest() {
    }

    public ClassifyRequest(String queryText, List<DomainDescriptor> domains) {
        this.queryText = queryText;
        this.domains = domains;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public List<DomainDescriptor> getDomains() {
        return domains;
    }

    public void setDomains(List<DomainDescriptor> domains) {
        this.domains = domains;
    }
}
