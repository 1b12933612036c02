package com.kmesh.router.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class DomainDescriptor {
    @JsonProperty("domain_id")
    private String domainId;
    private String name;
    private String description;
    private List<String> keywords = new ArrayList<>();

    public DomainDescriptor() {
    }

    public DomainDescriptor(String domainId, String name, String description, List<String> keywords) {
        this.domainId = domainId;
        this.name = name;
        this.description = description;
        this.keywords = keywords == null ? new ArrayList<>() : new ArrayList<>(keywords);
    }

    public String getDomainId() {
        return domainId;
    }

    public void setDomainId(String domainId) {
        this.domainId = domainId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }
}
