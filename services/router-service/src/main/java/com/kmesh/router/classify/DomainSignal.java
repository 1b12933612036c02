package com.kmesh.router.classify;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class DomainSignal {
    @JsonProperty("domain_id")
    private String domainId;
    private double score;
    private List<String> keywords = new ArrayList<>();

    public DomainSignal() {
    }

    public DomainSignal(String domainId, double score, List<String> keywords) {
        this.domainId = domainId;
        this.score = score;
        this.keywords = keywords == null ? new ArrayList<>() : new ArrayList<>(keywords);
    }

    public String getDomainId() {
        return domainId;
    }

    public void setDomainId(String domainId) {
        this.domainId = domainId;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }
}
