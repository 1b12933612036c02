package com.kmesh.router.fusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.agent.dto.SourceCitation;
import java.util.ArrayList;
import java.util.List;

public class ConflictRecord {
    private List<Item> items = new ArrayList<>();
    private ConflictStrategy resolution;

    @JsonProperty("resolved_to")
    private Item resolvedTo;

    private List<String> reasons = new ArrayList<>();

    public List<Item> getItems() {
        return items;
    }

    public void setItems(List<Item> items) {
        this.items = items == null ? new ArrayList<>() : items;
    }

    public ConflictStrategy getResolution() {
        return resolution;
    }

    public void setResolution(ConflictStrategy resolution) {
        this.resolution = resolution;
    }

    public Item getResolvedTo() {
        return resolvedTo;
    }

    public void setResolvedTo(Item resolvedTo) {
        this.resolvedTo = resolvedTo;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public void setReasons(List<String> reasons) {
        this.reasons = reasons == null ? new ArrayList<>() : reasons;
    }

    public static class Item {
        @JsonProperty("chunk_id")
        private String chunkId;

        @JsonProperty("agent_id")
        private String agentId;

        @JsonProperty("domain_id")
        private String domainId;

        private String content;

        @JsonProperty("normalized_score")
        private double normalizedScore;

        private SourceCitation citation;

        public String getChunkId() {
            return chunkId;
        }

        public void setChunkId(String chunkId) {
            this.chunkId = chunkId;
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

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }

        public double getNormalizedScore() {
            return normalizedScore;
        }

        public void setNormalizedScore(double normalizedScore) {
            this.normalizedScore = normalizedScore;
        }

        public SourceCitation getCitation() {
            return citation;
        }

        public void setCitation(SourceCitation citation) {
            this.citation = citation;
        }
    }
}
