package com.kmesh.router.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

public class RecallItem {
    @JsonProperty("chunk_id")
    private String chunkId;

    private String content;
    private Double score;
    private SourceCitation citation;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public RecallItem() {
    }

    public RecallItem(String chunkId, String content, Double score, SourceCitation citation) {
        this.chunkId = chunkId;
        this.content = content;
        this.score = score;
        this.citation = citation;
    }

    public String getChunkId() {
        return chunkId;
    }

    public void setChunkId(String chunkId) {
        this.chunkId = chunkId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }

    public SourceCitation getCitation() {
        return citation;
    }

    public void setCitation(SourceCitation citation) {
        this.citation = citation;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }
}
