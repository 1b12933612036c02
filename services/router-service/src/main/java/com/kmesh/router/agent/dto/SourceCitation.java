package com.kmesh.router.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceCitation {
    @JsonProperty("document_id")
    private String documentId;

    @JsonProperty("chunk_id")
    private String chunkId;

    @JsonProperty("domain_id")
    private String domainId;

    @JsonProperty("source_path")
    private String sourcePath;

    @JsonProperty("line_range")
    private List<Integer> lineRange;

    private Instant timestamp;

    public SourceCitation() {
    }

    public SourceCitation(String documentId, String chunkId, String domainId, String sourcePath, Instant timestamp) {
        this.documentId = documentId;
        this.chunkId = chunkId;
        this.domainId = domainId;
        this.sourcePath = sourcePath;
        this.timestamp = timestamp;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public String getChunkId() {
        return chunkId;
    }

    public void setChunkId(String chunkId) {
        this.chunkId = chunkId;
    }

    public String getDomainId() {
        return domainId;
    }

    public void setDomainId(String domainId) {
        this.domainId = domainId;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    public List<Integer> getLineRange() {
        return lineRange;
    }

    public void setLineRange(List<Integer> lineRange) {
        this.lineRange = lineRange;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
