package com.kmesh.router.fusion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.agent.dto.SourceCitation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FusedItem {
    private int rank;

    @JsonProperty("chunk_id")
    private String chunkId;

    private String content;
    private double score;

    @JsonProperty("normalized_score")
    private double normalizedScore;

    @JsonProperty("rank_score")
    private double rankScore;

    @JsonProperty("domain_id")
    private String domainId;

    @JsonProperty("agent_id")
    private String agentId;

    private SourceCitation citation;

    @JsonProperty("corroborating_citations")
    private List<SourceCitation> corroboratingCitations = new ArrayList<>();

    private boolean demoted;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
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

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public double getNormalizedScore() {
        return normalizedScore;
    }

    public void setNormalizedScore(double normalizedScore) {
        this.normalizedScore = normalizedScore;
    }

    public double getRankScore() {
        return rankScore;
    }

    public void setRankScore(double rankScore) {
        this.rankScore = rankScore;
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

    public SourceCitation getCitation() {
        return citation;
    }

    public void setCitation(SourceCitation citation) {
        this.citation = citation;
    }

    public List<SourceCitation> getCorroboratingCitations() {
        return corroboratingCitations;
    }

    public void setCorroboratingCitations(List<SourceCitation> corroboratingCitations) {
        this.corroboratingCitations = corroboratingCitations == null ? new ArrayList<>() : corroboratingCitations;
    }

    public boolean isDemoted() {
        return demoted;
    }

    public void setDemoted(boolean demoted) {
        this.demoted = demoted;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }
}
