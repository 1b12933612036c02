package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.api.dto.CoverageGap;
import com.kmesh.fusion.api.dto.RecallItem;
import com.kmesh.fusion.api.dto.RecallResponse;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Stage 1. Flattens agent responses into tagged items, keeping each agent's own order.
 */
@Component
public class Collector {
    static final String STAGE = "collect";

    public CollectedItems collect(List<RecallResponse> responses, List<CoverageGap> gaps) {
        List<TaggedItem> items = new ArrayList<>();
        int agentsResponded = 0;
        long totalSearched = 0L;
        if (responses != null) {
            for (RecallResponse response : responses) {
                if (response == null) {
                    continue;
                }
                requireText(response.getAgentId(), "response agent_id is required");
                requireText(response.getDomainId(), "response domain_id is required");
                agentsResponded++;
                totalSearched += Math.max(0L, response.getTotalSearched());
                if (response.getItems() == null) {
                    continue;
                }
                for (RecallItem item : response.getItems()) {
                    validate(item, response.getAgentId());
                    items.add(TaggedItem.of(item, response.getAgentId(), response.getDomainId(), response.getLatencyMs()));
                }
            }
        }
        return new CollectedItems(items, gaps == null ? List.of() : gaps, agentsResponded, totalSearched);
    }

    private void validate(RecallItem item, String agentId) {
        if (item == null) {
            throw new FusionPipelineException(STAGE, "null item from agent " + agentId);
        }
        requireText(item.getChunkId(), "item chunk_id is required (agent " + agentId + ")");
        if (item.getContent() == null) {
            throw new FusionPipelineException(STAGE, "item " + item.getChunkId() + " has no content");
        }
        Double score = item.getScore();
        if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
            throw new FusionPipelineException(STAGE, "item " + item.getChunkId() + " score out of range: " + score);
        }
        if (item.getCitation() == null || item.getCitation().getTimestamp() == null) {
            throw new FusionPipelineException(STAGE, "item " + item.getChunkId() + " has no citation timestamp");
        }
    }

    private void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new FusionPipelineException(STAGE, message);
        }
    }
}
