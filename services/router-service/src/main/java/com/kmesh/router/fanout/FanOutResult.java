package com.kmesh.router.fanout;

import com.kmesh.router.agent.dto.CoverageGap;
import com.kmesh.router.agent.dto.RecallResponse;
import java.util.List;

/**
 * Responses in target order, plus one gap per target that produced no usable response.
 */
public record FanOutResult(List<RecallResponse> responses, List<CoverageGap> gaps) {
    public FanOutResult {
        responses = List.copyOf(responses);
        gaps = List.copyOf(gaps);
    }
}
