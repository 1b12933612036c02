package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.api.dto.CoverageGap;
import java.util.List;

public record CollectedItems(
    List<TaggedItem> items,
    List<CoverageGap> gaps,
    int agentsResponded,
    long totalCandidatesSearched
) {
    public CollectedItems {
        items = List.copyOf(items);
        gaps = List.copyOf(gaps);
    }
}
