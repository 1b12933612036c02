package com.kmesh.fusion.pipeline;

import java.util.List;

public record DedupResult(List<TaggedItem> items, int duplicatesRemoved) {
    public DedupResult {
        items = List.copyOf(items);
    }
}
