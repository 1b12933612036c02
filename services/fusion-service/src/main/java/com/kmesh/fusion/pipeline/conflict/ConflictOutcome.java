package com.kmesh.fusion.pipeline.conflict;

import com.kmesh.fusion.api.dto.ConflictRecord;
import com.kmesh.fusion.pipeline.TaggedItem;
import java.util.List;

public record ConflictOutcome(List<TaggedItem> items, List<ConflictRecord> conflicts, int demoted) {
    public ConflictOutcome {
        items = List.copyOf(items);
        conflicts = List.copyOf(conflicts);
    }
}
