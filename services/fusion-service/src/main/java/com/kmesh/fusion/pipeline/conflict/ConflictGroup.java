package com.kmesh.fusion.pipeline.conflict;

import java.util.List;

/**
 * Indices (into the detector's input list, ascending) of items that contradict each other,
 * directly or transitively, with the rules that fired.
 */
public record ConflictGroup(List<Integer> members, List<String> reasons) {
    public ConflictGroup {
        members = List.copyOf(members);
        reasons = List.copyOf(reasons);
    }
}
