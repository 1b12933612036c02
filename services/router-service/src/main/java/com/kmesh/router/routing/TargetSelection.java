package com.kmesh.router.routing;

import java.util.List;

public record TargetSelection(List<RoutingTarget> targets, boolean broadcast) {
    public TargetSelection {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
