package com.kmesh.fusion.pipeline.conflict;

public enum QueryIntent {
    CURRENT_BEHAVIOR,
    INTENDED_DESIGN,
    HISTORICAL_DECISION
}
