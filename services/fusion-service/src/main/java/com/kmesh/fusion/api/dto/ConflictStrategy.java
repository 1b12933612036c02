package com.kmesh.fusion.api.dto;

public enum ConflictStrategy {
    RECENCY,
    SOURCE_AUTHORITY,
    CONFIDENCE,
    FLAG,
    RECENCY_THEN_FLAG
}
