package com.kmesh.router.fusion.dto;

public enum ConflictStrategy {
    RECENCY,
    SOURCE_AUTHORITY,
    CONFIDENCE,
    FLAG,
    RECENCY_THEN_FLAG
}
