package com.kmesh.router.classify;

public enum ClassifierMode {
    KEYWORD,
    TERM_VECTOR,
    LLM
}
