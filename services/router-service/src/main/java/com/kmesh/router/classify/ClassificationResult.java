package com.kmesh.router.classify;

import java.util.List;
import java.util.Map;

/**
 * Signals for every domain the backend scored, plus optional per-domain query rewrites.
 */
public record ClassificationResult(List<DomainSignal> signals, Map<String, String> rewrites) {
    public ClassificationResult {
        signals = signals == null ? List.of() : List.copyOf(signals);
        rewrites = rewrites == null ? Map.of() : Map.copyOf(rewrites);
    }

    public static ClassificationResult of(List<DomainSignal> signals) {
        return new ClassificationResult(signals, Map.of());
    }
}
