package com.kmesh.router.classify;

import com.kmesh.router.registry.DomainDescriptor;
import java.util.List;

/**
 * Scores how relevant each known domain is to a query. One implementation is chosen at startup
 * by {@code router.classifier.mode}.
 */
public interface DomainSignalSource {
    ClassificationResult classify(String queryText, List<DomainDescriptor> domains, String traceId);

    String name();
}
