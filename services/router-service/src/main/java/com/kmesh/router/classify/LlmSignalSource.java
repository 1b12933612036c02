package com.kmesh.router.classify;

import com.kmesh.router.classify.dto.ClassifyResponse;
import com.kmesh.router.registry.DomainDescriptor;
import java.util.List;

/**
 * Generative signals from an external classification model, which may also propose a rewritten
 * query per domain.
 */
public class LlmSignalSource implements DomainSignalSource {
    private final ClassifierGateway gateway;

    public LlmSignalSource(ClassifierGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public ClassificationResult classify(String queryText, List<DomainDescriptor> domains, String traceId) {
        ClassifyResponse response = gateway.classify(queryText, domains, traceId);
        return new ClassificationResult(response.getSignals(), response.getRewrites());
    }

    @Override
    public String name() {
        return "llm";
    }
}
