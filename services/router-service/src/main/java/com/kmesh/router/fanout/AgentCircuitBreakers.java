package com.kmesh.router.fanout;

import com.kmesh.router.config.RouterProperties;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class AgentCircuitBreakers {
    private final RouterProperties.Resilience properties;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public AgentCircuitBreakers(RouterProperties properties) {
        this.properties = properties.getResilience();
    }

    public CircuitBreaker forAgent(String agentId) {
        return breakers.computeIfAbsent(agentId,
            id -> new CircuitBreaker(properties.getFailureThreshold(), properties.getOpenMs()));
    }
}
