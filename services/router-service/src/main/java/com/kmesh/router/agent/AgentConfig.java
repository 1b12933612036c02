package com.kmesh.router.agent;

import com.kmesh.router.config.RouterProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AgentConfig {
    @Bean
    public RestTemplate agentRestTemplate(RestTemplateBuilder builder, RouterProperties properties) {
        return builder
            .requestFactory(() -> new CallBudgetRequestFactory(properties.getAgentTimeoutMs()))
            .build();
    }
}
