package com.kmesh.router.registry;

import com.kmesh.router.config.RouterProperties;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RegistryConfig {

    @Bean
    public RestTemplate registryRestTemplate(RestTemplateBuilder builder, RouterProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getRegistry().getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getRegistry().getTimeoutMs()))
            .build();
    }

    @Bean
    public RegistrySource registrySource(
        RouterProperties properties,
        @Qualifier("registryRestTemplate") RestTemplate registryRestTemplate
    ) {
        RouterProperties.Registry registry = properties.getRegistry();
        if (registry.getSource() == RegistrySourceType.HTTP) {
            return new HttpRegistrySource(registryRestTemplate, registry.getBaseUrl());
        }
        return new StaticRegistrySource(registry.getAgents());
    }
}
