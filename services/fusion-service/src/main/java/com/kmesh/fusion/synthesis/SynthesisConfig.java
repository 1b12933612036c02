package com.kmesh.fusion.synthesis;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(SynthesisProperties.class)
public class SynthesisConfig {

    @Bean
    public RestTemplate synthesisRestTemplate(RestTemplateBuilder builder, SynthesisProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService synthesisExecutor(SynthesisProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getPoolSize()));
    }
}
