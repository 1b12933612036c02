package com.kmesh.router.classify;

import com.kmesh.router.config.RouterProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ClassifierConfig {
    private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

    @Bean
    public RestTemplate classifierRestTemplate(RestTemplateBuilder builder, RouterProperties properties) {
        long budgetMs = properties.getClassifier().getBudgetMs();
        return builder
            .setConnectTimeout(Duration.ofMillis(budgetMs))
            .setReadTimeout(Duration.ofMillis(budgetMs))
            .build();
    }

    @Bean
    public DomainSignalSource domainSignalSource(RouterProperties properties, ClassifierGateway classifierGateway) {
        ClassifierMode mode = properties.getClassifier().getMode();
        DomainSignalSource source;
        switch (mode == null ? ClassifierMode.KEYWORD : mode) {
            case LLM:
                source = new LlmSignalSource(classifierGateway);
                break;
            case TERM_VECTOR:
                source = new TermVectorSignalSource();
                break;
            case KEYWORD:
            default:
                source = new KeywordSignalSource();
                break;
        }
        log.info("classifier selected mode={} budget_ms={}", source.name(), properties.getClassifier().getBudgetMs());
        return source;
    }
}
