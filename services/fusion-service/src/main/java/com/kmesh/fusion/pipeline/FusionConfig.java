package com.kmesh.fusion.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FusionProperties.class)
public class FusionConfig {
    private static final Logger log = LoggerFactory.getLogger(FusionConfig.class);

    @Bean
    public RankingWeights rankingWeights(FusionProperties properties) {
        RankingWeights weights = RankingWeights.from(properties.getRanking());
        log.info("ranking weights accepted {}", weights);
        return weights;
    }
}
