package com.kmesh.router.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmesh.router.config.RouterProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

@Configuration
public class EventConfig {
    private static final Logger log = LoggerFactory.getLogger(EventConfig.class);

    @Bean
    public QueryEventPublisher queryEventPublisher(
        RouterProperties properties,
        ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
        ObjectMapper objectMapper,
        @Qualifier("eventExecutor") ExecutorService eventExecutor,
        MeterRegistry meterRegistry
    ) {
        RouterProperties.Events events = properties.getEvents();
        KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
        if (!events.isEnabled() || template == null) {
            log.info("query events disabled enabled={} kafka_template={}", events.isEnabled(), template != null);
            return new NoopQueryEventPublisher();
        }
        log.info("query events enabled topic={} send_timeout_ms={}", events.getTopic(), events.getSendTimeoutMs());
        return new KafkaQueryEventPublisher(
            template,
            objectMapper,
            eventExecutor,
            meterRegistry,
            events.getTopic(),
            events.getSendTimeoutMs()
        );
    }
}
