package com.kmesh.router.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Publishes {@link QueryCompletedEvent}s keyed by query id. Sends run on their own executor
 * and are never awaited by the query path.
 */
public class KafkaQueryEventPublisher implements QueryEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaQueryEventPublisher.class);
    static final String EVENT_TYPE = "query_completed";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final String topic;
    private final long sendTimeoutMs;

    public KafkaQueryEventPublisher(
        KafkaTemplate<String, String> kafkaTemplate,
        ObjectMapper objectMapper,
        Executor executor,
        MeterRegistry meterRegistry,
        String topic,
        long sendTimeoutMs
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.topic = topic;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void publish(QueryCompletedEvent event) {
        try {
            executor.execute(() -> send(event));
        } catch (RejectedExecutionException e) {
            record("rejected");
            log.warn("Query event dropped query_id={} error={}", event.getQueryId(), e.getMessage());
        }
    }

    void send(QueryCompletedEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            record("serialization_error");
            log.warn("Failed to serialize query event query_id={} error={}", event.getQueryId(), e.getMessage());
            return;
        }
        try {
            ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.getQueryId(), payload);
            record.headers().add(new RecordHeader("event_type", bytes(EVENT_TYPE)));
            record.headers().add(new RecordHeader("trace_id", bytes(event.getTraceId())));
            kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            record("success");
            log.debug("Query event published query_id={} topic={}", event.getQueryId(), topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record("failure");
            log.warn("Query event publish interrupted query_id={} topic={}", event.getQueryId(), topic);
        } catch (Exception e) {
            record("failure");
            log.warn("Query event publish failed query_id={} topic={} error={}", event.getQueryId(), topic, e.getMessage());
        }
    }

    private void record(String outcome) {
        meterRegistry.counter("router_event_publish_total", "outcome", outcome).increment();
    }

    private static byte[] bytes(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }
}
