package com.kmesh.router.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kmesh.router.agent.dto.CoverageGap;
import com.kmesh.router.config.RouterExecutionConfig;
import com.kmesh.router.config.RouterProperties;
import com.kmesh.router.fusion.dto.FusedItem;
import com.kmesh.router.fusion.dto.FusionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class KafkaQueryEventPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private SimpleMeterRegistry meterRegistry;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Test
    void publishesEventKeyedByQueryId() throws Exception {
        CompletableFuture<SendResult<String, String>> sent = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, String>>any())).thenReturn(sent);
        KafkaQueryEventPublisher publisher = publisher(Runnable::run);

        publisher.publish(event());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertThat(record.topic()).isEqualTo("kmesh.routing.feedback");
        assertThat(record.key()).isEqualTo("q-1");
        assertThat(new String(record.headers().lastHeader("event_type").value(), StandardCharsets.UTF_8))
            .isEqualTo("query_completed");

        QueryCompletedEvent payload = objectMapper.readValue(record.value(), QueryCompletedEvent.class);
        assertThat(payload.getDomainsQueried()).containsExactly("code", "docs");
        assertThat(payload.getContributingDomains()).containsExactly("docs");
        assertThat(payload.getGapDomains()).containsExactly("research");
        assertThat(payload.getItemCount()).isEqualTo(1);
        assertThat(record.value()).contains("\"emitted_at\":\"2024-06-01T00:00:00Z\"");
        assertThat(meterRegistry.counter("router_event_publish_total", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void sendFailureIsCountedAndSwallowed() {
        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, String>>any())).thenReturn(failed);
        KafkaQueryEventPublisher publisher = publisher(Runnable::run);

        publisher.publish(event());

        assertThat(meterRegistry.counter("router_event_publish_total", "outcome", "failure").count()).isEqualTo(1.0);
    }

    @Test
    void saturatedExecutorDropsTheEvent() {
        KafkaQueryEventPublisher publisher = publisher(task -> {
            throw new RejectedExecutionException("queue full");
        });

        publisher.publish(event());

        verify(kafkaTemplate, never()).send(ArgumentMatchers.<ProducerRecord<String, String>>any());
        assertThat(meterRegistry.counter("router_event_publish_total", "outcome", "rejected").count()).isEqualTo(1.0);
    }

    @Test
    void fullEventQueueDropsInsteadOfBuffering() {
        lenient().when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, String>>any()))
            .thenReturn(new CompletableFuture<>());
        RouterProperties properties = new RouterProperties();
        properties.getEvents().setPoolSize(1);
        properties.getEvents().setQueueCapacity(1);
        ExecutorService executor = new RouterExecutionConfig().eventExecutor(properties);
        KafkaQueryEventPublisher publisher = publisher(executor);

        try {
            publisher.publish(event());
            publisher.publish(event());
            publisher.publish(event());
            publisher.publish(event());
        } finally {
            executor.shutdownNow();
        }

        assertThat(meterRegistry.counter("router_event_publish_total", "outcome", "rejected").count()).isEqualTo(2.0);
    }

    private KafkaQueryEventPublisher publisher(Executor executor) {
        return new KafkaQueryEventPublisher(
            kafkaTemplate, objectMapper, executor, meterRegistry, "kmesh.routing.feedback", 1000);
    }

    private static QueryCompletedEvent event() {
        FusionResult result = new FusionResult();
        result.setQueryId("q-1");
        result.setTraceId("trace-1");
        result.setDomainsQueried(List.of("code", "docs"));
        FusedItem item = new FusedItem();
        item.setDomainId("docs");
        result.setItems(List.of(item));
        return QueryCompletedEvent.from(
            result,
            List.of(new CoverageGap("research", "research-agent", "circuit open")),
            Instant.parse("2024-06-01T00:00:00Z")
        );
    }
}
