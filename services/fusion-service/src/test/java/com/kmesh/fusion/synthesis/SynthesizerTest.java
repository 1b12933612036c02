package com.kmesh.fusion.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.kmesh.fusion.api.dto.CoverageGap;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SynthesizerTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final SynthesisGateway gateway = mock(SynthesisGateway.class);
    private final SynthesisProperties properties = new SynthesisProperties();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private Synthesizer synthesizer;

    @BeforeEach
    void setUp() {
        properties.setTimeoutMs(200);
        synthesizer = new Synthesizer(gateway, new SynthesisPromptBuilder(), properties, executor, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsGeneratedText() {
        when(gateway.generate(anyString(), eq("trace-1"))).thenReturn("Refresh runs in middleware [1].");

        String text = synthesizer.synthesize("how does refresh work", List.of(), List.of(), List.of(), null, "trace-1");

        assertThat(text).isEqualTo("Refresh runs in middleware [1].");
        assertThat(meterRegistry.counter("fusion_synthesis_total", "outcome", "ok").count()).isEqualTo(1.0);
    }

    @Test
    void timeoutYieldsNull() {
        when(gateway.generate(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(2_000L);
            return "late";
        });

        long started = System.nanoTime();
        String text = synthesizer.synthesize("q", List.of(), List.of(), List.of(), 50, "trace-2");
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertThat(text).isNull();
        assertThat(elapsedMs).isLessThan(1_000L);
        assertThat(meterRegistry.counter("fusion_synthesis_total", "outcome", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    void gatewayFailureYieldsNull() {
        when(gateway.generate(anyString(), anyString())).thenThrow(new SynthesisUnavailableException("Synthesis service unavailable"));

        String text = synthesizer.synthesize("q", List.of(), List.of(), List.of(new CoverageGap("code", "code-agent", "timeout after 5000ms")), null, "trace-3");

        assertThat(text).isNull();
        assertThat(meterRegistry.counter("fusion_synthesis_total", "outcome", "error").count()).isEqualTo(1.0);
    }

    @Test
    void disabledOrExhaustedDeadlineSkipsTheCall() {
        assertThat(synthesizer.synthesize("q", List.of(), List.of(), List.of(), 0, "trace-4")).isNull();

        properties.setEnabled(false);
        assertThat(synthesizer.synthesize("q", List.of(), List.of(), List.of(), null, "trace-4")).isNull();

        verifyNoInteractions(gateway);
    }
}
