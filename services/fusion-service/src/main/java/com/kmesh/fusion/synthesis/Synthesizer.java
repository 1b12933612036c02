package com.kmesh.fusion.synthesis;

import com.kmesh.fusion.api.dto.ConflictRecord;
import com.kmesh.fusion.api.dto.CoverageGap;
import com.kmesh.fusion.api.dto.FusedItem;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Stage 6. Optional narrative digest. Any failure yields {@code null}; synthesis never fails
 * the fusion request.
 */
@Component
public class Synthesizer {
    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final SynthesisGateway gateway;
    private final SynthesisPromptBuilder promptBuilder;
    private final SynthesisProperties properties;
    private final ExecutorService synthesisExecutor;
    private final MeterRegistry meterRegistry;

    public Synthesizer(
        SynthesisGateway gateway,
        SynthesisPromptBuilder promptBuilder,
        SynthesisProperties properties,
        @Qualifier("synthesisExecutor") ExecutorService synthesisExecutor,
        MeterRegistry meterRegistry
    ) {
        this.gateway = gateway;
        this.promptBuilder = promptBuilder;
        this.properties = properties;
        this.synthesisExecutor = synthesisExecutor;
        this.meterRegistry = meterRegistry;
    }

    public String synthesize(
        String queryText,
        List<FusedItem> items,
        List<ConflictRecord> conflicts,
        List<CoverageGap> gaps,
        Integer deadlineMs,
        String traceId
    ) {
        if (!properties.isEnabled()) {
            record("disabled");
            return null;
        }
        long timeoutMs = resolveTimeoutMs(deadlineMs);
        if (timeoutMs <= 0) {
            log.warn("synthesis skipped trace_id={} reason=deadline_exhausted", traceId);
            record("skipped");
            return null;
        }
        String prompt = promptBuilder.build(queryText, items, conflicts, gaps, properties.getTopN(), properties.getMaxTokens());
        CompletableFuture<String> future = CompletableFuture.supplyAsync(
            () -> gateway.generate(prompt, traceId),
            synthesisExecutor
        );
        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            record("ok");
            return text;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("synthesis timed out trace_id={} timeout_ms={}", traceId, timeoutMs);
            record("timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("synthesis failed trace_id={} error={}", traceId, cause.getMessage());
            record("error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("synthesis interrupted trace_id={}", traceId);
            record("interrupted");
        }
        return null;
    }

    private long resolveTimeoutMs(Integer deadlineMs) {
        long timeoutMs = Math.max(0, properties.getTimeoutMs());
        if (deadlineMs != null) {
            timeoutMs = Math.min(timeoutMs, Math.max(0, deadlineMs));
        }
        return timeoutMs;
    }

    private void record(String outcome) {
        meterRegistry.counter("fusion_synthesis_total", "outcome", outcome).increment();
    }
}
