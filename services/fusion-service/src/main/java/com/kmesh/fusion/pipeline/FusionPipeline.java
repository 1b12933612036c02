package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.api.dto.FuseRequest;
import com.kmesh.fusion.api.dto.FusedItem;
import com.kmesh.fusion.api.dto.FusionResult;
import com.kmesh.fusion.api.dto.RecallResponse;
import com.kmesh.fusion.pipeline.conflict.ConflictOutcome;
import com.kmesh.fusion.pipeline.conflict.ConflictResolver;
import com.kmesh.fusion.synthesis.Synthesizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the six fusion stages strictly in order over one request. Holds no per-request state.
 */
@Service
public class FusionPipeline {
    private static final Logger log = LoggerFactory.getLogger(FusionPipeline.class);

    private final Collector collector;
    private final ScoreNormalizer normalizer;
    private final Deduplicator deduplicator;
    private final ConflictResolver conflictResolver;
    private final Ranker ranker;
    private final Synthesizer synthesizer;
    private final MeterRegistry meterRegistry;

    public FusionPipeline(
        Collector collector,
        ScoreNormalizer normalizer,
        Deduplicator deduplicator,
        ConflictResolver conflictResolver,
        Ranker ranker,
        Synthesizer synthesizer,
        MeterRegistry meterRegistry
    ) {
        this.collector = collector;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.conflictResolver = conflictResolver;
        this.ranker = ranker;
        this.synthesizer = synthesizer;
        this.meterRegistry = meterRegistry;
    }

    public FusionResult fuse(FuseRequest request, String traceId) {
        if (request == null) {
            throw new InvalidFuseRequestException("request body is required");
        }
        if (request.getQueryId() == null || request.getQueryId().isBlank()) {
            throw new InvalidFuseRequestException("query_id is required");
        }
        long started = System.nanoTime();

        FusionResult result;
        try {
            result = runStages(request);
        } catch (FusionPipelineException e) {
            meterRegistry.counter("fusion_requests_total", "outcome", "pipeline_error").increment();
            log.error("fusion failed query_id={} trace_id={} stage={} error={}", request.getQueryId(), traceId, e.getStage(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            meterRegistry.counter("fusion_requests_total", "outcome", "pipeline_error").increment();
            log.error("fusion failed query_id={} trace_id={}", request.getQueryId(), traceId, e);
            throw new FusionPipelineException("fuse", e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        if (request.isSynthesize()) {
            Integer remainingMs = null;
            if (request.getDeadlineMs() != null) {
                long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
                remainingMs = (int) Math.max(0L, request.getDeadlineMs() - elapsedMs);
            }
            result.setSynthesis(synthesizer.synthesize(
                request.getOriginalText(),
                result.getItems(),
                result.getConflicts(),
                result.getCoverageGaps(),
                remainingMs,
                traceId
            ));
        }

        result.setTraceId(traceId);
        result.setTotalLatencyMs((System.nanoTime() - started) / 1_000_000L);
        meterRegistry.counter(
            "fusion_requests_total",
            "outcome",
            result.getCoverageGaps().isEmpty() ? "complete" : "partial"
        ).increment();
        log.debug(
            "fusion done query_id={} trace_id={} items={} conflicts={} gaps={} took_ms={}",
            request.getQueryId(),
            traceId,
            result.getItems().size(),
            result.getConflicts().size(),
            result.getCoverageGaps().size(),
            result.getTotalLatencyMs()
        );
        return result;
    }

    private FusionResult runStages(FuseRequest request) {
        CollectedItems collected = collector.collect(request.getResponses(), request.getCoverageGaps());
        List<TaggedItem> normalized = normalizer.normalize(collected.items());
        DedupResult deduplicated = deduplicator.deduplicate(normalized);
        ConflictOutcome conflicts = conflictResolver.resolve(
            deduplicated.items(),
            request.getConflictStrategy(),
            request.getOriginalText()
        );
        Instant asOf = resolveAsOf(request, conflicts.items());
        List<FusedItem> ranked = ranker.rank(conflicts.items(), request.getDomainSignals(), asOf);

        FusionResult result = new FusionResult();
        result.setQueryId(request.getQueryId());
        result.setItems(ranked);
        result.setConflicts(new ArrayList<>(conflicts.conflicts()));
        result.setCoverageGaps(new ArrayList<>(collected.gaps()));
        result.setDomainsQueried(resolveDomainsQueried(request));

        FusionResult.Stats stats = new FusionResult.Stats();
        stats.setAgentsResponded(collected.agentsResponded());
        stats.setTotalCandidatesSearched(collected.totalCandidatesSearched());
        stats.setDuplicatesRemoved(deduplicated.duplicatesRemoved());
        stats.setConflictsDetected(conflicts.conflicts().size());
        stats.setItemsDemoted(conflicts.demoted());
        result.setStats(stats);
        return result;
    }

    /**
     * Recency is measured against the request's reference time, or the newest citation in the
     * input, so identical input always ranks identically.
     */
    private Instant resolveAsOf(FuseRequest request, List<TaggedItem> items) {
        if (request.getAsOf() != null) {
            return request.getAsOf();
        }
        Instant newest = Instant.EPOCH;
        for (TaggedItem item : items) {
            if (item.timestamp().isAfter(newest)) {
                newest = item.timestamp();
            }
        }
        return newest;
    }

    /**
     * Domains whose agents answered, in response order. Domains that failed appear only as
     * coverage gaps.
     */
    private List<String> resolveDomainsQueried(FuseRequest request) {
        Set<String> domains = new LinkedHashSet<>();
        if (request.getResponses() == null) {
            return new ArrayList<>();
        }
        for (RecallResponse response : request.getResponses()) {
            if (response != null && response.getDomainId() != null) {
                domains.add(response.getDomainId());
            }
        }
        return new ArrayList<>(domains);
    }
}
