package com.kmesh.router.routing;

import com.kmesh.router.api.dto.QueryRequest;
import com.kmesh.router.classify.ClassificationResult;
import com.kmesh.router.classify.DomainSignal;
import com.kmesh.router.classify.DomainSignalSource;
import com.kmesh.router.config.RouterProperties;
import com.kmesh.router.registry.DomainRegistry;
import com.kmesh.router.registry.RegistrySnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
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
 * Builds the routing plan for one query: validates the request, classifies it under the
 * classification budget (never past the query deadline), selects targets and attaches
 * accepted rewrites.
 *
 * <p>Classification never fails the query. A timeout, a backend error or a malformed signal
 * degrades to broadcast over every registered domain.
 */
@Component
public class RoutingPlanner {
    private static final Logger log = LoggerFactory.getLogger(RoutingPlanner.class);

    private final DomainRegistry registry;
    private final DomainSignalSource signalSource;
    private final TargetSelector targetSelector;
    private final QueryRewriter queryRewriter;
    private final RouterProperties properties;
    private final ExecutorService classificationExecutor;
    private final MeterRegistry meterRegistry;

    public RoutingPlanner(
        DomainRegistry registry,
        DomainSignalSource signalSource,
        TargetSelector targetSelector,
        QueryRewriter queryRewriter,
        RouterProperties properties,
        @Qualifier("classificationExecutor") ExecutorService classificationExecutor,
        MeterRegistry meterRegistry
    ) {
        this.registry = registry;
        this.signalSource = signalSource;
        this.targetSelector = targetSelector;
        this.queryRewriter = queryRewriter;
        this.properties = properties;
        this.classificationExecutor = classificationExecutor;
        this.meterRegistry = meterRegistry;
    }

    public RoutingPlan plan(QueryRequest request, String queryId, String traceId) {
        long startedAt = System.currentTimeMillis();
        validate(request);
        long deadlineAt = startedAt + request.getTimeoutMs();
        String queryText = request.getQueryText().trim();
        RegistrySnapshot snapshot = registry.snapshot();

        RoutingPlan plan = new RoutingPlan();
        plan.setQueryId(queryId);
        plan.setOriginalText(queryText);
        plan.setTraceId(traceId);
        plan.setCreatedAt(Instant.now());

        if (request.getDomains() != null && !request.getDomains().isEmpty()) {
            TargetSelection selection = targetSelector.explicit(request.getDomains(), snapshot);
            plan.setTargets(selection.targets());
            log.debug("routing explicit query_id={} domains={}", queryId, request.getDomains());
            return plan;
        }

        ClassificationResult classification = classify(queryText, snapshot, queryId, traceId, deadlineAt);
        TargetSelection selection;
        if (classification == null) {
            selection = targetSelector.broadcast(List.of(), snapshot);
        } else {
            plan.setSignals(classification.signals());
            selection = targetSelector.select(classification.signals(), snapshot);
            applyRewrites(queryText, selection.targets(), classification.rewrites());
        }
        plan.setTargets(selection.targets());
        plan.setBroadcast(selection.broadcast());

        if (selection.broadcast()) {
            meterRegistry.counter("router_broadcast_total").increment();
            log.warn("routing broadcast query_id={} domains={} classified={}",
                queryId, selection.targets().size(), classification != null);
        } else {
            log.debug("routing selected query_id={} targets={}", queryId, selection.targets().size());
        }
        return plan;
    }

    private void validate(QueryRequest request) {
        if (request == null) {
            throw new InvalidQueryException("request body is required");
        }
        if (request.getQueryText() == null || request.getQueryText().isBlank()) {
            throw new InvalidQueryException("query_text is required");
        }
        if (request.getQueryText().length() > properties.getMaxQueryLength()) {
            throw new InvalidQueryException("query_text exceeds " + properties.getMaxQueryLength() + " characters");
        }
        if (request.getTopK() == null || request.getTopK() <= 0) {
            throw new InvalidQueryException("top_k must be positive");
        }
        if (request.getTimeoutMs() == null || request.getTimeoutMs() <= 0) {
            throw new InvalidQueryException("timeout_ms must be positive");
        }
    }

    private ClassificationResult classify(
        String queryText,
        RegistrySnapshot snapshot,
        String queryId,
        String traceId,
        long deadlineAt
    ) {
        if (snapshot.size() == 0) {
            return ClassificationResult.of(List.of());
        }
        long remainingMs = deadlineAt - System.currentTimeMillis();
        if (remainingMs <= 0) {
            log.warn("classification skipped query_id={} reason=deadline_reached", queryId);
            return null;
        }
        long configuredMs = properties.getClassifier().getBudgetMs();
        long budgetMs = configuredMs > 0 ? Math.min(configuredMs, remainingMs) : remainingMs;
        CompletableFuture<ClassificationResult> future = CompletableFuture.supplyAsync(
            () -> signalSource.classify(queryText, snapshot.descriptors(), traceId),
            classificationExecutor
        );
        ClassificationResult result;
        try {
            result = future.get(budgetMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("classification timed out query_id={} source={} budget_ms={}", queryId, signalSource.name(), budgetMs);
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("classification failed query_id={} source={} error={}", queryId, signalSource.name(), cause.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("classification interrupted query_id={}", queryId);
            return null;
        }
        if (result == null) {
            return ClassificationResult.of(List.of());
        }
        for (DomainSignal signal : result.signals()) {
            double score = signal.getScore();
            if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                log.error("classification returned out-of-range score query_id={} source={} domain_id={} score={}",
                    queryId, signalSource.name(), signal.getDomainId(), score);
                return null;
            }
        }
        return result;
    }

    private void applyRewrites(String queryText, List<RoutingTarget> targets, Map<String, String> rewrites) {
        if (rewrites == null || rewrites.isEmpty()) {
            return;
        }
        for (RoutingTarget target : targets) {
            target.setRewrittenQuery(queryRewriter.rewrite(queryText, rewrites.get(target.getDomainId())));
        }
    }
}
