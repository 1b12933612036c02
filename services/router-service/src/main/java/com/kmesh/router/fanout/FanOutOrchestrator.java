package com.kmesh.router.fanout;

import com.kmesh.router.agent.AgentGateway;
import com.kmesh.router.agent.AgentProtocolException;
import com.kmesh.router.agent.dto.CoverageGap;
import com.kmesh.router.agent.dto.RecallRequest;
import com.kmesh.router.agent.dto.RecallResponse;
import com.kmesh.router.config.RouterProperties;
import com.kmesh.router.routing.RoutingPlan;
import com.kmesh.router.routing.RoutingTarget;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Calls every target agent concurrently and waits on all of them under one shared budget:
 * the agent timeout, or the time left before the query deadline when that is shorter.
 *
 * <p>Agents never fail the query. Whatever does not come back in time, errors out, breaks
 * the recall contract or sits behind an open circuit becomes a {@link CoverageGap}. Failed
 * calls are not retried. Calls still running when the budget ends are cancelled with an
 * interrupt; the agent client's read timeout is capped by the same budget, so a call blocked
 * in socket I/O gives its thread back at the deadline too.
 */
@Component
public class FanOutOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FanOutOrchestrator.class);

    static final String REASON_CIRCUIT_OPEN = "circuit open";
    static final String REASON_DEADLINE = "cancelled at query deadline";
    static final String REASON_SATURATED = "fan-out pool saturated";

    private final AgentGateway agentGateway;
    private final AgentCircuitBreakers breakers;
    private final RouterProperties properties;
    private final ExecutorService fanOutExecutor;
    private final MeterRegistry meterRegistry;

    public FanOutOrchestrator(
        AgentGateway agentGateway,
        AgentCircuitBreakers breakers,
        RouterProperties properties,
        @Qualifier("fanOutExecutor") ExecutorService fanOutExecutor,
        MeterRegistry meterRegistry
    ) {
        this.agentGateway = agentGateway;
        this.breakers = breakers;
        this.properties = properties;
        this.fanOutExecutor = fanOutExecutor;
        this.meterRegistry = meterRegistry;
    }

    public FanOutResult dispatch(
        RoutingPlan plan,
        int topK,
        Map<String, Object> filters,
        long deadlineAtMs,
        String requestId
    ) {
        long startedAt = System.currentTimeMillis();
        long remaining = deadlineAtMs - startedAt;
        long agentTimeoutMs = properties.getAgentTimeoutMs();
        boolean deadlineBinds = remaining < agentTimeoutMs;
        long budgetMs = Math.max(0L, Math.min(agentTimeoutMs, remaining));

        Map<RoutingTarget, Future<RecallResponse>> inFlight = new LinkedHashMap<>();
        Map<RoutingTarget, CoverageGap> skipped = new LinkedHashMap<>();
        for (RoutingTarget target : plan.getTargets()) {
            if (budgetMs <= 0) {
                skipped.put(target, gap(target, REASON_DEADLINE, "cancelled", plan.getQueryId()));
                continue;
            }
            CircuitBreaker breaker = breakers.forAgent(target.getAgentId());
            if (!breaker.tryAcquire()) {
                skipped.put(target, gap(target, REASON_CIRCUIT_OPEN, "circuit_open", plan.getQueryId()));
                continue;
            }
            RecallRequest request = buildRequest(plan, target, topK, filters, budgetMs);
            try {
                inFlight.put(target, fanOutExecutor.submit(() -> agentGateway.recall(target, request, requestId)));
            } catch (RejectedExecutionException e) {
                breaker.release();
                skipped.put(target, gap(target, REASON_SATURATED, "rejected", plan.getQueryId()));
            }
        }

        List<RecallResponse> responses = new ArrayList<>();
        List<CoverageGap> gaps = new ArrayList<>();
        long budgetEndsAt = startedAt + budgetMs;
        for (RoutingTarget target : plan.getTargets()) {
            CoverageGap skip = skipped.get(target);
            if (skip != null) {
                gaps.add(skip);
                continue;
            }
            Future<RecallResponse> future = inFlight.get(target);
            if (future == null) {
                continue;
            }
            CircuitBreaker breaker = breakers.forAgent(target.getAgentId());
            long waitMs = Math.max(0L, budgetEndsAt - System.currentTimeMillis());
            try {
                RecallResponse response = future.get(waitMs, TimeUnit.MILLISECONDS);
                breaker.recordSuccess();
                responses.add(response);
            } catch (TimeoutException e) {
                future.cancel(true);
                breaker.recordFailure();
                if (deadlineBinds) {
                    gaps.add(gap(target, REASON_DEADLINE, "cancelled", plan.getQueryId()));
                } else {
                    gaps.add(gap(target, "timeout after " + budgetMs + "ms", "timeout", plan.getQueryId()));
                }
            } catch (ExecutionException e) {
                breaker.recordFailure();
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof AgentProtocolException) {
                    gaps.add(gap(target, "protocol error: " + cause.getMessage(), "protocol", plan.getQueryId()));
                } else {
                    gaps.add(gap(target, errorMessage(cause), "error", plan.getQueryId()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                breaker.release();
                gaps.add(gap(target, "interrupted", "cancelled", plan.getQueryId()));
            }
        }

        log.debug("fan-out finished query_id={} targets={} responses={} gaps={} elapsed_ms={}",
            plan.getQueryId(), plan.getTargets().size(), responses.size(), gaps.size(),
            System.currentTimeMillis() - startedAt);
        return new FanOutResult(responses, gaps);
    }

    private RecallRequest buildRequest(
        RoutingPlan plan,
        RoutingTarget target,
        int topK,
        Map<String, Object> filters,
        long budgetMs
    ) {
        RecallRequest request = new RecallRequest();
        request.setQueryId(plan.getQueryId());
        String rewritten = target.getRewrittenQuery();
        request.setQueryText(rewritten != null ? rewritten : plan.getOriginalText());
        request.setOriginalText(plan.getOriginalText());
        request.setDomainId(target.getDomainId());
        request.setTopK(topK);
        request.setFilters(filters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(filters));
        request.setTraceId(plan.getTraceId());
        request.setTimeoutMs(budgetMs);
        return request;
    }

    private CoverageGap gap(RoutingTarget target, String reason, String reasonTag, String queryId) {
        meterRegistry.counter("router_coverage_gap_total", "reason", reasonTag).increment();
        log.warn("coverage gap query_id={} domain_id={} agent_id={} reason=\"{}\"",
            queryId, target.getDomainId(), target.getAgentId(), reason);
        return new CoverageGap(target.getDomainId(), target.getAgentId(), reason);
    }

    private static String errorMessage(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
