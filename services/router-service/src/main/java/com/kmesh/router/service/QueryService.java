package com.kmesh.router.service;

import com.kmesh.router.agent.dto.CoverageGap;
import com.kmesh.router.api.dto.QueryRequest;
import com.kmesh.router.api.dto.QueryResponse;
import com.kmesh.router.classify.DomainSignal;
import com.kmesh.router.events.QueryCompletedEvent;
import com.kmesh.router.events.QueryEventPublisher;
import com.kmesh.router.fanout.FanOutOrchestrator;
import com.kmesh.router.fanout.FanOutResult;
import com.kmesh.router.fusion.FusionGateway;
import com.kmesh.router.fusion.FusionUnavailableException;
import com.kmesh.router.fusion.dto.FuseRequest;
import com.kmesh.router.fusion.dto.FusionResult;
import com.kmesh.router.routing.RoutingPlan;
import com.kmesh.router.routing.RoutingPlanner;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QueryService {
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final RoutingPlanner planner;
    private final FanOutOrchestrator orchestrator;
    private final FusionGateway fusionGateway;
    private final QueryEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public QueryService(
        RoutingPlanner planner,
        FanOutOrchestrator orchestrator,
        FusionGateway fusionGateway,
        QueryEventPublisher eventPublisher,
        MeterRegistry meterRegistry
    ) {
        this.planner = planner;
        this.orchestrator = orchestrator;
        this.fusionGateway = fusionGateway;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    public RoutingPlan route(QueryRequest request, String traceId) {
        return planner.plan(request, newQueryId(), traceId);
    }

    /**
     * Plans, fans out and fuses one query. Agent failures become coverage gaps and mark the
     * response partial; only an unreachable fusion service fails the call.
     */
    public QueryResponse query(QueryRequest request, String traceId, String requestId) {
        long startedAt = System.currentTimeMillis();
        String queryId = newQueryId();
        RoutingPlan plan = planner.plan(request, queryId, traceId);
        long deadlineAt = startedAt + request.getTimeoutMs();

        FanOutResult fanOut = orchestrator.dispatch(plan, request.getTopK(), request.getFilters(), deadlineAt, requestId);

        FuseRequest fuseRequest = new FuseRequest();
        fuseRequest.setQueryId(queryId);
        fuseRequest.setOriginalText(plan.getOriginalText());
        fuseRequest.setResponses(new ArrayList<>(fanOut.responses()));
        fuseRequest.setCoverageGaps(new ArrayList<>(fanOut.gaps()));
        fuseRequest.setConflictStrategy(request.getConflictStrategy());
        fuseRequest.setSynthesize(request.isSynthesize());
        fuseRequest.setDomainSignals(signalMap(plan.getSignals()));
        fuseRequest.setDeadlineMs((int) Math.max(1L, deadlineAt - System.currentTimeMillis()));
        fuseRequest.setTraceId(traceId);

        FusionResult result;
        try {
            result = fusionGateway.fuse(fuseRequest, requestId);
        } catch (FusionUnavailableException e) {
            meterRegistry.counter("router_query_total", "status", "error").increment();
            log.warn("fusion failed query_id={} error={}", queryId, e.getMessage());
            throw e;
        }

        List<CoverageGap> gaps = result.getCoverageGaps() == null ? fanOut.gaps() : result.getCoverageGaps();
        boolean partial = !gaps.isEmpty() || plan.getTargets().isEmpty();
        String status = partial ? QueryResponse.STATUS_PARTIAL : QueryResponse.STATUS_COMPLETE;
        meterRegistry.counter("router_query_total", "status", status).increment();

        eventPublisher.publish(QueryCompletedEvent.from(result, gaps, Instant.now()));

        log.info("query completed query_id={} status={} targets={} gaps={} items={} latency_ms={}",
            queryId, status, plan.getTargets().size(), gaps.size(),
            result.getItems() == null ? 0 : result.getItems().size(),
            System.currentTimeMillis() - startedAt);

        QueryResponse response = new QueryResponse();
        response.setStatus(status);
        response.setQueryId(queryId);
        response.setTraceId(traceId);
        response.setPlan(plan);
        response.setResult(result);
        return response;
    }

    private static Map<String, Double> signalMap(List<DomainSignal> signals) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (DomainSignal signal : signals) {
            map.merge(signal.getDomainId(), signal.getScore(), Math::max);
        }
        return map;
    }

    private static String newQueryId() {
        return UUID.randomUUID().toString();
    }
}
