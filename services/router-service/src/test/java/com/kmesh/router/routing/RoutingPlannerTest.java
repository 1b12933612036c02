package com.kmesh.router.routing;

import static com.kmesh.router.RouterFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.kmesh.router.api.dto.QueryRequest;
import com.kmesh.router.classify.ClassificationResult;
import com.kmesh.router.classify.ClassifierUnavailableException;
import com.kmesh.router.classify.DomainSignal;
import com.kmesh.router.classify.DomainSignalSource;
import com.kmesh.router.config.RouterProperties;
import com.kmesh.router.registry.DomainRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RoutingPlannerTest {

    private static final String QUERY = "how is the session token refreshed";

    @Mock
    private DomainRegistry registry;

    @Mock
    private DomainSignalSource signalSource;

    private RouterProperties properties;
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private RoutingPlanner planner;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        properties.getClassifier().setBudgetMs(200);
        executor = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();
        when(registry.snapshot()).thenReturn(snapshot("code", "docs", "conversations"));
        when(signalSource.name()).thenReturn("test");
        planner = new RoutingPlanner(
            registry,
            signalSource,
            new TargetSelector(properties),
            new QueryRewriter(properties),
            properties,
            executor,
            meterRegistry
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void selectsTargetsAndAppliesAcceptedRewrites() {
        when(signalSource.classify(eq(QUERY), anyList(), eq("trace-1"))).thenReturn(new ClassificationResult(
            List.of(signal("code", 0.8), signal("docs", 0.4), signal("conversations", 0.05)),
            Map.of("code", "session token refresh middleware", "docs", "How is the session token refreshed")
        ));

        RoutingPlan plan = planner.plan(request(QUERY), "q-1", "trace-1");

        assertThat(plan.getQueryId()).isEqualTo("q-1");
        assertThat(plan.getTraceId()).isEqualTo("trace-1");
        assertThat(plan.getOriginalText()).isEqualTo(QUERY);
        assertThat(plan.isBroadcast()).isFalse();
        assertThat(plan.getSignals()).hasSize(3);
        assertThat(plan.getTargets()).extracting(RoutingTarget::getDomainId).containsExactly("code", "docs");
        assertThat(plan.getTargets().get(0).getRewrittenQuery()).isEqualTo("session token refresh middleware");
        assertThat(plan.getTargets().get(1).getRewrittenQuery()).isNull();
        assertThat(meterRegistry.find("router_broadcast_total").counter()).isNull();
    }

    @Test
    void classificationTimeoutBroadcasts() {
        when(signalSource.classify(anyString(), anyList(), any())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return ClassificationResult.of(List.of(signal("code", 0.9)));
        });

        long started = System.currentTimeMillis();
        RoutingPlan plan = planner.plan(request(QUERY), "q-2", "trace-2");

        assertThat(System.currentTimeMillis() - started).isLessThan(1500);
        assertThat(plan.isBroadcast()).isTrue();
        assertThat(plan.getTargets()).extracting(RoutingTarget::getDomainId)
            .containsExactly("code", "conversations", "docs");
        assertThat(meterRegistry.counter("router_broadcast_total").count()).isEqualTo(1.0);
    }

    @Test
    void classificationWaitIsCappedByQueryDeadline() {
        properties.getClassifier().setBudgetMs(2000);
        when(signalSource.classify(anyString(), anyList(), any())).thenAnswer(invocation -> {
            Thread.sleep(3000);
            return ClassificationResult.of(List.of(signal("code", 0.9)));
        });
        QueryRequest request = request(QUERY);
        request.setTimeoutMs(150);

        long started = System.currentTimeMillis();
        RoutingPlan plan = planner.plan(request, "q-2b", "trace-2b");

        assertThat(System.currentTimeMillis() - started).isLessThan(1000);
        assertThat(plan.isBroadcast()).isTrue();
    }

    @Test
    void classifierErrorBroadcasts() {
        when(signalSource.classify(anyString(), anyList(), any()))
            .thenThrow(new ClassifierUnavailableException("Classifier unavailable"));

        RoutingPlan plan = planner.plan(request(QUERY), "q-3", "trace-3");

        assertThat(plan.isBroadcast()).isTrue();
        assertThat(plan.getTargets()).hasSize(3);
        assertThat(plan.getSignals()).isEmpty();
    }

    @Test
    void outOfRangeScoreIsNotClampedAndBroadcasts() {
        when(signalSource.classify(anyString(), anyList(), any()))
            .thenReturn(ClassificationResult.of(List.of(signal("code", 1.4), signal("docs", 0.7))));

        RoutingPlan plan = planner.plan(request(QUERY), "q-4", "trace-4");

        assertThat(plan.isBroadcast()).isTrue();
        assertThat(plan.getSignals()).isEmpty();
        assertThat(plan.getTargets()).hasSize(3);
    }

    @Test
    void explicitDomainsBypassClassification() {
        QueryRequest request = request(QUERY);
        request.setDomains(List.of("docs", "code"));

        RoutingPlan plan = planner.plan(request, "q-5", "trace-5");

        assertThat(plan.isBroadcast()).isFalse();
        assertThat(plan.getTargets()).extracting(RoutingTarget::getDomainId).containsExactly("docs", "code");
        verifyNoInteractions(signalSource);
    }

    @Test
    void explicitUnknownDomainIsRejected() {
        QueryRequest request = request(QUERY);
        request.setDomains(List.of("legal"));

        assertThatThrownBy(() -> planner.plan(request, "q-6", "trace-6"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("unknown domain: legal");
    }

    @Test
    void rejectsInvalidRequests() {
        assertThatThrownBy(() -> planner.plan(null, "q", "t")).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> planner.plan(request("  "), "q", "t"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("query_text is required");

        properties.setMaxQueryLength(10);
        assertThatThrownBy(() -> planner.plan(request("a query that is far too long"), "q", "t"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("exceeds 10");

        properties.setMaxQueryLength(4000);
        QueryRequest zeroTopK = request(QUERY);
        zeroTopK.setTopK(0);
        assertThatThrownBy(() -> planner.plan(zeroTopK, "q", "t"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("top_k must be positive");

        QueryRequest zeroTimeout = request(QUERY);
        zeroTimeout.setTimeoutMs(0);
        assertThatThrownBy(() -> planner.plan(zeroTimeout, "q", "t"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("timeout_ms must be positive");
        verifyNoInteractions(signalSource);
    }

    private static QueryRequest request(String text) {
        QueryRequest request = new QueryRequest();
        request.setQueryText(text);
        return request;
    }

    private static DomainSignal signal(String domainId, double score) {
        return new DomainSignal(domainId, score, List.of());
    }
}
