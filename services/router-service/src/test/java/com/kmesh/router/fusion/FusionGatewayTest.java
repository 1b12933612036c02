package com.kmesh.router.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.kmesh.router.fusion.dto.ConflictStrategy;
import com.kmesh.router.fusion.dto.FuseRequest;
import com.kmesh.router.fusion.dto.FusionResult;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class FusionGatewayTest {

    private MockRestServiceServer server;
    private FusionGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        FusionServiceProperties properties = new FusionServiceProperties();
        properties.setBaseUrl("http://fusion.local/");
        gateway = new FusionGateway(restTemplate, properties);
    }

    @Test
    void postsFuseRequestAndReadsResult() {
        server.expect(requestTo("http://fusion.local/fuse"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("x-trace-id", "trace-1"))
            .andExpect(header("x-request-id", "req-1"))
            .andExpect(jsonPath("$.query_id").value("q-1"))
            .andExpect(jsonPath("$.conflict_strategy").value("SOURCE_AUTHORITY"))
            .andExpect(jsonPath("$.domain_signals.code").value(0.8))
            .andExpect(jsonPath("$.deadline_ms").value(1500))
            .andRespond(withSuccess(
                "{\"query_id\":\"q-1\",\"trace_id\":\"trace-1\",\"items\":[{\"rank\":1,\"chunk_id\":\"c1\","
                    + "\"content\":\"x\",\"score\":0.9,\"normalized_score\":1.0,\"rank_score\":0.8,"
                    + "\"domain_id\":\"code\",\"agent_id\":\"code-agent\",\"demoted\":false}],"
                    + "\"conflicts\":[],\"coverage_gaps\":[],\"domains_queried\":[\"code\"],"
                    + "\"total_latency_ms\":12,\"stats\":{\"agents_responded\":1,\"duplicates_removed\":0}}",
                MediaType.APPLICATION_JSON
            ));

        FuseRequest request = new FuseRequest();
        request.setQueryId("q-1");
        request.setOriginalText("how is the token refreshed");
        request.setConflictStrategy(ConflictStrategy.SOURCE_AUTHORITY);
        request.setDomainSignals(Map.of("code", 0.8));
        request.setDeadlineMs(1500);
        request.setTraceId("trace-1");

        FusionResult result = gateway.fuse(request, "req-1");

        assertThat(result.getItems()).hasSize(1);
        assertThat(result.getItems().get(0).getRankScore()).isEqualTo(0.8);
        assertThat(result.getDomainsQueried()).containsExactly("code");
        assertThat(result.getStats().getAgentsResponded()).isEqualTo(1);
        server.verify();
    }

    @Test
    void serverErrorMeansFusionUnavailable() {
        server.expect(requestTo("http://fusion.local/fuse")).andRespond(withServerError());

        FuseRequest request = new FuseRequest();
        request.setQueryId("q-2");

        assertThatThrownBy(() -> gateway.fuse(request, "req-2"))
            .isInstanceOf(FusionUnavailableException.class)
            .hasMessage("Fusion service error: 500");
    }
}
