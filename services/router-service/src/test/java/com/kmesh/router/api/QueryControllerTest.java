package com.kmesh.router.api;

import static com.kmesh.router.RouterFixtures.plan;
import static com.kmesh.router.RouterFixtures.target;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.kmesh.router.api.dto.QueryResponse;
import com.kmesh.router.fusion.FusionUnavailableException;
import com.kmesh.router.fusion.dto.ConflictStrategy;
import com.kmesh.router.fusion.dto.FusionResult;
import com.kmesh.router.routing.InvalidQueryException;
import com.kmesh.router.routing.RoutingPlan;
import com.kmesh.router.service.QueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QueryController.class)
class QueryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryService queryService;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void queryReturnsPlanAndResult() throws Exception {
        RoutingPlan plan = plan("q-1", target("code"));
        plan.getTargets().get(0).setRewrittenQuery("token refresh middleware");
        FusionResult result = new FusionResult();
        result.setQueryId("q-1");
        QueryResponse response = new QueryResponse();
        response.setStatus("complete");
        response.setQueryId("q-1");
        response.setTraceId("trace-1");
        response.setPlan(plan);
        response.setResult(result);
        when(queryService.query(
            argThat(request -> request.getTopK() == 5 && request.getConflictStrategy() == ConflictStrategy.FLAG),
            eq("trace-1"),
            eq("req-1")
        )).thenReturn(response);

        mockMvc.perform(post("/query")
                .header("x-trace-id", "trace-1")
                .header("x-request-id", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_text\":\"how is the token refreshed\",\"top_k\":5,\"conflict_strategy\":\"FLAG\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("complete"))
            .andExpect(jsonPath("$.query_id").value("q-1"))
            .andExpect(jsonPath("$.plan.targets[0].domain_id").value("code"))
            .andExpect(jsonPath("$.plan.targets[0].rewritten_query").value("token refresh middleware"))
            .andExpect(jsonPath("$.plan.targets[0].base_url").doesNotExist())
            .andExpect(jsonPath("$.plan.targets[0].baseUrl").doesNotExist())
            .andExpect(jsonPath("$.result.query_id").value("q-1"));
    }

    @Test
    void invalidQueryIsBadRequest() throws Exception {
        when(queryService.query(any(), anyString(), anyString()))
            .thenThrow(new InvalidQueryException("query_text is required"));

        mockMvc.perform(post("/query")
                .header("x-trace-id", "trace-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_text\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("query_text is required"))
            .andExpect(jsonPath("$.trace_id").value("trace-2"))
            .andExpect(jsonPath("$.request_id").exists());
    }

    @Test
    void fusionOutageIsBadGateway() throws Exception {
        when(queryService.query(any(), anyString(), anyString()))
            .thenThrow(new FusionUnavailableException("Fusion service unavailable"));

        mockMvc.perform(post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_text\":\"how is the token refreshed\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error.code").value("fusion_unavailable"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_text\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void routeReturnsPlanOnly() throws Exception {
        RoutingPlan plan = plan("q-3", target("docs"));
        plan.setBroadcast(true);
        when(queryService.route(any(), eq("trace-3"))).thenReturn(plan);

        mockMvc.perform(post("/route")
                .header("x-trace-id", "trace-3")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_text\":\"anything\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query_id").value("q-3"))
            .andExpect(jsonPath("$.broadcast").value(true))
            .andExpect(jsonPath("$.targets[0].agent_id").value("docs-agent"))
            .andExpect(jsonPath("$.created_at").value("2024-06-01T00:00:00Z"));
    }

    @Test
    void routeRejectsUnknownDomain() throws Exception {
        when(queryService.route(any(), anyString())).thenThrow(new InvalidQueryException("unknown domain: legal"));

        mockMvc.perform(post("/route")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_text\":\"anything\",\"domains\":[\"legal\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("unknown domain: legal"));
    }
}
