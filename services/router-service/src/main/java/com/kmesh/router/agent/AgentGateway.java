package com.kmesh.router.agent;

import com.kmesh.router.agent.dto.RecallRequest;
import com.kmesh.router.agent.dto.RecallResponse;
import com.kmesh.router.routing.RoutingTarget;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Synchronous recall call against one domain agent. Transport failures surface as
 * {@link AgentUnavailableException}, contract violations as {@link AgentProtocolException}.
 */
@Component
public class AgentGateway {
    private final RestTemplate restTemplate;

    public AgentGateway(@Qualifier("agentRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public RecallResponse recall(RoutingTarget target, RecallRequest request, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add("x-trace-id", request.getTraceId());
        headers.add("x-request-id", requestId);

        HttpEntity<RecallRequest> entity = new HttpEntity<>(request, headers);
        try {
            String url = buildUrl(target.getBaseUrl(), "/recall");
            ResponseEntity<RecallResponse> response = CallBudgetRequestFactory.withinBudget(
                request.getTimeoutMs(),
                () -> restTemplate.exchange(url, HttpMethod.POST, entity, RecallResponse.class)
            );
            return RecallResponseValidator.validate(response.getBody(), target);
        } catch (ResourceAccessException e) {
            throw new AgentUnavailableException("agent unreachable: " + target.getAgentId(), e);
        } catch (HttpStatusCodeException e) {
            throw new AgentUnavailableException("agent error: " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new AgentProtocolException("unreadable response: " + e.getMessage());
        }
    }

    private static String buildUrl(String base, String path) {
        if (base == null || base.isBlank()) {
            throw new AgentUnavailableException("agent has no base_url");
        }
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return trimmed + path;
    }
}
