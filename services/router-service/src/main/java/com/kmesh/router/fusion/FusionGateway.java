package com.kmesh.router.fusion;

import com.kmesh.router.fusion.dto.FuseRequest;
import com.kmesh.router.fusion.dto.FusionResult;
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

@Component
public class FusionGateway {
    private final RestTemplate restTemplate;
    private final FusionServiceProperties properties;

    public FusionGateway(
        @Qualifier("fusionServiceRestTemplate") RestTemplate restTemplate,
        FusionServiceProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public FusionResult fuse(FuseRequest request, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add("x-trace-id", request.getTraceId());
        headers.add("x-request-id", requestId);

        HttpEntity<FuseRequest> entity = new HttpEntity<>(request, headers);
        try {
            ResponseEntity<FusionResult> response = restTemplate.exchange(
                buildUrl("/fuse"),
                HttpMethod.POST,
                entity,
                FusionResult.class
            );
            FusionResult body = response.getBody();
            if (body == null) {
                throw new FusionUnavailableException("Fusion service returned an empty body");
            }
            return body;
        } catch (ResourceAccessException e) {
            throw new FusionUnavailableException("Fusion service unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new FusionUnavailableException("Fusion service error: " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new FusionUnavailableException("Fusion service response unreadable", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
