package com.kmesh.fusion.synthesis;

import com.kmesh.fusion.synthesis.dto.GenerateRequest;
import com.kmesh.fusion.synthesis.dto.GenerateResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class SynthesisGateway {
    private final RestTemplate restTemplate;
    private final SynthesisProperties properties;

    public SynthesisGateway(
        @Qualifier("synthesisRestTemplate") RestTemplate restTemplate,
        SynthesisProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public String generate(String prompt, String traceId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (traceId != null && !traceId.isBlank()) {
            headers.add("x-trace-id", traceId);
        }
        HttpEntity<GenerateRequest> entity = new HttpEntity<>(new GenerateRequest(prompt, properties.getMaxTokens()), headers);

        try {
            ResponseEntity<GenerateResponse> response = restTemplate.exchange(
                buildUrl("/generate"),
                HttpMethod.POST,
                entity,
                GenerateResponse.class
            );
            GenerateResponse body = response.getBody();
            if (body == null || body.getText() == null || body.getText().isBlank()) {
                throw new SynthesisUnavailableException("Synthesis returned no text");
            }
            return body.getText().trim();
        } catch (ResourceAccessException e) {
            throw new SynthesisUnavailableException("Synthesis service unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new SynthesisUnavailableException("Synthesis service error: " + e.getStatusCode(), e);
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
