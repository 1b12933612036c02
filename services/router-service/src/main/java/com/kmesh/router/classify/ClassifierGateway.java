package com.kmesh.router.classify;

import com.kmesh.router.classify.dto.ClassifyRequest;
import com.kmesh.router.classify.dto.ClassifyResponse;
import com.kmesh.router.config.RouterProperties;
import com.kmesh.router.registry.DomainDescriptor;
import java.util.List;
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
public class ClassifierGateway {
    private final RestTemplate restTemplate;
    private final RouterProperties properties;

    public ClassifierGateway(
        @Qualifier("classifierRestTemplate") RestTemplate restTemplate,
        RouterProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public ClassifyResponse classify(String queryText, List<DomainDescriptor> domains, String traceId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (traceId != null) {
            headers.add("x-trace-id", traceId);
        }
        HttpEntity<ClassifyRequest> entity = new HttpEntity<>(new ClassifyRequest(queryText, domains), headers);

        try {
            ResponseEntity<ClassifyResponse> response = restTemplate.exchange(
                buildUrl("/classify"),
                HttpMethod.POST,
                entity,
                ClassifyResponse.class
            );
            if (response.getBody() == null) {
                throw new ClassifierUnavailableException("Classifier returned an empty body");
            }
            return response.getBody();
        } catch (ResourceAccessException e) {
            throw new ClassifierUnavailableException("Classifier unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new ClassifierUnavailableException("Classifier error: " + e.getStatusCode(), e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getClassifier().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
