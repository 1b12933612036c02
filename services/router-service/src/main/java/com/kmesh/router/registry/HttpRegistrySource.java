package com.kmesh.router.registry;

import java.util.ArrayList;
import java.util.List;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

public class HttpRegistrySource implements RegistrySource {
    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpRegistrySource(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public List<DomainRegistration> load() {
        try {
            AgentListResponse response = restTemplate.getForObject(buildUrl("/agents"), AgentListResponse.class);
            if (response == null || response.getAgents() == null) {
                throw new RegistryUnavailableException("Registry returned no agent list");
            }
            return new ArrayList<>(response.getAgents());
        } catch (ResourceAccessException e) {
            throw new RegistryUnavailableException("Registry unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new RegistryUnavailableException("Registry error: " + e.getStatusCode(), e);
        }
    }

    @Override
    public String name() {
        return "http";
    }

    private String buildUrl(String path) {
        String base = baseUrl;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
