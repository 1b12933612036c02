package com.kmesh.router.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class HttpRegistrySourceTest {

    private MockRestServiceServer server;
    private HttpRegistrySource source;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        source = new HttpRegistrySource(restTemplate, "http://registry.local/");
    }

    @Test
    void readsAgentList() {
        server.expect(requestTo("http://registry.local/agents"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(
                "{\"total\":2,\"agents\":["
                    + "{\"agent_id\":\"code-agent\",\"base_url\":\"http://code:9101\",\"status\":\"READY\","
                    + "\"domain\":{\"domain_id\":\"code\",\"name\":\"Source code\",\"keywords\":[\"function\"]}},"
                    + "{\"agent_id\":\"docs-agent\",\"base_url\":\"http://docs:9102\",\"status\":\"DRAINING\","
                    + "\"domain\":{\"domain_id\":\"docs\",\"name\":\"Documentation\"}}]}",
                MediaType.APPLICATION_JSON
            ));

        List<DomainRegistration> registrations = source.load();

        assertThat(registrations).hasSize(2);
        assertThat(registrations.get(0).domainId()).isEqualTo("code");
        assertThat(registrations.get(0).getBaseUrl()).isEqualTo("http://code:9101");
        assertThat(registrations.get(1).getStatus()).isEqualTo(AgentStatus.DRAINING);
        assertThat(RegistrySnapshot.of(registrations, 0L).domainIds()).containsExactly("code");
    }

    @Test
    void serverErrorMeansRegistryUnavailable() {
        server.expect(requestTo("http://registry.local/agents")).andRespond(withServerError());

        assertThatThrownBy(() -> source.load()).isInstanceOf(RegistryUnavailableException.class);
    }
}
