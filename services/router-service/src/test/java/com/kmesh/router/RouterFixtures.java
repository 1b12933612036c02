package com.kmesh.router;

import com.kmesh.router.agent.dto.RecallItem;
import com.kmesh.router.agent.dto.RecallResponse;
import com.kmesh.router.agent.dto.SourceCitation;
import com.kmesh.router.registry.AgentStatus;
import com.kmesh.router.registry.DomainDescriptor;
import com.kmesh.router.registry.DomainRegistration;
import com.kmesh.router.registry.RegistrySnapshot;
import com.kmesh.router.routing.RoutingPlan;
import com.kmesh.router.routing.RoutingTarget;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class RouterFixtures {
    private RouterFixtures() {
    }

    public static DomainRegistration registration(String domainId, AgentStatus status, String... keywords) {
        DomainDescriptor descriptor = new DomainDescriptor(domainId, domainId, domainId + " knowledge", Arrays.asList(keywords));
        return new DomainRegistration(domainId + "-agent", "http://" + domainId + ".local", status, descriptor);
    }

    public static RegistrySnapshot snapshot(String... domainIds) {
        List<DomainRegistration> registrations = new ArrayList<>();
        for (String domainId : domainIds) {
            registrations.add(registration(domainId, AgentStatus.READY));
        }
        return RegistrySnapshot.of(registrations, 0L);
    }

    public static RoutingTarget target(String domainId) {
        return new RoutingTarget(domainId, domainId + "-agent", "http://" + domainId + ".local", 0.8);
    }

    public static RoutingPlan plan(String queryId, RoutingTarget... targets) {
        RoutingPlan plan = new RoutingPlan();
        plan.setQueryId(queryId);
        plan.setOriginalText("how is the session token refreshed");
        plan.setTraceId("trace-1");
        plan.setCreatedAt(Instant.parse("2024-06-01T00:00:00Z"));
        plan.setTargets(new ArrayList<>(Arrays.asList(targets)));
        return plan;
    }

    public static RecallResponse response(String queryId, String domainId, double... scores) {
        RecallResponse response = new RecallResponse();
        response.setQueryId(queryId);
        response.setDomainId(domainId);
        response.setAgentId(domainId + "-agent");
        response.setTotalSearched(50);
        List<RecallItem> items = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            String chunkId = domainId + "-" + i;
            SourceCitation citation = new SourceCitation("doc-" + chunkId, chunkId, domainId, domainId + "/file" + i, null);
            items.add(new RecallItem(chunkId, "content " + chunkId, scores[i], citation));
        }
        response.setItems(items);
        return response;
    }
}
