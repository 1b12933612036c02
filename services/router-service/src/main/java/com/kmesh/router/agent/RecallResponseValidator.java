package com.kmesh.router.agent;

import com.kmesh.router.agent.dto.RecallItem;
import com.kmesh.router.agent.dto.RecallResponse;
import com.kmesh.router.routing.RoutingTarget;
import java.util.List;

final class RecallResponseValidator {
    private RecallResponseValidator() {
    }

    static RecallResponse validate(RecallResponse response, RoutingTarget target) {
        if (response == null) {
            throw new AgentProtocolException("empty response body");
        }
        if (response.getDomainId() == null) {
            response.setDomainId(target.getDomainId());
        } else if (!response.getDomainId().equals(target.getDomainId())) {
            throw new AgentProtocolException("domain_id " + response.getDomainId() + " does not match " + target.getDomainId());
        }
        if (response.getAgentId() == null) {
            response.setAgentId(target.getAgentId());
        }
        List<RecallItem> items = response.getItems();
        for (int i = 0; i < items.size(); i++) {
            RecallItem item = items.get(i);
            if (item == null) {
                throw new AgentProtocolException("item " + i + " is null");
            }
            Double score = item.getScore();
            if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
                throw new AgentProtocolException("item " + i + " score " + score + " outside [0,1]");
            }
            if (item.getCitation() == null) {
                throw new AgentProtocolException("item " + i + " has no citation");
            }
            if (item.getContent() == null) {
                throw new AgentProtocolException("item " + i + " has no content");
            }
        }
        return response;
    }
}
