package com.kmesh.router.registry;

import java.util.ArrayList;
import java.util.List;

public class AgentListResponse {
    private List<DomainRegistration> agents = new ArrayList<>();
    private int total;

    public List<DomainRegistration> getAgents() {
        return agents;
    }

    public void setAgents(List<DomainRegistration> agents) {
        this.agents = agents;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }
}
