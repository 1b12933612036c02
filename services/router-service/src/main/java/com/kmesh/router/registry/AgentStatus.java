package com.kmesh.router.registry;

public enum AgentStatus {
    STARTING,
    READY,
    DEGRADED,
    DRAINING,
    OFFLINE;

    public boolean isRoutable() {
        return this == READY || this == DEGRADED;
    }
}
