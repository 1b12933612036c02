package com.kmesh.router.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view of the routable registrations, one per domain, keyed by domain id.
 */
public final class RegistrySnapshot {
    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Map.of(), 0L);

    private final Map<String, DomainRegistration> byDomain;
    private final long loadedAtMs;

    private RegistrySnapshot(Map<String, DomainRegistration> byDomain, long loadedAtMs) {
        this.byDomain = byDomain;
        this.loadedAtMs = loadedAtMs;
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    /**
     * Keeps READY and DEGRADED registrations. When a domain is claimed twice, a READY agent wins
     * over a DEGRADED one and otherwise the first listed agent is kept.
     */
    public static RegistrySnapshot of(Collection<DomainRegistration> registrations, long loadedAtMs) {
        Map<String, DomainRegistration> byDomain = new TreeMap<>();
        for (DomainRegistration registration : registrations) {
            if (registration == null || registration.getStatus() == null || !registration.getStatus().isRoutable()) {
                continue;
            }
            String domainId = registration.domainId();
            if (domainId == null || domainId.isBlank() || registration.getAgentId() == null) {
                continue;
            }
            DomainRegistration existing = byDomain.get(domainId);
            if (existing == null
                || (existing.getStatus() == AgentStatus.DEGRADED && registration.getStatus() == AgentStatus.READY)) {
                byDomain.put(domainId, registration);
            }
        }
        return new RegistrySnapshot(Collections.unmodifiableMap(byDomain), loadedAtMs);
    }

    public boolean isRegistered(String domainId) {
        return domainId != null && byDomain.containsKey(domainId);
    }

    public DomainRegistration get(String domainId) {
        return domainId == null ? null : byDomain.get(domainId);
    }

    public List<String> domainIds() {
        return new ArrayList<>(byDomain.keySet());
    }

    public List<DomainDescriptor> descriptors() {
        List<DomainDescriptor> descriptors = new ArrayList<>(byDomain.size());
        for (DomainRegistration registration : byDomain.values()) {
            descriptors.add(registration.getDomain());
        }
        return descriptors;
    }

    public int size() {
        return byDomain.size();
    }

    public long getLoadedAtMs() {
        return loadedAtMs;
    }

    public boolean isOlderThan(long ttlMs, long nowMs) {
        return nowMs - loadedAtMs > ttlMs;
    }
}
