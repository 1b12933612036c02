package com.kmesh.router.routing;

import com.kmesh.router.classify.DomainSignal;
import com.kmesh.router.config.RouterProperties;
import com.kmesh.router.registry.DomainRegistration;
import com.kmesh.router.registry.RegistrySnapshot;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns domain signals into an ordered target list.
 *
 * <p>Primaries (score at or above the primary threshold) are always taken and padded with
 * secondaries up to {@code maxDomains}; without primaries the secondaries are taken up to the
 * cap. When nothing reaches the secondary threshold every registered domain is targeted.
 */
@Component
public class TargetSelector {
    private static final Logger log = LoggerFactory.getLogger(TargetSelector.class);

    private static final Comparator<DomainSignal> STRONGEST_FIRST = Comparator
        .comparingDouble(DomainSignal::getScore).reversed()
        .thenComparing(DomainSignal::getDomainId);

    private final RouterProperties properties;

    public TargetSelector(RouterProperties properties) {
        this.properties = properties;
    }

    public TargetSelection select(List<DomainSignal> signals, RegistrySnapshot registry) {
        double primary = properties.getPrimaryThreshold();
        double secondary = properties.getSecondaryThreshold();
        int maxDomains = Math.max(1, properties.getMaxDomains());

        List<DomainSignal> primaries = new ArrayList<>();
        List<DomainSignal> secondaries = new ArrayList<>();
        for (DomainSignal signal : strongestPerDomain(signals)) {
            if (!registry.isRegistered(signal.getDomainId())) {
                log.warn("routing skipped unregistered domain domain_id={} score={}", signal.getDomainId(), signal.getScore());
                continue;
            }
            if (signal.getScore() >= primary) {
                primaries.add(signal);
            } else if (signal.getScore() >= secondary) {
                secondaries.add(signal);
            }
        }

        List<DomainSignal> chosen = new ArrayList<>(primaries);
        for (DomainSignal signal : secondaries) {
            if (chosen.size() >= maxDomains) {
                break;
            }
            chosen.add(signal);
        }
        if (chosen.isEmpty()) {
            return broadcast(signals, registry);
        }

        List<RoutingTarget> targets = new ArrayList<>(chosen.size());
        for (DomainSignal signal : chosen) {
            targets.add(toTarget(registry.get(signal.getDomainId()), signal.getScore()));
        }
        return new TargetSelection(targets, false);
    }

    /**
     * Every registered domain, strongest signal first, then by domain id.
     */
    public TargetSelection broadcast(List<DomainSignal> signals, RegistrySnapshot registry) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (DomainSignal signal : strongestPerDomain(signals)) {
            scores.put(signal.getDomainId(), signal.getScore());
        }
        List<String> domains = new ArrayList<>(registry.domainIds());
        domains.sort(Comparator
            .comparingDouble((String domainId) -> scores.getOrDefault(domainId, 0.0)).reversed()
            .thenComparing(Comparator.<String>naturalOrder()));

        List<RoutingTarget> targets = new ArrayList<>(domains.size());
        for (String domainId : domains) {
            targets.add(toTarget(registry.get(domainId), scores.getOrDefault(domainId, 0.0)));
        }
        return new TargetSelection(targets, true);
    }

    /**
     * Caller-named domains, in the order given. Unknown or unroutable domains are rejected.
     */
    public TargetSelection explicit(List<String> domainIds, RegistrySnapshot registry) {
        Set<String> unique = new LinkedHashSet<>();
        for (String domainId : domainIds) {
            if (domainId == null || domainId.isBlank()) {
                throw new InvalidQueryException("domains must not contain blank entries");
            }
            unique.add(domainId.trim());
        }
        List<RoutingTarget> targets = new ArrayList<>(unique.size());
        for (String domainId : unique) {
            if (!registry.isRegistered(domainId)) {
                throw new InvalidQueryException("unknown domain: " + domainId);
            }
            targets.add(toTarget(registry.get(domainId), 1.0));
        }
        return new TargetSelection(targets, false);
    }

    private static List<DomainSignal> strongestPerDomain(List<DomainSignal> signals) {
        List<DomainSignal> sorted = new ArrayList<>();
        if (signals != null) {
            for (DomainSignal signal : signals) {
                if (signal != null && signal.getDomainId() != null) {
                    sorted.add(signal);
                }
            }
        }
        sorted.sort(STRONGEST_FIRST);
        Set<String> seen = new LinkedHashSet<>();
        List<DomainSignal> unique = new ArrayList<>(sorted.size());
        for (DomainSignal signal : sorted) {
            if (seen.add(signal.getDomainId())) {
                unique.add(signal);
            }
        }
        return unique;
    }

    private static RoutingTarget toTarget(DomainRegistration registration, double relevance) {
        return new RoutingTarget(registration.domainId(), registration.getAgentId(), registration.getBaseUrl(), relevance);
    }
}
