package com.kmesh.router.registry;

import com.kmesh.router.config.RouterProperties;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Process-scoped cache of the agent registry. Loaded once at startup, refreshed on a fixed
 * schedule, and refreshed on read once the snapshot outlives its TTL. A failed refresh keeps
 * serving the previous snapshot.
 */
@Component
public class DomainRegistry {
    private static final Logger log = LoggerFactory.getLogger(DomainRegistry.class);

    private final RegistrySource source;
    private final RouterProperties properties;
    private final LongSupplier clock;
    private final AtomicReference<RegistrySnapshot> snapshot = new AtomicReference<>(RegistrySnapshot.empty());
    private final ReentrantLock refreshLock = new ReentrantLock();

    @Autowired
    public DomainRegistry(RegistrySource source, RouterProperties properties) {
        this(source, properties, System::currentTimeMillis);
    }

    DomainRegistry(RegistrySource source, RouterProperties properties, LongSupplier clock) {
        this.source = source;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        refresh();
    }

    @Scheduled(
        initialDelayString = "${router.registry.refresh-interval-ms:15000}",
        fixedDelayString = "${router.registry.refresh-interval-ms:15000}"
    )
    public void scheduledRefresh() {
        refresh();
    }

    public RegistrySnapshot snapshot() {
        RegistrySnapshot current = snapshot.get();
        if (current.isOlderThan(properties.getRegistry().getTtlMs(), clock.getAsLong()) && refreshLock.tryLock()) {
            try {
                refreshLocked();
            } finally {
                refreshLock.unlock();
            }
            current = snapshot.get();
        }
        return current;
    }

    public boolean refresh() {
        refreshLock.lock();
        try {
            return refreshLocked();
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean refreshLocked() {
        RegistrySnapshot previous = snapshot.get();
        try {
            List<DomainRegistration> registrations = source.load();
            RegistrySnapshot next = RegistrySnapshot.of(registrations, clock.getAsLong());
            snapshot.set(next);
            if (!next.domainIds().equals(previous.domainIds())) {
                log.info("registry loaded source={} domains={}", source.name(), next.domainIds());
            }
            return true;
        } catch (RegistryUnavailableException e) {
            log.warn(
                "registry refresh failed source={} error={} stale_domains={}",
                source.name(),
                e.getMessage(),
                previous.domainIds()
            );
            return false;
        }
    }
}
