package com.kmesh.router.registry;

import static com.kmesh.router.RouterFixtures.registration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kmesh.router.config.RouterProperties;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DomainRegistryTest {

    @Mock
    private RegistrySource source;

    private final AtomicLong now = new AtomicLong(1_000L);
    private RouterProperties properties;
    private DomainRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        properties.getRegistry().setTtlMs(30_000);
        when(source.name()).thenReturn("test");
        registry = new DomainRegistry(source, properties, now::get);
    }

    @Test
    void keepsOnlyRoutableAgents() {
        when(source.load()).thenReturn(List.of(
            registration("code", AgentStatus.READY),
            registration("docs", AgentStatus.DEGRADED),
            registration("research", AgentStatus.OFFLINE),
            registration("conversations", AgentStatus.STARTING),
            registration("ops", AgentStatus.DRAINING)
        ));

        registry.initialize();

        RegistrySnapshot snapshot = registry.snapshot();
        assertThat(snapshot.domainIds()).containsExactly("code", "docs");
        assertThat(snapshot.isRegistered("research")).isFalse();
    }

    @Test
    void readyAgentWinsADomainClaimedTwice() {
        DomainRegistration degraded = registration("code", AgentStatus.DEGRADED);
        degraded.setAgentId("code-old");
        when(source.load()).thenReturn(List.of(degraded, registration("code", AgentStatus.READY)));

        registry.initialize();

        assertThat(registry.snapshot().get("code").getAgentId()).isEqualTo("code-agent");
    }

    @Test
    void failedRefreshKeepsStaleSnapshot() {
        when(source.load())
            .thenReturn(List.of(registration("code", AgentStatus.READY)))
            .thenThrow(new RegistryUnavailableException("Registry unavailable"));

        registry.initialize();
        boolean refreshed = registry.refresh();

        assertThat(refreshed).isFalse();
        assertThat(registry.snapshot().domainIds()).containsExactly("code");
    }

    @Test
    void expiredSnapshotIsRefreshedOnRead() {
        when(source.load())
            .thenReturn(List.of(registration("code", AgentStatus.READY)))
            .thenReturn(List.of(registration("code", AgentStatus.READY), registration("docs", AgentStatus.READY)));

        registry.initialize();
        now.addAndGet(10_000);
        assertThat(registry.snapshot().domainIds()).containsExactly("code");

        now.addAndGet(25_000);
        assertThat(registry.snapshot().domainIds()).containsExactly("code", "docs");
        verify(source, times(2)).load();
    }
}
