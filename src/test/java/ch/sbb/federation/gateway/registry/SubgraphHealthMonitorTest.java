package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.client.SubgraphClient;
import ch.sbb.federation.gateway.config.GatewayProperties;
import ch.sbb.federation.gateway.model.ProbeResult;
import ch.sbb.federation.gateway.model.SubgraphHealth.HealthStatus;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubgraphHealthMonitorTest {

    @Mock
    private SchemaRegistry registry;

    @Mock
    private SubgraphClient subgraphClient;

    private SubgraphHealthMonitor monitor;

    private final SubgraphSchema workflows = subgraph("workflows");
    private final SubgraphSchema content = subgraph("content_processing");

    @BeforeEach
    void setUp() {
        monitor = new SubgraphHealthMonitor(registry, subgraphClient, new GatewayProperties());
    }

    @Test
    void unprobedSubgraphIsHealthy() {
        assertThat(monitor.status("workflows").status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(monitor.isDown("workflows")).isFalse();
        assertThat(monitor.downSubgraphs()).isEmpty();
    }

    @Test
    void marksSubgraphDownAfterRepeatedFailures() {
        for (int i = 0; i < 5; i++) {
            monitor.record("content_processing", ProbeResult.failure("Connection refused"));
        }

        assertThat(monitor.isDown("content_processing")).isTrue();
        assertThat(monitor.downSubgraphs()).containsExactly("content_processing");
        assertThat(monitor.isDown("workflows")).isFalse();
    }

    @Test
    void recoversOnFirstSuccess() {
        for (int i = 0; i < 5; i++) {
            monitor.record("content_processing", ProbeResult.failure("Connection refused"));
        }

        monitor.record("content_processing", ProbeResult.success(Duration.ofMillis(30)));

        assertThat(monitor.downSubgraphs()).isEmpty();
    }

    @Test
    void checkAllSubgraphsProbesEveryRegisteredSubgraph() {
        when(registry.listSubgraphs()).thenReturn(List.of(workflows, content));
        when(subgraphClient.probe(workflows)).thenReturn(ProbeResult.success(Duration.ofMillis(12)));
        when(subgraphClient.probe(content)).thenReturn(ProbeResult.failure("Read timed out"));

        monitor.checkAllSubgraphs();

        assertThat(monitor.snapshot()).containsOnlyKeys("workflows", "content_processing");
        assertThat(monitor.status("workflows").latency()).isEqualTo(Duration.ofMillis(12));
        assertThat(monitor.status("content_processing").errorMessage()).isEqualTo("Read timed out");
    }

    @Test
    void forgetsRemovedSubgraphs() {
        monitor.record("retired", ProbeResult.failure("gone"));
        when(registry.listSubgraphs()).thenReturn(List.of(workflows));
        when(subgraphClient.probe(workflows)).thenReturn(ProbeResult.success(Duration.ofMillis(5)));

        monitor.checkAllSubgraphs();

        assertThat(monitor.snapshot()).containsOnlyKeys("workflows");
    }

    @Test
    void checkSubgraphIgnoresUnknownName() {
        when(registry.getSubgraph("missing")).thenReturn(Optional.empty());

        assertThat(monitor.checkSubgraph("missing")).isNull();
        verify(subgraphClient, never()).probe(any());
    }

    private static SubgraphSchema subgraph(String name) {
        return new SubgraphSchema(name, "http://" + name, null, "type Query { ok: Boolean }", Map.of(), Instant.now());
    }
}
