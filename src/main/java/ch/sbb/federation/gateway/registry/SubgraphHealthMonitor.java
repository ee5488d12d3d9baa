package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.client.SubgraphClient;
import ch.sbb.federation.gateway.config.GatewayProperties;
import ch.sbb.federation.gateway.model.ProbeResult;
import ch.sbb.federation.gateway.model.SubgraphHealth;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Scheduled health monitor for registered subgraphs.
 *
 * <p>Periodically probes every registered subgraph and classifies it as
 * {@code HEALTHY}, {@code DEGRADED} or {@code DOWN}. The health table is an immutable
 * map swapped on every update; readers never block.</p>
 */
@Component
public class SubgraphHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(SubgraphHealthMonitor.class);

    private final SchemaRegistry registry;
    private final SubgraphClient subgraphClient;
    private final GatewayProperties properties;

    private final AtomicReference<Map<String, SubgraphHealth>> health = new AtomicReference<>(Map.of());

    public SubgraphHealthMonitor(SchemaRegistry registry,
                                 SubgraphClient subgraphClient,
                                 GatewayProperties properties) {
        this.registry = registry;
        this.subgraphClient = subgraphClient;
        this.properties = properties;
    }

    /**
     * Scheduled health check for all registered subgraphs.
     *
     * <p>Runs at the fixed rate configured by {@code federation.gateway.health.check-interval}.</p>
     */
    @Scheduled(fixedRateString = "${federation.gateway.health.check-interval:PT10S}")
    public synchronized void checkAllSubgraphs() {
        log.debug("Starting health check for all subgraphs");

        for (SubgraphSchema subgraph : registry.listSubgraphs()) {
            try {
                record(subgraph.name(), subgraphClient.probe(subgraph));
            } catch (RuntimeException e) {
                log.error("Error checking health of subgraph {}: {}", subgraph.name(), e.getMessage());
            }
        }
        forgetRemoved();
    }

    /**
     * Probe a single subgraph immediately.
     *
     * @param name the subgraph name
     * @return the new health, or {@code null} if the subgraph is not registered
     */
    public synchronized SubgraphHealth checkSubgraph(String name) {
        return registry.getSubgraph(name)
            .map(subgraph -> record(name, subgraphClient.probe(subgraph)))
            .orElseGet(() -> {
                log.warn("Cannot check health: subgraph not found: {}", name);
                return null;
            });
    }

    /**
     * Apply a probe result to a subgraph's state.
     *
     * @param name the subgraph name
     * @param probe the probe outcome
     * @return the new state
     */
    public synchronized SubgraphHealth record(String name, ProbeResult probe) {
        GatewayProperties.HealthConfig config = properties.getHealth();
        SubgraphHealth previous = status(name);
        SubgraphHealth next = previous.next(probe, config.getSlowThreshold(),
            config.getDegradedAfter(), config.getDownAfter());

        Map<String, SubgraphHealth> updated = new LinkedHashMap<>(health.get());
        updated.put(name, next);
        health.set(Collections.unmodifiableMap(updated));

        if (previous.status() != next.status()) {
            log.info("Subgraph {} health changed from {} to {}", name, previous.status(), next.status());
        }
        if (next.isDown() && !previous.isDown()) {
            log.warn("Subgraph {} marked as DOWN after {} consecutive failures: {}",
                name, next.consecutiveFailures(), next.errorMessage());
        }
        return next;
    }

    /**
     * Current state of a subgraph; subgraphs never probed are {@code HEALTHY}.
     */
    public SubgraphHealth status(String name) {
        return health.get().getOrDefault(name, SubgraphHealth.initial());
    }

    public boolean isDown(String name) {
        return status(name).isDown();
    }

    /**
     * Names of the subgraphs currently {@code DOWN}.
     */
    public Set<String> downSubgraphs() {
        return health.get().entrySet().stream()
            .filter(e -> e.getValue().isDown())
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Immutable view of the whole health table.
     */
    public Map<String, SubgraphHealth> snapshot() {
        return health.get();
    }

    private void forgetRemoved() {
        Set<String> registered = registry.listSubgraphs().stream()
            .map(SubgraphSchema::name)
            .collect(Collectors.toSet());
        Map<String, SubgraphHealth> current = health.get();
        if (registered.containsAll(current.keySet())) {
            return;
        }
        Map<String, SubgraphHealth> updated = new LinkedHashMap<>(current);
        updated.keySet().retainAll(registered);
        health.set(Collections.unmodifiableMap(updated));
    }
}
