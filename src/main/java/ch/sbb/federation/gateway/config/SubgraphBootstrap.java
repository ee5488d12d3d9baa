package ch.sbb.federation.gateway.config;

import ch.sbb.federation.gateway.client.SubgraphClient;
import ch.sbb.federation.gateway.config.GatewayProperties.SubgraphConfig;
import ch.sbb.federation.gateway.error.CompositionException;
import ch.sbb.federation.gateway.error.FederationException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.registry.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the pre-configured subgraphs once the application is ready.
 *
 * <p>Fetches every configured subgraph's SDL through {@code _service { sdl }}, registers it
 * and composes. A subgraph that cannot be loaded is logged and skipped. A composition
 * conflict leaves the previous schema serving.</p>
 */
@Component
public class SubgraphBootstrap {

    private static final Logger log = LoggerFactory.getLogger(SubgraphBootstrap.class);

    private final GatewayProperties properties;
    private final SubgraphClient subgraphClient;
    private final SchemaRegistry registry;

    public SubgraphBootstrap(GatewayProperties properties, SubgraphClient subgraphClient, SchemaRegistry registry) {
        this.properties = properties;
        this.subgraphClient = subgraphClient;
        this.registry = registry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getSubgraphs().isEmpty()) {
            log.info("No pre-configured subgraphs, waiting for registrations");
            return;
        }
        try {
            reload();
        } catch (CompositionException e) {
            log.error("Composition of configured subgraphs failed, serving generation {}: {}",
                registry.current().generation(), e.getMessage());
        }
    }

    /**
     * Re-fetch the SDL of every configured subgraph and recompose.
     *
     * <p>Subgraphs whose SDL cannot be fetched or parsed are skipped and reported. The rest
     * are registered together; if they do not compose, none of them is registered.</p>
     *
     * @return names of the subgraphs that could not be loaded
     * @throws CompositionException if the loaded subgraphs conflict; the previous
     *         registrations and schema stay in force
     */
    public List<String> reload() {
        List<String> failed = new ArrayList<>();
        List<SubgraphSchema> loaded = new ArrayList<>();
        for (SubgraphConfig config : properties.getSubgraphs()) {
            try {
                String sdl = subgraphClient.fetchSdl(config.getName(), config.getUrl());
                loaded.add(registry.parse(config.getName(), config.getUrl(), config.getHealthUrl(), sdl));
            } catch (FederationException e) {
                log.error("Failed to load subgraph {} from {}: {}", config.getName(), config.getUrl(), e.getMessage());
                failed.add(config.getName());
            }
        }

        if (loaded.isEmpty()) {
            log.warn("No configured subgraph could be loaded, serving generation {}", registry.current().generation());
            return failed;
        }

        ComposedSchema schema = registry.registerAllAndCompose(loaded);
        log.info("Initialized federated schema generation {} from {} subgraphs",
            schema.generation(), schema.subgraphs().size());
        return failed;
    }
}
