package ch.sbb.federation.gateway.protocol;

import ch.sbb.federation.gateway.config.SubgraphBootstrap;
import ch.sbb.federation.gateway.error.CompositionException;
import ch.sbb.federation.gateway.error.SchemaException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.SubgraphHealth;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.registry.SchemaRegistry;
import ch.sbb.federation.gateway.registry.SubgraphHealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for subgraph and schema administration.
 *
 * <p>Registration requests carry {@code {name, url, healthUrl, sdl}}. Malformed SDL is answered
 * with 400, composition conflicts with 409 and unknown subgraphs with 404.</p>
 */
@RestController
@RequestMapping("/admin")
public class SubgraphAdminController {

    private static final Logger log = LoggerFactory.getLogger(SubgraphAdminController.class);

    private final SchemaRegistry registry;
    private final SubgraphHealthMonitor healthMonitor;
    private final SubgraphBootstrap bootstrap;

    public SubgraphAdminController(SchemaRegistry registry,
                                   SubgraphHealthMonitor healthMonitor,
                                   SubgraphBootstrap bootstrap) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.bootstrap = bootstrap;
    }

    /**
     * List all registered subgraphs.
     */
    @GetMapping("/subgraphs")
    public ResponseEntity<Map<String, Object>> listSubgraphs() {
        try {
            List<Map<String, Object>> subgraphs = registry.listSubgraphs().stream()
                .map(this::describe)
                .toList();
            return ResponseEntity.ok(Map.of("subgraphs", subgraphs));
        } catch (Exception e) {
            log.error("Error listing subgraphs: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Register a new subgraph and recompose.
     *
     * @param request the registration
     * @return the new schema generation
     */
    @PostMapping("/subgraphs")
    public ResponseEntity<Map<String, Object>> registerSubgraph(@RequestBody Map<String, Object> request) {
        String name = (String) request.get("name");
        if (name == null || name.isBlank()) {
            return ResponseEntity.badRequest()
                .body(Map.of("error", "Missing required field: name"));
        }
        return register(name, request);
    }

    /**
     * Replace the SDL or endpoint of a subgraph and recompose.
     */
    @PutMapping("/subgraphs/{name}")
    public ResponseEntity<Map<String, Object>> updateSubgraph(@PathVariable String name,
                                                              @RequestBody Map<String, Object> request) {
        if (registry.getSubgraph(name).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Subgraph '" + name + "' not found"));
        }
        return register(name, request);
    }

    /**
     * Unregister a subgraph and recompose.
     */
    @DeleteMapping("/subgraphs/{name}")
    public ResponseEntity<Map<String, Object>> removeSubgraph(@PathVariable String name) {
        try {
            ComposedSchema composed = registry.remove(name);
            return ResponseEntity.ok(Map.of("removed", name, "generation", composed.generation()));
        } catch (IllegalArgumentException e) {
            log.warn("Subgraph not found: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", e.getMessage()));
        } catch (CompositionException e) {
            log.error("Removing subgraph {} breaks composition: {}", name, e.getMessage());
            return conflict(e);
        } catch (Exception e) {
            log.error("Error removing subgraph: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * The composed schema: SDL, generation and field ownership.
     */
    @GetMapping("/schema")
    public ResponseEntity<Map<String, Object>> schema() {
        try {
            ComposedSchema schema = registry.current();
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("generation", schema.generation());
            result.put("composedAt", schema.composedAt().toString());
            result.put("subgraphs", List.copyOf(schema.subgraphs().keySet()));
            result.put("sdl", schema.printSdl());
            result.put("ownership", schema.ownership());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("Error printing schema: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/schema/validate")
    public ResponseEntity<Map<String, Object>> validate() {
        try {
            List<String> issues = registry.validateFederationCompliance();
            return ResponseEntity.ok(Map.of("valid", issues.isEmpty(), "issues", issues));
        } catch (Exception e) {
            log.error("Error validating subgraphs: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Fetch the SDL of every configured subgraph again and recompose.
     */
    @PostMapping("/schema/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        try {
            List<String> failed = bootstrap.reload();
            return ResponseEntity.ok(Map.of(
                "generation", registry.current().generation(),
                "failed", failed));
        } catch (CompositionException e) {
            log.error("Reloaded subgraphs do not compose: {}", e.getMessage());
            return conflict(e);
        } catch (Exception e) {
            log.error("Error reloading subgraphs: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Health of every registered subgraph.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            Map<String, Object> subgraphs = new LinkedHashMap<>();
            for (SubgraphSchema subgraph : registry.listSubgraphs()) {
                SubgraphHealth health = healthMonitor.status(subgraph.name());
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("status", health.status().name());
                entry.put("lastCheck", health.lastCheck() != null ? health.lastCheck().toString() : null);
                entry.put("latencyMs", health.latency() != null ? health.latency().toMillis() : null);
                entry.put("error", health.errorMessage());
                entry.put("consecutiveFailures", health.consecutiveFailures());
                subgraphs.put(subgraph.name(), entry);
            }
            return ResponseEntity.ok(Map.of("subgraphs", subgraphs));
        } catch (Exception e) {
            log.error("Error reading subgraph health: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    private ResponseEntity<Map<String, Object>> register(String name, Map<String, Object> request) {
        String url = (String) request.get("url");
        String sdl = (String) request.get("sdl");
        if (url == null || sdl == null) {
            return ResponseEntity.badRequest()
                .body(Map.of("error", "Missing required fields: url, sdl"));
        }
        try {
            ComposedSchema composed = registry.registerAndCompose(name, url, (String) request.get("healthUrl"), sdl);
            return ResponseEntity.ok(Map.of("registered", name, "generation", composed.generation()));
        } catch (SchemaException e) {
            log.error("Invalid SDL for subgraph {}: {}", name, e.getMessage());
            return ResponseEntity.badRequest()
                .body(Map.of("error", e.getMessage()));
        } catch (CompositionException e) {
            log.error("Registering subgraph {} breaks composition: {}", name, e.getMessage());
            return conflict(e);
        } catch (Exception e) {
            log.error("Error registering subgraph: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
        }
    }

    private static ResponseEntity<Map<String, Object>> conflict(CompositionException e) {
        List<Map<String, Object>> conflicts = e.getConflicts().stream()
            .map(c -> Map.<String, Object>of(
                "coordinate", c.coordinate(),
                "subgraphs", c.subgraphs(),
                "reason", c.reason()))
            .toList();
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", e.getMessage(), "conflicts", conflicts));
    }

    private Map<String, Object> describe(SubgraphSchema subgraph) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", subgraph.name());
        result.put("url", subgraph.url());
        result.put("healthUrl", subgraph.healthUrl());
        result.put("types", List.copyOf(subgraph.types().keySet()));
        result.put("registeredAt", subgraph.registeredAt() != null ? subgraph.registeredAt().toString() : null);
        result.put("status", healthMonitor.status(subgraph.name()).status().name());
        return result;
    }
}
