package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.error.CompositionException;
import ch.sbb.federation.gateway.error.SchemaException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.SubgraphField;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import ch.sbb.federation.gateway.model.SubgraphType;
import ch.sbb.federation.gateway.model.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of subgraph schemas and holder of the current composed schema.
 *
 * <p>Registrations and compositions are serialized through a single writer lock. The
 * composed schema is an immutable snapshot behind an atomic reference, so readers never
 * block and never see a partially composed schema. A failed registration or composition
 * leaves the last good snapshot serving.</p>
 */
@Component
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, SubgraphSchema> subgraphs = new LinkedHashMap<>();
    private final AtomicReference<ComposedSchema> current = new AtomicReference<>(ComposedSchema.empty());
    private final Object writeLock = new Object();

    private final SdlParser parser;
    private final SchemaComposer composer;
    private final ApplicationEventPublisher events;

    public SchemaRegistry(SdlParser parser, SchemaComposer composer, ApplicationEventPublisher events) {
        this.parser = parser;
        this.composer = composer;
        this.events = events;
    }

    /**
     * Register or replace a subgraph. Does not recompose.
     *
     * @param name the subgraph name
     * @param url the subgraph GraphQL endpoint
     * @param healthUrl optional health endpoint, may be {@code null}
     * @param sdl the subgraph SDL
     * @return the parsed subgraph
     * @throws SchemaException if the SDL is malformed; the previous registration is kept
     */
    public SubgraphSchema register(String name, String url, String healthUrl, String sdl) {
        SubgraphSchema subgraph = parse(name, url, healthUrl, sdl);
        synchronized (writeLock) {
            subgraphs.put(name, subgraph);
        }
        log.info("Registered subgraph: {} at {} ({} types)", name, url, subgraph.types().size());
        return subgraph;
    }

    /**
     * Parse a subgraph without registering it.
     *
     * @throws SchemaException if the SDL is malformed
     */
    public SubgraphSchema parse(String name, String url, String healthUrl, String sdl) {
        try {
            return parser.parse(name, url, healthUrl, sdl);
        } catch (SchemaException e) {
            log.error("Rejected registration of subgraph {}: {}", name, e.getMessage());
            throw e;
        }
    }

    /**
     * Register or replace several parsed subgraphs and recompose once. If composition fails
     * every registration is restored to its state before the call.
     *
     * @param parsed subgraphs from {@link #parse(String, String, String, String)}
     * @return the new snapshot
     * @throws CompositionException if the subgraphs conflict
     */
    public ComposedSchema registerAllAndCompose(List<SubgraphSchema> parsed) {
        synchronized (writeLock) {
            Map<String, SubgraphSchema> before = new LinkedHashMap<>(subgraphs);
            parsed.forEach(subgraph -> subgraphs.put(subgraph.name(), subgraph));
            try {
                return compose();
            } catch (CompositionException e) {
                subgraphs.clear();
                subgraphs.putAll(before);
                log.warn("Rolled back registration of {} subgraphs after failed composition", parsed.size());
                throw e;
            }
        }
    }

    /**
     * Compose all registered subgraphs and swap the result in.
     *
     * @return the new snapshot
     * @throws CompositionException if the subgraphs conflict; the previous snapshot stays live
     */
    public ComposedSchema compose() {
        synchronized (writeLock) {
            ComposedSchema previous = current.get();
            ComposedSchema composed;
            try {
                composed = composer.compose(new ArrayList<>(subgraphs.values()), previous.generation() + 1);
            } catch (CompositionException e) {
                log.error("Composition failed, keeping generation {}: {}", previous.generation(), e.getMessage());
                throw e;
            }
            current.set(composed);
            log.info("Composed schema generation {} from {} subgraphs", composed.generation(), subgraphs.size());
            events.publishEvent(new SchemaComposedEvent(composed));
            return composed;
        }
    }

    /**
     * Register a subgraph and recompose. If composition fails the registration is rolled back.
     */
    public ComposedSchema registerAndCompose(String name, String url, String healthUrl, String sdl) {
        SubgraphSchema subgraph = parser.parse(name, url, healthUrl, sdl);
        synchronized (writeLock) {
            SubgraphSchema previous = subgraphs.put(name, subgraph);
            try {
                return compose();
            } catch (CompositionException e) {
                restore(name, previous);
                throw e;
            }
        }
    }

    /**
     * Remove a subgraph and recompose. If composition fails the subgraph is restored.
     *
     * @return the new snapshot
     * @throws IllegalArgumentException if the subgraph is not registered
     */
    public ComposedSchema remove(String name) {
        synchronized (writeLock) {
            SubgraphSchema removed = subgraphs.remove(name);
            if (removed == null) {
                throw new IllegalArgumentException("Subgraph '" + name + "' not found");
            }
            log.info("Unregistered subgraph: {}", name);
            try {
                return compose();
            } catch (CompositionException e) {
                restore(name, removed);
                throw e;
            }
        }
    }

    /**
     * The latest composed snapshot; generation {@code 0} until the first successful composition.
     */
    public ComposedSchema current() {
        return current.get();
    }

    public List<SubgraphSchema> listSubgraphs() {
        synchronized (writeLock) {
            return new ArrayList<>(subgraphs.values());
        }
    }

    public Optional<SubgraphSchema> getSubgraph(String name) {
        synchronized (writeLock) {
            return Optional.ofNullable(subgraphs.get(name));
        }
    }

    /**
     * Non-fatal federation issues of the registered subgraphs.
     *
     * @return human readable warnings, empty when everything looks consistent
     */
    public List<String> validateFederationCompliance() {
        List<String> issues = new ArrayList<>();
        for (SubgraphSchema subgraph : listSubgraphs()) {
            for (SubgraphType type : subgraph.types().values()) {
                if (type.extension() && !type.isEntity() && !isRoot(type.name())
                    && type.kind() == TypeKind.OBJECT) {
                    issues.add(subgraph.name() + ": extended type '" + type.name() + "' declares no @key");
                }
                for (SubgraphField field : type.fields().values()) {
                    for (String required : field.requires()) {
                        SubgraphField requiredField = type.fields().get(required);
                        if (requiredField != null && !requiredField.isExternal()) {
                            issues.add(subgraph.name() + ": " + type.name() + "." + field.name() + " requires '"
                                + required + "' which is not @external");
                        }
                    }
                    if (!field.provides().isEmpty()) {
                        SubgraphType target = subgraph.type(field.type().namedType());
                        if (target == null || !target.isEntity()) {
                            issues.add(subgraph.name() + ": " + type.name() + "." + field.name()
                                + " uses @provides on non-entity type '" + field.type().namedType() + "'");
                        }
                    }
                    if (field.isExternal() && !type.isKeyField(field.name()) && !isRequired(type, field.name())
                        && !isProvidedSomewhere(subgraph, type.name(), field.name())) {
                        issues.add(subgraph.name() + ": " + type.name() + "." + field.name()
                            + " is @external but never used by @key, @requires or @provides");
                    }
                }
            }
        }
        return issues;
    }

    private void restore(String name, SubgraphSchema previous) {
        if (previous != null) {
            subgraphs.put(name, previous);
        } else {
            subgraphs.remove(name);
        }
        log.warn("Rolled back registration change of subgraph {} after failed composition", name);
    }

    private static boolean isRoot(String typeName) {
        return ComposedSchema.QUERY.equals(typeName) || ComposedSchema.MUTATION.equals(typeName);
    }

    private static boolean isRequired(SubgraphType type, String fieldName) {
        return type.fields().values().stream().anyMatch(f -> f.requires().contains(fieldName));
    }

    private static boolean isProvidedSomewhere(SubgraphSchema subgraph, String typeName, String fieldName) {
        return subgraph.types().values().stream()
            .flatMap(t -> t.fields().values().stream())
            .anyMatch(f -> f.type().namedType().equals(typeName) && f.provides().contains(fieldName));
    }
}
