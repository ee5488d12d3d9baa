package ch.sbb.federation.gateway.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A registered subgraph: where it lives, its raw SDL and the types it declares.
 *
 * <p>Immutable once registered; re-registration replaces the whole record.</p>
 */
public record SubgraphSchema(
    String name,
    String url,
    String healthUrl,
    String sdl,
    Map<String, SubgraphType> types,
    Instant registeredAt
) {

    public SubgraphSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subgraph name cannot be null or blank");
        }
        types = types != null ? Collections.unmodifiableMap(new LinkedHashMap<>(types)) : Map.of();
    }

    public SubgraphType type(String typeName) {
        return types.get(typeName);
    }

    public boolean declares(String typeName) {
        return types.containsKey(typeName);
    }
}
