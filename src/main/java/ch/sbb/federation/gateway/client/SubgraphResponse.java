package ch.sbb.federation.gateway.client;

import java.util.List;
import java.util.Map;

/**
 * Raw GraphQL response of a subgraph.
 *
 * @param data the {@code data} entry, may be {@code null}
 * @param errors the {@code errors} entries, never {@code null}
 */
public record SubgraphResponse(Map<String, Object> data, List<Map<String, Object>> errors) {

    public SubgraphResponse {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
