package ch.sbb.federation.gateway.model;

import ch.sbb.federation.gateway.error.FederationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A GraphQL error entry of the gateway response.
 *
 * @param message error message
 * @param path response path ({@code String} keys and {@code Integer} list indexes)
 * @param extensions extensions, always including {@code code} and, when known, {@code subgraph}
 */
public record GatewayError(String message, List<Object> path, Map<String, Object> extensions) {

    public GatewayError {
        path = path != null ? List.copyOf(path) : List.of();
        extensions = extensions != null ? Map.copyOf(extensions) : Map.of();
    }

    public static GatewayError of(String message, List<Object> path, String code, String subgraph) {
        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put("code", code);
        if (subgraph != null) {
            extensions.put("subgraph", subgraph);
        }
        return new GatewayError(message, path, extensions);
    }

    public static GatewayError from(FederationException e) {
        return of(e.getMessage(), e.getPath(), e.getCode(), e.getSubgraph());
    }

    public String code() {
        Object code = extensions.get("code");
        return code != null ? code.toString() : null;
    }

    public String subgraph() {
        Object subgraph = extensions.get("subgraph");
        return subgraph != null ? subgraph.toString() : null;
    }

    /**
     * Render in the GraphQL response format.
     */
    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", message);
        if (!path.isEmpty()) {
            result.put("path", new ArrayList<>(path));
        }
        if (!extensions.isEmpty()) {
            result.put("extensions", new LinkedHashMap<>(extensions));
        }
        return result;
    }
}
