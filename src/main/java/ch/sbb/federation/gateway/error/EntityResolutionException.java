package ch.sbb.federation.gateway.error;

import java.util.List;

/**
 * A representation was rejected, invalid, or resolved to {@code null} by its owning subgraph.
 */
public class EntityResolutionException extends FederationException {

    public EntityResolutionException(String subgraph, String message, List<Object> path) {
        super(message, subgraph, path, null);
    }

    @Override
    public String getCode() {
        return "ENTITY_RESOLUTION_FAILED";
    }
}
