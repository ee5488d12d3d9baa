package ch.sbb.federation.gateway.error;

import java.util.List;

/**
 * Base class for all errors raised by the federation gateway.
 *
 * <p>Every error carries the originating subgraph (when one is involved) and the
 * GraphQL response path it applies to, so it can be rendered as a tagged GraphQL error.</p>
 */
public abstract class FederationException extends RuntimeException {

    private final String subgraph;
    private final List<Object> path;

    protected FederationException(String message, String subgraph, List<Object> path, Throwable cause) {
        super(message, cause);
        this.subgraph = subgraph;
        this.path = path != null ? List.copyOf(path) : List.of();
    }

    public String getSubgraph() {
        return subgraph;
    }

    public List<Object> getPath() {
        return path;
    }

    /**
     * Error code rendered in the {@code extensions.code} entry of a GraphQL error.
     */
    public abstract String getCode();
}
