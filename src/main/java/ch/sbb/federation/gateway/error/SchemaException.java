package ch.sbb.federation.gateway.error;

/**
 * Thrown when a subgraph's SDL is malformed or violates a federation rule on its own
 * (for example an entity that does not define its declared key fields).
 *
 * <p>The registration is rejected; the previously registered SDL and the composed
 * schema keep serving.</p>
 */
public class SchemaException extends FederationException {

    public SchemaException(String subgraph, String message) {
        super(message, subgraph, null, null);
    }

    public SchemaException(String subgraph, String message, Throwable cause) {
        super(message, subgraph, null, cause);
    }

    @Override
    public String getCode() {
        return "INVALID_SUBGRAPH_SCHEMA";
    }
}
