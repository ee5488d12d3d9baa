package ch.sbb.federation.gateway.error;

import java.util.List;

/**
 * Thrown when a client operation cannot be planned against the composed schema,
 * typically because it selects a type or field the schema does not have.
 *
 * <p>Surfaced to the client as a validation error; nothing is executed.</p>
 */
public class PlanningException extends FederationException {

    public PlanningException(String message) {
        super(message, null, null, null);
    }

    public PlanningException(String message, List<Object> path) {
        super(message, null, path, null);
    }

    @Override
    public String getCode() {
        return "GRAPHQL_VALIDATION_FAILED";
    }
}
