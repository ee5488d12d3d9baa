package ch.sbb.federation.gateway.error;

import java.util.List;

/**
 * Network, HTTP or timeout failure while talking to a subgraph.
 *
 * <p>Scoped to the fetch that raised it: the fields that fetch contributes become
 * field-level errors, sibling branches are not affected.</p>
 */
public class FetchException extends FederationException {

    public FetchException(String subgraph, String message, Throwable cause) {
        super(message, subgraph, null, cause);
    }

    public FetchException(String subgraph, String message, List<Object> path) {
        super(message, subgraph, path, null);
    }

    @Override
    public String getCode() {
        return "SUBGRAPH_FETCH_FAILED";
    }
}
