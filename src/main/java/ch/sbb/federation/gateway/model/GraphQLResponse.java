package ch.sbb.federation.gateway.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a federated operation in the standard {@code {data, errors}} shape.
 *
 * @param data the response data, {@code null} when null propagation reached the root
 * @param errors accumulated errors
 * @param dataPresent whether the {@code data} entry is rendered at all (it is not for
 *        requests rejected before execution)
 */
public record GraphQLResponse(Map<String, Object> data, List<GatewayError> errors, boolean dataPresent) {

    public GraphQLResponse {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static GraphQLResponse of(Map<String, Object> data, List<GatewayError> errors) {
        return new GraphQLResponse(data, errors, true);
    }

    /**
     * Response for a request that was rejected before execution started.
     */
    public static GraphQLResponse rejected(GatewayError error) {
        return new GraphQLResponse(null, List.of(error), false);
    }

    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (dataPresent) {
            result.put("data", data);
        }
        if (!errors.isEmpty()) {
            List<Map<String, Object>> rendered = new ArrayList<>();
            errors.forEach(error -> rendered.add(error.toSpecification()));
            result.put("errors", rendered);
        }
        return result;
    }
}
