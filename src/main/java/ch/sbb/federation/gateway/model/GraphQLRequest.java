package ch.sbb.federation.gateway.model;

import java.util.Map;

/**
 * Client request accepted by the gateway endpoint.
 */
public record GraphQLRequest(String query, Map<String, Object> variables, String operationName) {

    public GraphQLRequest {
        variables = variables != null ? variables : Map.of();
    }
}
