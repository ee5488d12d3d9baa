package ch.sbb.federation.gateway.protocol;

import ch.sbb.federation.gateway.model.GatewayError;
import ch.sbb.federation.gateway.model.GraphQLRequest;
import ch.sbb.federation.gateway.model.GraphQLResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * The federated GraphQL endpoint.
 */
@RestController
public class GraphQLController {

    private static final Logger log = LoggerFactory.getLogger(GraphQLController.class);

    private final FederationGateway gateway;

    public GraphQLController(FederationGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Execute a GraphQL request.
     *
     * @param request {@code {query, variables, operationName}}
     * @return the {@code {data, errors}} response
     */
    @PostMapping("/graphql")
    public ResponseEntity<Map<String, Object>> graphql(@RequestBody GraphQLRequest request) {
        try {
            GraphQLResponse response = gateway.execute(request);
            return ResponseEntity.ok(response.toSpecification());
        } catch (Exception e) {
            log.error("Error executing GraphQL request: {}", e.getMessage(), e);
            GatewayError error = GatewayError.of("Internal gateway error: " + e.getMessage(), List.of(),
                "INTERNAL_SERVER_ERROR", null);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(GraphQLResponse.rejected(error).toSpecification());
        }
    }
}
