package ch.sbb.federation.gateway.protocol;

import ch.sbb.federation.gateway.cache.QueryPlanCache;
import ch.sbb.federation.gateway.error.PlanningException;
import ch.sbb.federation.gateway.execution.FederatedExecutor;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.GatewayError;
import ch.sbb.federation.gateway.model.GraphQLRequest;
import ch.sbb.federation.gateway.model.GraphQLResponse;
import ch.sbb.federation.gateway.planning.QueryPlan;
import ch.sbb.federation.gateway.planning.QueryPlanner;
import ch.sbb.federation.gateway.registry.SchemaRegistry;
import ch.sbb.federation.gateway.registry.SubgraphHealthMonitor;
import graphql.language.Document;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of federated query execution.
 *
 * <p>Parses the client request, takes the current composed schema snapshot, looks the plan up
 * in the plan cache (planning it on a miss) and executes it. The snapshot acquired at the start
 * is used for the whole request.</p>
 */
@Service
public class FederationGateway {

    private static final Logger log = LoggerFactory.getLogger(FederationGateway.class);

    static final String GRAPHQL_PARSE_FAILED = "GRAPHQL_PARSE_FAILED";

    private final SchemaRegistry schemaRegistry;
    private final SubgraphHealthMonitor healthMonitor;
    private final QueryPlanner planner;
    private final QueryPlanCache planCache;
    private final FederatedExecutor executor;

    public FederationGateway(SchemaRegistry schemaRegistry,
                             SubgraphHealthMonitor healthMonitor,
                             QueryPlanner planner,
                             QueryPlanCache planCache,
                             FederatedExecutor executor) {
        this.schemaRegistry = schemaRegistry;
        this.healthMonitor = healthMonitor;
        this.planner = planner;
        this.planCache = planCache;
        this.executor = executor;
    }

    /**
     * Execute a client request.
     *
     * @param request the GraphQL request
     * @return the response; requests that fail to parse or validate carry no {@code data}
     */
    public GraphQLResponse execute(GraphQLRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return GraphQLResponse.rejected(GatewayError.of("Missing required field: query", List.of(),
                GRAPHQL_PARSE_FAILED, null));
        }

        Document document;
        try {
            document = Parser.parse(request.query());
        } catch (InvalidSyntaxException e) {
            log.debug("Rejected unparsable query: {}", e.getMessage());
            return GraphQLResponse.rejected(GatewayError.of(e.getMessage(), List.of(), GRAPHQL_PARSE_FAILED, null));
        }

        ComposedSchema schema = schemaRegistry.current();
        QueryPlan plan;
        try {
            if (schema.isEmpty()) {
                throw new PlanningException("No federated schema has been composed yet");
            }
            String key = planCache.generateKey(document, request.operationName(), request.variables());
            plan = planCache.getOrPlan(key, schema.generation(),
                () -> planner.plan(schema, document, request.operationName(), healthMonitor.downSubgraphs()));
        } catch (PlanningException e) {
            log.debug("Rejected query: {}", e.getMessage());
            return GraphQLResponse.rejected(GatewayError.from(e));
        }

        GraphQLResponse response = executor.execute(plan, schema, request.variables());
        if (!response.errors().isEmpty()) {
            log.info("Federated {} completed with {} errors", plan.getOperationType(), response.errors().size());
        }
        return response;
    }
}
