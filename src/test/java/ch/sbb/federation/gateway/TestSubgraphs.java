package ch.sbb.federation.gateway;

import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.registry.SchemaComposer;
import ch.sbb.federation.gateway.registry.SdlParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Subgraph SDL shared by the tests: {@code workflows} owns {@code Workflow},
 * {@code content_processing} extends it with {@code executions}.
 */
public final class TestSubgraphs {

    public static final String WORKFLOWS = "workflows";
    public static final String CONTENT = "content_processing";

    public static final String WORKFLOWS_URL = "http://localhost:4001/graphql";
    public static final String CONTENT_URL = "http://localhost:4002/graphql";

    public static final String WORKFLOWS_SDL = """
        type Query {
          workflow(id: ID!): Workflow
          workflows: [Workflow!]!
        }

        type Mutation {
          startWorkflow(name: String!): Workflow
        }

        type Workflow @key(fields: "id") {
          id: ID!
          name: String!
          status: String
        }
        """;

    public static final String CONTENT_SDL = """
        type Query {
          document(id: ID!): Document
        }

        type Mutation {
          processDocument(id: ID!): Document
        }

        type Document @key(fields: "id") {
          id: ID!
          title: String
        }

        type Execution {
          id: ID!
          state: String!
        }

        extend type Workflow @key(fields: "id") {
          id: ID! @external
          executions: [Execution!]
        }
        """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestSubgraphs() {
    }

    public static ComposedSchema composed() {
        SdlParser parser = new SdlParser();
        return new SchemaComposer().compose(List.of(
            parser.parse(WORKFLOWS, WORKFLOWS_URL, null, WORKFLOWS_SDL),
            parser.parse(CONTENT, CONTENT_URL, null, CONTENT_SDL)), 1);
    }

    /**
     * Parse JSON into mutable maps and lists, the way subgraph responses arrive.
     */
    public static Map<String, Object> json(String json) {
        try {
            return MAPPER.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid test JSON: " + json, e);
        }
    }
}
