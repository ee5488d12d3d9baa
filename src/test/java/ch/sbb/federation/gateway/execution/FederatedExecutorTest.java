package ch.sbb.federation.gateway.execution;

import ch.sbb.federation.gateway.TestSubgraphs;
import ch.sbb.federation.gateway.client.SubgraphClient;
import ch.sbb.federation.gateway.client.SubgraphResponse;
import ch.sbb.federation.gateway.config.GatewayProperties;
import ch.sbb.federation.gateway.error.FetchException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.GatewayError;
import ch.sbb.federation.gateway.model.GraphQLResponse;
import ch.sbb.federation.gateway.planning.QueryPlan;
import ch.sbb.federation.gateway.planning.QueryPlanner;
import ch.sbb.federation.gateway.registry.SubgraphHealthMonitor;
import graphql.parser.Parser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FederatedExecutorTest {

    private final ComposedSchema schema = TestSubgraphs.composed();
    private final QueryPlanner planner = new QueryPlanner();

    private SubgraphClient client;
    private SubgraphHealthMonitor healthMonitor;
    private GatewayProperties properties;
    private ExecutorService threads;
    private FederatedExecutor executor;

    @BeforeEach
    void setUp() {
        client = mock(SubgraphClient.class);
        healthMonitor = mock(SubgraphHealthMonitor.class);
        properties = new GatewayProperties();
        threads = Executors.newFixedThreadPool(4);
        executor = new FederatedExecutor(client, healthMonitor, threads, new ResponseShaper(), properties);
    }

    @AfterEach
    void tearDown() {
        threads.shutdownNow();
    }

    @Test
    void stitchesEntityFieldFromSecondSubgraph() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": "Ingest", "__typename": "Workflow"}}}
            """);
        stub(TestSubgraphs.CONTENT, """
            {"data": {"_entities": [{"executions": [{"id": "e1", "state": "DONE"}]}]}}
            """);

        GraphQLResponse response = execute("{ workflow(id: \"1\") { id name executions { id state } } }");

        assertThat(response.errors()).isEmpty();
        assertThat(response.data()).isEqualTo(TestSubgraphs.json("""
            {"workflow": {"id": "1", "name": "Ingest", "executions": [{"id": "e1", "state": "DONE"}]}}
            """));
        assertThat(representationsSentTo(TestSubgraphs.CONTENT))
            .containsExactly(Map.of("__typename", "Workflow", "id", "1"));
    }

    @Test
    void downSubgraphYieldsNullFieldWithSingleError() {
        when(healthMonitor.isDown(TestSubgraphs.CONTENT)).thenReturn(true);
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": "Ingest", "__typename": "Workflow"}}}
            """);

        GraphQLResponse response = execute("{ workflow(id: \"1\") { id name executions { id } } }");

        Map<String, Object> workflow = object(response.data(), "workflow");
        assertThat(workflow).containsEntry("name", "Ingest").containsEntry("executions", null);
        assertThat(response.errors()).hasSize(1);
        GatewayError error = response.errors().get(0);
        assertThat(error.path()).containsExactly("workflow", "executions");
        assertThat(error.code()).isEqualTo(FederatedExecutor.SUBGRAPH_UNAVAILABLE);
        assertThat(error.subgraph()).isEqualTo(TestSubgraphs.CONTENT);
        verify(client, never()).execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(), anyBoolean());
    }

    @Test
    void sendsOneBatchedEntitiesCallWithDeduplicatedRepresentations() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflows": [
              {"id": "1", "__typename": "Workflow"},
              {"id": "2", "__typename": "Workflow"},
              {"id": "1", "__typename": "Workflow"}
            ]}}
            """);
        stub(TestSubgraphs.CONTENT, """
            {"data": {"_entities": [
              {"executions": [{"id": "a"}]},
              {"executions": [{"id": "b"}]}
            ]}}
            """);

        GraphQLResponse response = execute("{ workflows { id executions { id } } }");

        assertThat(response.errors()).isEmpty();
        verify(client, times(1)).execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(),
            anyBoolean());
        assertThat(representationsSentTo(TestSubgraphs.CONTENT)).hasSize(2);
        assertThat(list(response.data(), "workflows")).<Object>extracting(w -> ((Map<?, ?>) w).get("executions"))
            .containsExactly(
                List.of(Map.of("id", "a")),
                List.of(Map.of("id", "b")),
                List.of(Map.of("id", "a")));
    }

    @Test
    void unresolvedEntityDoesNotAffectSiblings() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflows": [{"id": "1", "__typename": "Workflow"}, {"id": "2", "__typename": "Workflow"}]}}
            """);
        stub(TestSubgraphs.CONTENT, """
            {"data": {"_entities": [{"executions": [{"id": "a"}]}, null]}}
            """);

        GraphQLResponse response = execute("{ workflows { id executions { id } } }");

        List<Object> workflows = list(response.data(), "workflows");
        assertThat(((Map<?, ?>) workflows.get(0)).get("executions")).isEqualTo(List.of(Map.of("id", "a")));
        assertThat(((Map<?, ?>) workflows.get(1)).get("executions")).isNull();
        assertThat(((Map<?, ?>) workflows.get(1)).get("id")).isEqualTo("2");

        assertThat(response.errors()).hasSize(1);
        assertThat(response.errors().get(0).path()).containsExactly("workflows", 1, "executions");
        assertThat(response.errors().get(0).code()).isEqualTo("ENTITY_RESOLUTION_FAILED");
    }

    @Test
    void entityErrorsAreRemappedToResponsePath() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflows": [{"id": "1", "__typename": "Workflow"}, {"id": "2", "__typename": "Workflow"}]}}
            """);
        stub(TestSubgraphs.CONTENT, """
            {"data": {"_entities": [{"executions": []}, null]},
             "errors": [{"message": "execution store unavailable", "path": ["_entities", 1, "executions"],
                         "extensions": {"code": "STORE_UNAVAILABLE"}}]}
            """);

        GraphQLResponse response = execute("{ workflows { id executions { id } } }");

        assertThat(response.errors()).hasSize(1);
        GatewayError error = response.errors().get(0);
        assertThat(error.message()).isEqualTo("execution store unavailable");
        assertThat(error.path()).containsExactly("workflows", 1, "executions");
        assertThat(error.code()).isEqualTo("STORE_UNAVAILABLE");
        assertThat(error.subgraph()).isEqualTo(TestSubgraphs.CONTENT);
    }

    @Test
    void failedFetchNullsContributedFields() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": "Ingest", "__typename": "Workflow"}}}
            """);
        when(client.execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(), anyBoolean()))
            .thenThrow(new FetchException(TestSubgraphs.CONTENT,
                "Subgraph 'content_processing' request failed: Connection refused", new IllegalStateException()));

        GraphQLResponse response = execute("{ workflow(id: \"1\") { name executions { id } } }");

        assertThat(object(response.data(), "workflow")).containsEntry("name", "Ingest")
            .containsEntry("executions", null);
        assertThat(response.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(FederatedExecutor.SUBGRAPH_FETCH_FAILED);
            assertThat(error.message()).contains("Connection refused");
            assertThat(error.path()).containsExactly("workflow", "executions");
        });
    }

    @Test
    void missingKeyFieldFailsOnlyThatEntity() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": null, "name": "Ingest", "__typename": "Workflow"}}}
            """);

        GraphQLResponse response = execute("{ workflow(id: \"1\") { name executions { id } } }");

        assertThat(object(response.data(), "workflow")).containsEntry("name", "Ingest")
            .containsEntry("executions", null);
        assertThat(response.errors()).singleElement()
            .satisfies(error -> assertThat(error.code()).isEqualTo("ENTITY_RESOLUTION_FAILED"));
        verify(client, never()).execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(), anyBoolean());
    }

    @Test
    void nullInNonNullFieldPropagatesToNullableParent() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": null}}}
            """);

        GraphQLResponse response = execute("{ workflow(id: \"1\") { id name } }");

        assertThat(response.data()).containsEntry("workflow", null);
        assertThat(response.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ResponseShaper.NON_NULL_VIOLATION);
            assertThat(error.path()).containsExactly("workflow", "name");
            assertThat(error.message()).isEqualTo("Cannot return null for non-nullable field Workflow.name");
        });
    }

    @Test
    void nullNonNullRootFieldNullsData() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": null, "errors": [{"message": "database unavailable"}]}
            """);

        GraphQLResponse response = execute("{ workflows { id } }");

        assertThat(response.data()).isNull();
        assertThat(response.dataPresent()).isTrue();
        assertThat(response.errors()).extracting(GatewayError::code)
            .containsExactly(FederatedExecutor.DOWNSTREAM_SERVICE_ERROR, FederatedExecutor.SUBGRAPH_FETCH_FAILED);
        assertThat(response.toSpecification()).containsEntry("data", null);
    }

    @Test
    void requestDeadlineReturnsPartialData() {
        properties.getExecution().setRequestTimeout(Duration.ofMillis(300));
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": "Ingest", "__typename": "Workflow"}}}
            """);
        when(client.execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(), anyBoolean()))
            .thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return response("{\"data\": {\"_entities\": [{\"executions\": []}]}}");
            });

        GraphQLResponse response = execute("{ workflow(id: \"1\") { name executions { id } } }");

        assertThat(object(response.data(), "workflow")).containsEntry("name", "Ingest")
            .containsEntry("executions", null);
        assertThat(response.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(FederatedExecutor.TIMEOUT);
            assertThat(error.path()).containsExactly("workflow", "executions");
        });
    }

    @Test
    void slowFetchTimesOutIndependently() {
        properties.getExecution().setFetchTimeout(Duration.ofMillis(100));
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": "Ingest", "__typename": "Workflow"}}}
            """);
        when(client.execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(), anyBoolean()))
            .thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return response("{\"data\": {\"_entities\": [{\"executions\": []}]}}");
            });

        GraphQLResponse response = execute("{ workflow(id: \"1\") { name executions { id } } }");

        assertThat(response.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(FederatedExecutor.TIMEOUT);
            assertThat(error.message()).contains("timed out");
            assertThat(error.subgraph()).isEqualTo(TestSubgraphs.CONTENT);
        });
    }

    @Test
    void mutationsAreNotRetriedAndRunInOrder() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"first": {"id": "w1"}}}
            """);
        stub(TestSubgraphs.CONTENT, """
            {"data": {"doc": {"id": "d1"}}}
            """);

        GraphQLResponse response = execute("""
            mutation {
              first: startWorkflow(name: "ingest") { id }
              doc: processDocument(id: "d1") { id }
            }
            """);

        assertThat(response.errors()).isEmpty();
        assertThat(response.data()).containsOnlyKeys("first", "doc");
        verify(client).execute(eq(TestSubgraphs.WORKFLOWS), anyString(), anyString(), anyMap(), eq(false));
        verify(client).execute(eq(TestSubgraphs.CONTENT), anyString(), anyString(), anyMap(), eq(false));
    }

    @Test
    void omittedVariableTakesItsDefaultValueForInclude() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1", "name": "Ingest"}}}
            """);

        GraphQLResponse response = execute("""
            query ($inc: Boolean = true) { workflow(id: "1") { id name @include(if: $inc) } }
            """);

        assertThat(response.errors()).isEmpty();
        assertThat(object(response.data(), "workflow")).containsEntry("id", "1").containsEntry("name", "Ingest");
    }

    @Test
    void providedVariableOverridesDefaultValue() {
        stub(TestSubgraphs.WORKFLOWS, """
            {"data": {"workflow": {"id": "1"}}}
            """);
        QueryPlan plan = planner.plan(schema, Parser.parse("""
            query ($inc: Boolean = true) { workflow(id: "1") { id name @include(if: $inc) } }
            """), null, Set.of());

        GraphQLResponse response = executor.execute(plan, schema, Map.of("inc", false));

        assertThat(response.errors()).isEmpty();
        assertThat(object(response.data(), "workflow")).containsOnlyKeys("id");
    }

    private GraphQLResponse execute(String query) {
        QueryPlan plan = planner.plan(schema, Parser.parse(query), null, Set.of());
        return executor.execute(plan, schema, Map.of());
    }

    private void stub(String subgraph, String json) {
        when(client.execute(eq(subgraph), anyString(), anyString(), anyMap(), anyBoolean()))
            .thenReturn(response(json));
    }

    @SuppressWarnings("unchecked")
    private static SubgraphResponse response(String json) {
        Map<String, Object> body = TestSubgraphs.json(json);
        return new SubgraphResponse((Map<String, Object>) body.get("data"),
            (List<Map<String, Object>>) body.getOrDefault("errors", List.of()));
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> representationsSentTo(String subgraph) {
        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(client).execute(eq(subgraph), anyString(), anyString(), variables.capture(), anyBoolean());
        return (List<Map<String, Object>>) variables.getValue().get("representations");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> data, String key) {
        return (Map<String, Object>) data.get(key);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Map<String, Object> data, String key) {
        return (List<Object>) data.get(key);
    }
}
