package ch.sbb.federation.gateway.registry;

import ch.sbb.federation.gateway.TestSubgraphs;
import ch.sbb.federation.gateway.error.CompositionException;
import ch.sbb.federation.gateway.error.CompositionException.Conflict;
import ch.sbb.federation.gateway.model.ComposedField;
import ch.sbb.federation.gateway.model.ComposedSchema;
import ch.sbb.federation.gateway.model.ComposedType;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SchemaComposerTest {

    private final SdlParser parser = new SdlParser();
    private final SchemaComposer composer = new SchemaComposer();

    @Test
    void mergesEntityFieldsAcrossSubgraphs() {
        ComposedSchema schema = TestSubgraphs.composed();

        ComposedType workflow = schema.type("Workflow");
        assertThat(workflow.isEntity()).isTrue();
        assertThat(workflow.keys()).containsExactly(List.of("id"));
        assertThat(workflow.fields()).containsOnlyKeys("id", "name", "status", "executions");
        assertThat(workflow.subgraphs()).containsExactly(TestSubgraphs.WORKFLOWS, TestSubgraphs.CONTENT);

        assertThat(workflow.field("name").owner()).isEqualTo(TestSubgraphs.WORKFLOWS);
        assertThat(workflow.field("executions").owner()).isEqualTo(TestSubgraphs.CONTENT);
        assertThat(workflow.field("id").resolvers())
            .containsExactly(TestSubgraphs.WORKFLOWS, TestSubgraphs.CONTENT);

        assertThat(schema.type("Query").fields()).containsOnlyKeys("workflow", "workflows", "document");
        assertThat(schema.type("Mutation").fields()).containsOnlyKeys("startWorkflow", "processDocument");
        assertThat(schema.ownership())
            .containsEntry("Workflow.executions", TestSubgraphs.CONTENT)
            .containsEntry("Query.workflow", TestSubgraphs.WORKFLOWS);
        assertThat(schema.generation()).isEqualTo(1);
    }

    @Test
    void rejectsFieldDefinedTwiceWithoutShareable() {
        CompositionException e = catchThrowableOfType(() -> composer.compose(List.of(
            subgraph("a", "type Query { status: String }"),
            subgraph("b", "type Query { status: String }")), 1), CompositionException.class);

        assertThat(e).isNotNull();
        assertThat(e.getConflicts()).hasSize(1);
        Conflict conflict = e.getConflicts().get(0);
        assertThat(conflict.coordinate()).isEqualTo("Query.status");
        assertThat(conflict.subgraphs()).containsExactly("a", "b");
        assertThat(e.getMessage()).contains("Query.status").contains("a").contains("b");
    }

    @Test
    void acceptsShareableFieldsWithSeveralResolvers() {
        ComposedSchema schema = composer.compose(List.of(
            subgraph("a", "type Query { a: Location } type Location { lat: Float @shareable }"),
            subgraph("b", "type Query { b: Location } type Location { lat: Float @shareable }")), 1);

        ComposedField lat = schema.field("Location", "lat");
        assertThat(lat.shareable()).isTrue();
        assertThat(lat.owner()).isEqualTo("a");
        assertThat(lat.resolvers()).containsExactly("a", "b");
    }

    @Test
    void overrideMovesOwnership() {
        ComposedSchema schema = composer.compose(List.of(
            subgraph("products", """
                type Query { product(upc: String!): Product }
                type Product @key(fields: "upc") { upc: String! stock: Int }
                """),
            subgraph("inventory", """
                type Product @key(fields: "upc") {
                  upc: String!
                  stock: Int @override(from: "products")
                }
                """)), 1);

        ComposedField stock = schema.field("Product", "stock");
        assertThat(stock.owner()).isEqualTo("inventory");
        assertThat(stock.resolvers()).containsExactly("inventory");
    }

    @Test
    void rejectsKeyThatMatchesNoOriginKey() {
        assertThatThrownBy(() -> composer.compose(List.of(
            subgraph("a", "type Query { w: Workflow } type Workflow @key(fields: \"id\") { id: ID! name: String }"),
            subgraph("c", """
                extend type Workflow @key(fields: "name") {
                  name: String @external
                  owner: String
                }
                """)), 1))
            .isInstanceOf(CompositionException.class)
            .hasMessageContaining("matches no key declared by a");
    }

    @Test
    void reportsEveryConflictAtOnce() {
        CompositionException e = catchThrowableOfType(() -> composer.compose(List.of(
            subgraph("a", "type Query { status: String count: Int } enum Color { RED }"),
            subgraph("b", "type Query { status: String count: Int } type Color { id: ID }")), 1),
            CompositionException.class);

        assertThat(e.getConflicts()).extracting(Conflict::coordinate)
            .containsExactlyInAnyOrder("Query.status", "Query.count", "Color");
    }

    @Test
    void rejectsDifferentReturnTypes() {
        assertThatThrownBy(() -> composer.compose(List.of(
            subgraph("a", "type Query { a: Item } type Item @key(fields: \"id\") { id: ID! size: Int }"),
            subgraph("b", "type Item @key(fields: \"id\") { id: String! }")), 1))
            .isInstanceOf(CompositionException.class)
            .hasMessageContaining("Item.id")
            .hasMessageContaining("different return types");
    }

    @Test
    void resolvesInterfaceImplementations() {
        ComposedSchema schema = composer.compose(List.of(
            subgraph("media", """
                type Query { media: [Media] }
                interface Media { id: ID! }
                type Book implements Media { id: ID! pages: Int }
                type Movie implements Media { id: ID! minutes: Int }
                """)), 1);

        assertThat(schema.possibleTypes("Media")).containsExactlyInAnyOrder("Book", "Movie");
        assertThat(schema.possibleTypes("Book")).containsExactly("Book");
    }

    @Test
    void rejectsEmptySubgraphList() {
        assertThatThrownBy(() -> composer.compose(List.of(), 1))
            .isInstanceOf(CompositionException.class)
            .hasMessageContaining("no subgraphs registered");
    }

    private SubgraphSchema subgraph(String name, String sdl) {
        return parser.parse(name, "http://" + name, null, sdl);
    }
}
