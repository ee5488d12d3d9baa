package ch.sbb.federation.gateway.protocol;

import ch.sbb.federation.gateway.TestSubgraphs;
import ch.sbb.federation.gateway.config.SubgraphBootstrap;
import ch.sbb.federation.gateway.error.CompositionException;
import ch.sbb.federation.gateway.model.SubgraphHealth;
import ch.sbb.federation.gateway.registry.SchemaComposer;
import ch.sbb.federation.gateway.registry.SchemaRegistry;
import ch.sbb.federation.gateway.registry.SdlParser;
import ch.sbb.federation.gateway.registry.SubgraphHealthMonitor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SubgraphAdminControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SchemaRegistry registry;
    private SubgraphBootstrap bootstrap;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry(new SdlParser(), new SchemaComposer(), mock(ApplicationEventPublisher.class));
        SubgraphHealthMonitor healthMonitor = mock(SubgraphHealthMonitor.class);
        when(healthMonitor.status(anyString())).thenReturn(SubgraphHealth.initial());
        bootstrap = mock(SubgraphBootstrap.class);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new SubgraphAdminController(registry, healthMonitor, bootstrap))
            .build();
    }

    @Test
    void registersSubgraph() throws Exception {
        mockMvc.perform(post("/admin/subgraphs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(registration(TestSubgraphs.WORKFLOWS, TestSubgraphs.WORKFLOWS_URL,
                    TestSubgraphs.WORKFLOWS_SDL)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.registered").value(TestSubgraphs.WORKFLOWS))
            .andExpect(jsonPath("$.generation").value(1));

        mockMvc.perform(get("/admin/subgraphs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subgraphs[0].name").value(TestSubgraphs.WORKFLOWS))
            .andExpect(jsonPath("$.subgraphs[0].status").value("HEALTHY"));
    }

    @Test
    void malformedSdlIsBadRequest() throws Exception {
        mockMvc.perform(post("/admin/subgraphs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(registration("broken", "http://broken", "type Query {")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(containsString("Malformed SDL")));
    }

    @Test
    void missingNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/admin/subgraphs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("url", "http://x", "sdl", "type Query { a: Int }"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing required field: name"));
    }

    @Test
    void compositionConflictIsReportedWithConflicts() throws Exception {
        registry.registerAndCompose(TestSubgraphs.WORKFLOWS, TestSubgraphs.WORKFLOWS_URL, null,
            TestSubgraphs.WORKFLOWS_SDL);

        mockMvc.perform(post("/admin/subgraphs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(registration("knowledge_graph", "http://localhost:4003/graphql",
                    "type Query { workflows: [String] }")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.conflicts[0].coordinate").value("Query.workflows"))
            .andExpect(jsonPath("$.conflicts[0].subgraphs[0]").value(TestSubgraphs.WORKFLOWS))
            .andExpect(jsonPath("$.conflicts[0].subgraphs[1]").value("knowledge_graph"));
    }

    @Test
    void updatingOrRemovingUnknownSubgraphIsNotFound() throws Exception {
        mockMvc.perform(put("/admin/subgraphs/missing")
                .contentType(MediaType.APPLICATION_JSON)
                .content(registration("missing", "http://missing", "type Query { a: Int }")))
            .andExpect(status().isNotFound());

        mockMvc.perform(delete("/admin/subgraphs/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value(containsString("missing")));
    }

    @Test
    void exposesComposedSchemaWithOwnership() throws Exception {
        registry.registerAndCompose(TestSubgraphs.WORKFLOWS, TestSubgraphs.WORKFLOWS_URL, null,
            TestSubgraphs.WORKFLOWS_SDL);
        registry.registerAndCompose(TestSubgraphs.CONTENT, TestSubgraphs.CONTENT_URL, null,
            TestSubgraphs.CONTENT_SDL);

        mockMvc.perform(get("/admin/schema"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.generation").value(2))
            .andExpect(jsonPath("$.sdl").value(containsString("type Workflow @key(fields: \"id\")")))
            .andExpect(jsonPath("$.ownership['Workflow.executions']").value(TestSubgraphs.CONTENT))
            .andExpect(jsonPath("$.ownership['Workflow.name']").value(TestSubgraphs.WORKFLOWS));

        mockMvc.perform(get("/admin/schema/validate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(get("/admin/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subgraphs.workflows.status").value("HEALTHY"));
    }

    @Test
    void removesSubgraph() throws Exception {
        registry.registerAndCompose(TestSubgraphs.WORKFLOWS, TestSubgraphs.WORKFLOWS_URL, null,
            TestSubgraphs.WORKFLOWS_SDL);
        registry.registerAndCompose(TestSubgraphs.CONTENT, TestSubgraphs.CONTENT_URL, null,
            TestSubgraphs.CONTENT_SDL);

        mockMvc.perform(delete("/admin/subgraphs/" + TestSubgraphs.CONTENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(TestSubgraphs.CONTENT))
            .andExpect(jsonPath("$.generation").value(3));
    }

    @Test
    void reloadReportsFailedSubgraphs() throws Exception {
        when(bootstrap.reload()).thenReturn(List.of("knowledge_graph"));

        mockMvc.perform(post("/admin/schema/reload"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.failed[0]").value("knowledge_graph"))
            .andExpect(jsonPath("$.generation").value(0));
    }

    @Test
    void reloadConflictIsReportedWithConflicts() throws Exception {
        when(bootstrap.reload()).thenThrow(new CompositionException(List.of(
            new CompositionException.Conflict("Workflow.name", List.of(TestSubgraphs.WORKFLOWS, "rogue"),
                "field 'name' is defined in multiple subgraphs without @shareable or @override"))));

        mockMvc.perform(post("/admin/schema/reload"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.conflicts[0].coordinate").value("Workflow.name"))
            .andExpect(jsonPath("$.conflicts[0].subgraphs[1]").value("rogue"));
    }

    private String registration(String name, String url, String sdl) throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("name", name);
        body.put("url", url);
        body.put("sdl", sdl);
        return objectMapper.writeValueAsString(body);
    }
}
