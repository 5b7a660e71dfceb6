package com.imaginarium.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the whole application in single-process mode and runs a pipeline
 * of built-in node types through the API.
 */
@SpringBootTest(properties = "orchestrator.dispatch-interval-ms=50")
@ActiveProfiles("in-memory")
@AutoConfigureMockMvc
class OrchestratorApplicationTest {

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @Test
    void builtInPipeline_runsToCompletion() throws Exception {
        String body = mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipelineId":"greeting","userId":"u1","priority":1,
                                 "definition":{
                                   "nodes":[
                                     {"id":"in",    "type":"text-input", "config":{"text":"world"}},
                                     {"id":"greet", "type":"template",   "config":{"template":"Hello {{name}}!"}},
                                     {"id":"out",   "type":"output",     "config":{"label":"greeting"}}],
                                   "connections":[
                                     {"sourceNodeId":"in",    "sourceHandle":"text",
                                      "targetNodeId":"greet", "targetHandle":"name"},
                                     {"sourceNodeId":"greet", "sourceHandle":"text",
                                      "targetNodeId":"out",   "targetHandle":"greeting"}]}}
                                """))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String runId = objectMapper.readTree(body).get("id").asText();

        await().atMost(Duration.ofSeconds(20)).pollInterval(Duration.ofMillis(100))
                .until(() -> "COMPLETED".equals(runStatus(runId)));

        mockMvc.perform(get("/runs/{id}/tasks", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[2].nodeId").value("out"))
                .andExpect(jsonPath("$[2].output.result.greeting").value("Hello world!"))
                .andExpect(jsonPath("$[2].output.result.label").value("greeting"));

        mockMvc.perform(get("/runs/{id}", runId))
                .andExpect(jsonPath("$.progress").value(1.0))
                .andExpect(jsonPath("$.taskCounts.SUCCEEDED").value(3));
    }

    @Test
    void unknownNodeType_isRejectedWith400() throws Exception {
        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipelineId":"p","userId":"u",
                                 "definition":{"nodes":[{"id":"x","type":"teleport","config":{}}],
                                               "connections":[]}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_NODE_TYPE"))
                .andExpect(jsonPath("$.offendingNodes[0]").value("x"));
    }

    @Test
    void health_reportsStoreComponent() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.store.status").value("UP"));
    }

    private String runStatus(String runId) throws Exception {
        String json = mockMvc.perform(get("/runs/{id}", runId)).andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(json);
        assertThat(node.get("status").asText()).isNotIn("FAILED", "CANCELLED");
        return node.get("status").asText();
    }
}
