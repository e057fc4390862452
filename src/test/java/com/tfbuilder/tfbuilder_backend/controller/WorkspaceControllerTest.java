package com.tfbuilder.tfbuilder_backend.controller;

import com.tfbuilder.tfbuilder_backend.TestFixtures;
import com.tfbuilder.tfbuilder_backend.engine.DependencyInferenceEngine;
import com.tfbuilder.tfbuilder_backend.engine.TerraformCodeGenerator;
import com.tfbuilder.tfbuilder_backend.engine.TerraformOutputWriter;
import com.tfbuilder.tfbuilder_backend.service.GenerationService;
import com.tfbuilder.tfbuilder_backend.service.IngestionService;
import com.tfbuilder.tfbuilder_backend.service.WorkspaceService;
import com.tfbuilder.tfbuilder_backend.terraform.LocalDirectoryLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkspaceControllerTest {

    private MockMvc mvc;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        WorkspaceService workspace = TestFixtures.workspace();
        IngestionService ingestion = new IngestionService(
                TestFixtures.parser(), new LocalDirectoryLoader(), TestFixtures.canvasMapper(), workspace);
        GenerationService generation = new GenerationService(
                new DependencyInferenceEngine(TestFixtures.schemaProvider()),
                new TerraformCodeGenerator(TestFixtures.schemaProvider(), "us-west-2"),
                new TerraformOutputWriter(),
                workspace,
                TestFixtures.canvasMapper());
        mvc = MockMvcBuilders.standaloneSetup(new WorkspaceController(workspace, ingestion, generation))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(TestFixtures.objectMapper()))
                .build();
    }

    private ResultActions postJson(String path, String body) throws Exception {
        return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private ResultActions putJson(String path, String body) throws Exception {
        return mvc.perform(put(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private void addNode(String id, String resourceType, String content, double x) throws Exception {
        postJson("/api/workspace/nodes", """
                {"id": "%s", "resourceType": "%s", "content": "%s", "x": %s, "y": 0}""".formatted(id, resourceType, content, x))
                .andExpect(status().isCreated());
    }

    // ========== nodes ==========

    @Test
    void createsAndEditsNodes() throws Exception {
        postJson("/api/workspace/nodes", "{\"resourceType\": \"VPC\", \"content\": \"main\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNotEmpty())
                .andExpect(jsonPath("$.type").value("VPC"))
                .andExpect(jsonPath("$.properties.enable_dns_support").value("true"));

        addNode("vpc", "VPC", "core", 0);
        putJson("/api/workspace/nodes/vpc/position", "{\"x\": 15, \"y\": 25}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.x").value(15.0));
        putJson("/api/workspace/nodes/vpc/properties/cidr_block", "{\"value\": \"10.0.0.0/16\"}")
                .andExpect(jsonPath("$.properties.cidr_block").value("10.0.0.0/16"));
        mvc.perform(delete("/api/workspace/nodes/vpc/properties/cidr_block"))
                .andExpect(jsonPath("$.properties.cidr_block").doesNotExist());

        mvc.perform(get("/api/workspace"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocks", hasSize(2)));
    }

    @Test
    void unknownNodeIsNotFound() throws Exception {
        mvc.perform(get("/api/workspace/nodes/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        mvc.perform(delete("/api/workspace/nodes/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void incompleteGeometryIsABadRequest() throws Exception {
        addNode("vpc", "VPC", "core", 0);

        putJson("/api/workspace/nodes/vpc/size", "{\"width\": 200}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    // ========== connections ==========

    @Test
    void rejectedConnectionIsUnprocessable() throws Exception {
        addNode("vpc", "VPC", "core", 0);

        postJson("/api/workspace/connections", "{\"sourceBlockId\": \"vpc\", \"targetBlockId\": \"vpc\"}")
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void dragCreatesAConnection() throws Exception {
        addNode("vpc", "VPC", "core", 0);
        addNode("subnet", "SUBNET", "public", 300);

        postJson("/api/workspace/drag/start", "{\"blockId\": \"vpc\", \"origin\": \"OUTPUT\"}")
                .andExpect(status().isNoContent());
        postJson("/api/workspace/drag/move", "{\"x\": 200, \"y\": 20}")
                .andExpect(status().isNoContent());
        postJson("/api/workspace/drag/end", "{\"x\": 295, \"y\": 21}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sourceBlockId").value("vpc"))
                .andExpect(jsonPath("$.targetBlockId").value("subnet"));

        postJson("/api/workspace/drag/start", "{\"blockId\": \"vpc\", \"origin\": \"OUTPUT\"}");
        postJson("/api/workspace/drag/end", "{\"x\": 900, \"y\": 900}")
                .andExpect(status().isNoContent());
    }

    @Test
    void dragStartNeedsAnOrigin() throws Exception {
        addNode("vpc", "VPC", "core", 0);

        postJson("/api/workspace/drag/start", "{\"blockId\": \"vpc\"}")
                .andExpect(status().isBadRequest());
    }

    // ========== composites ==========

    @Test
    void templatesGetADefaultName() throws Exception {
        postJson("/api/workspace/templates", "{\"template\": \"VPC_NETWORK\", \"x\": 10, \"y\": 10}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("vpc-network"))
                .andExpect(jsonPath("$.iconTag").value("CLOUD"))
                .andExpect(jsonPath("$.children", hasSize(3)));
    }

    @Test
    void groupsAndEntersScope() throws Exception {
        addNode("vpc", "VPC", "core", 0);

        MvcResult created = postJson("/api/workspace/groups", "{\"blockIds\": [\"vpc\"], \"name\": \"net\", \"iconTag\": \"CLOUD\"}")
                .andExpect(status().isCreated())
                .andReturn();
        String compositeId = TestFixtures.objectMapper()
                .readTree(created.getResponse().getContentAsString()).get("id").asText();

        mvc.perform(post("/api/workspace/scope/" + compositeId)).andExpect(status().isNoContent());
        mvc.perform(get("/api/workspace")).andExpect(jsonPath("$.currentCompositeId").value(compositeId));
        mvc.perform(post("/api/workspace/scope/unknown")).andExpect(status().isNotFound());
        mvc.perform(delete("/api/workspace/scope")).andExpect(status().isNoContent());
        mvc.perform(post("/api/workspace/groups/" + compositeId + "/ungroup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("vpc"));
    }

    // ========== variables ==========

    @Test
    void duplicateVariableConflicts() throws Exception {
        String env = "{\"name\": \"env\", \"type\": \"STRING\", \"defaultValue\": \"dev\"}";

        postJson("/api/workspace/variables", env).andExpect(status().isCreated());
        postJson("/api/workspace/variables", env).andExpect(status().isConflict());
        mvc.perform(get("/api/workspace/variables"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].sensitive").value(false));
        mvc.perform(delete("/api/workspace/variables/other")).andExpect(status().isNotFound());
    }

    // ========== ingestion and generation ==========

    @Test
    void loadsDocumentsAndGenerates() throws Exception {
        postJson("/api/workspace/load", "{\"documents\": [\"resource \\\"aws_instance\\\" \\\"web\\\" {\\n  ami = \\\"ami-123\\\"\\n}\"]}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodeCount").value(1));

        mvc.perform(post("/api/workspace/generate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.files['outputs.tf']").value(containsString("web_public_ip")));
    }

    @Test
    void emptyWorkspaceGenerationIsUnprocessable() throws Exception {
        mvc.perform(post("/api/workspace/generate"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("GENERATION_REFUSED"));
    }

    @Test
    void loadsADirectoryAsynchronously() throws Exception {
        Files.writeString(dir.resolve("main.tf"), "resource \"aws_sqs_queue\" \"jobs\" {}\n");

        MvcResult started = postJson("/api/workspace/load-directory", "{\"path\": \"" + dir.toString().replace("\\", "\\\\") + "\"}")
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodeCount").value(1));
        mvc.perform(get("/api/workspace/nodes/aws_sqs_queue_jobs")).andExpect(status().isOk());
    }
}
