package com.tfbuilder.tfbuilder_backend.controller;

import com.tfbuilder.tfbuilder_backend.TestFixtures;
import com.tfbuilder.tfbuilder_backend.service.ProjectService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ProjectControllerTest {

    @TempDir
    Path projectsDir;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ProjectService projects = new ProjectService(
                TestFixtures.objectMapper(), TestFixtures.workspace(), TestFixtures.canvasMapper(), projectsDir.toString());
        mvc = MockMvcBuilders.standaloneSetup(new ProjectController(projects))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(TestFixtures.objectMapper()))
                .build();
    }

    @Test
    void createsListsAndDeletesProjects() throws Exception {
        MvcResult created = mvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Payments\", \"description\": \"payment stack\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Payments"))
                .andReturn();
        String id = TestFixtures.objectMapper()
                .readTree(created.getResponse().getContentAsString()).get("id").asText();

        mvc.perform(get("/api/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(id));
        mvc.perform(post("/api/projects/" + id + "/save")).andExpect(status().isOk());
        mvc.perform(post("/api/projects/" + id + "/load")).andExpect(jsonPath("$.id").value(id));
        mvc.perform(delete("/api/projects/" + id)).andExpect(status().isNoContent());
        mvc.perform(get("/api/projects")).andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void unknownProjectIsNotFound() throws Exception {
        mvc.perform(post("/api/projects/does-not-exist/load"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void blankNameIsABadRequest() throws Exception {
        mvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\"}"))
                .andExpect(status().isBadRequest());
    }
}
