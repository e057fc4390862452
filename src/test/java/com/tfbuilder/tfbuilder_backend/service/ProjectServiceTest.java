package com.tfbuilder.tfbuilder_backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfbuilder.tfbuilder_backend.TestFixtures;
import com.tfbuilder.tfbuilder_backend.model.domain.Project;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.domain.VariableType;
import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

import static com.tfbuilder.tfbuilder_backend.service.WorkspaceServiceTest.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectServiceTest {

    @TempDir
    Path projectsDir;

    private final ObjectMapper objectMapper = TestFixtures.objectMapper();
    private final WorkspaceService workspace = TestFixtures.workspace();
    private ProjectService projects;

    @BeforeEach
    void setUp() {
        projects = new ProjectService(objectMapper, workspace, TestFixtures.canvasMapper(), projectsDir.toString());
    }

    @Test
    void createWritesAnEmptyProject() {
        Project project = projects.create("Payments", "payment stack");

        Path dir = projectsDir.resolve(project.getId());
        assertThat(dir.resolve(ProjectService.METADATA_FILE)).exists();
        assertThat(dir.resolve(ProjectService.BLOCKS_FILE)).exists();
        assertThat(projectsDir.resolve(ProjectService.STATE_FILE)).exists();
        assertThat(projects.listRecent()).extracting(Project::getName).containsExactly("Payments");
    }

    @Test
    void blankNamesAreRejected() {
        assertThatThrownBy(() -> projects.create(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void saveAndLoadRestoreTheWorkspace() {
        Project project = projects.create("Network", null);
        workspace.addNode(node("vpc", ResourceType.VPC, "main", 10, 20));
        workspace.addNode(node("subnet", ResourceType.SUBNET, "public", 300, 20));
        ConnectionDto connection = workspace.addConnection("vpc", "subnet").orElseThrow();
        workspace.addVariable(new TerraformVariable("env", VariableType.STRING, "Stage", "dev", false));
        workspace.groupNodes(List.of("subnet"), "subnets", null, null);
        CanvasDto saved = workspace.getCanvas();

        projects.save(project.getId());
        workspace.clear();
        projects.load(project.getId());

        CanvasDto loaded = workspace.getCanvas();
        assertThat(loaded.blocks()).isEqualTo(saved.blocks());
        assertThat(loaded.composites()).isEqualTo(saved.composites());
        assertThat(loaded.connections()).containsExactly(connection);
        assertThat(loaded.variables()).isEqualTo(saved.variables());
    }

    @Test
    void recentListIsCappedAndDeduplicated() {
        Project first = projects.create("p0", null);
        for (int i = 1; i <= 11; i++) {
            projects.create("p" + i, null);
        }
        assertThat(projects.listRecent()).hasSize(ProjectState.MAX_RECENT)
                .extracting(Project::getName).startsWith("p11", "p10").doesNotContain("p0", "p1");

        Project reopened = projects.create("again", null);
        projects.save(reopened.getId());
        projects.save(reopened.getId());

        List<Project> recent = projects.listRecent();
        assertThat(recent).hasSize(ProjectState.MAX_RECENT);
        assertThat(recent).filteredOn(p -> p.getId().equals(reopened.getId())).hasSize(1);
        assertThat(recent.get(0).getId()).isEqualTo(reopened.getId());
        assertThat(projectsDir.resolve(first.getId())).isDirectory();
    }

    @Test
    void danglingConnectionsAreDroppedOnLoad() throws IOException {
        Project project = projects.create("Broken", null);
        Path dir = projectsDir.resolve(project.getId());
        objectMapper.writeValue(dir.resolve(ProjectService.BLOCKS_FILE).toFile(),
                List.of(node("a", ResourceType.VPC, "a", 0, 0), node("b", ResourceType.SUBNET, "b", 0, 0)));
        objectMapper.writeValue(dir.resolve(ProjectService.CONNECTIONS_FILE).toFile(),
                List.of(new ConnectionDto("c1", "a", "b"), new ConnectionDto("c2", "b", "missing")));

        projects.load(project.getId());

        assertThat(workspace.getCanvas().blocks()).extracting(BlockDto::id).containsExactly("a", "b");
        assertThat(workspace.getCanvas().connections()).isEmpty();
    }

    @Test
    void missingListFilesReadAsEmpty() throws IOException {
        Project project = projects.create("Sparse", null);
        Files.delete(projectsDir.resolve(project.getId()).resolve(ProjectService.COMPOSITES_FILE));
        Files.delete(projectsDir.resolve(project.getId()).resolve(ProjectService.VARIABLES_FILE));

        projects.load(project.getId());

        assertThat(workspace.getCanvas().composites()).isEmpty();
    }

    @Test
    void unknownAndInvalidIds() {
        assertThatThrownBy(() -> projects.load("nope")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> projects.delete("nope")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> projects.load("../outside")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void corruptMetadataIsAPersistenceError() throws IOException {
        Project project = projects.create("Corrupt", null);
        Files.writeString(projectsDir.resolve(project.getId()).resolve(ProjectService.METADATA_FILE), "{not json");

        assertThatThrownBy(() -> projects.load(project.getId()))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining(ProjectService.METADATA_FILE);
    }

    @Test
    void unreadableStateStartsEmpty() throws IOException {
        Files.writeString(projectsDir.resolve(ProjectService.STATE_FILE), "garbage");

        assertThat(projects.listRecent()).isEmpty();
    }

    @Test
    void deleteRemovesTheDirectoryAndRecentEntry() {
        Project keep = projects.create("Keep", null);
        Project drop = projects.create("Drop", null);

        projects.delete(drop.getId());

        assertThat(projectsDir.resolve(drop.getId())).doesNotExist();
        assertThat(projects.listRecent()).extracting(Project::getId).containsExactly(keep.getId());
    }
}
