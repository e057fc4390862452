package com.tfbuilder.tfbuilder_backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfbuilder.tfbuilder_backend.model.domain.Project;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CompositeBlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Saves and restores workspaces as project directories under
 * {@code app.projects.dir}. Each project directory holds metadata.json,
 * blocks.json, composites.json, connections.json and variables.json;
 * project_state.json in the root keeps the recent-project list.
 */
@Slf4j
@Service
public class ProjectService {

    static final String STATE_FILE = "project_state.json";
    static final String METADATA_FILE = "metadata.json";
    static final String BLOCKS_FILE = "blocks.json";
    static final String COMPOSITES_FILE = "composites.json";
    static final String CONNECTIONS_FILE = "connections.json";
    static final String VARIABLES_FILE = "variables.json";

    private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final ObjectMapper objectMapper;
    private final WorkspaceService workspace;
    private final CanvasMapper canvasMapper;
    private final Path projectsDir;

    public ProjectService(ObjectMapper objectMapper,
                          WorkspaceService workspace,
                          CanvasMapper canvasMapper,
                          @Value("${app.projects.dir:${user.home}/.tfbuilder/projects}") String projectsDir) {
        this.objectMapper = objectMapper;
        this.workspace = workspace;
        this.canvasMapper = canvasMapper;
        this.projectsDir = Paths.get(projectsDir);
    }

    public List<Project> listRecent() {
        return loadState().recentProjects();
    }

    /** Creates an empty project and records it as the most recent one. */
    public Project create(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        Project project = Project.create(name, description);
        writeProject(project, new CanvasDto(List.of(), List.of(), List.of(), List.of(), null));
        saveState(loadState().withRecent(project));
        log.info("Created project {} ({})", project.getName(), project.getId());
        return project;
    }

    /** Writes the live workspace into an existing project. */
    public Project save(String projectId) {
        Project project = readMetadata(projectId).touched();
        writeProject(project, workspace.getCanvas());
        saveState(loadState().withRecent(project));
        log.info("Saved project {} ({})", project.getName(), project.getId());
        return project;
    }

    /** Replaces the live workspace with the stored project. */
    public Project load(String projectId) {
        Project project = readMetadata(projectId).touched();
        Path dir = projectDir(projectId);
        List<BlockDto> blocks = readList(dir.resolve(BLOCKS_FILE), new TypeReference<>() {});
        List<CompositeBlockDto> composites = readList(dir.resolve(COMPOSITES_FILE), new TypeReference<>() {});
        List<ConnectionDto> connections = readList(dir.resolve(CONNECTIONS_FILE), new TypeReference<>() {});
        List<TerraformVariable> variables = readList(dir.resolve(VARIABLES_FILE), new TypeReference<>() {});

        workspace.replaceGraph(canvasMapper.toGraph(new CanvasDto(blocks, composites, connections, variables, null)));
        write(dir.resolve(METADATA_FILE), project);
        saveState(loadState().withRecent(project));
        log.info("Loaded project {}: {} blocks, {} composites, {} connections",
                projectId, blocks.size(), composites.size(), connections.size());
        return project;
    }

    public void delete(String projectId) {
        Path dir = projectDir(projectId);
        if (!Files.isDirectory(dir)) {
            throw new NoSuchElementException("Project not found: " + projectId);
        }
        try (Stream<Path> tree = Files.walk(dir)) {
            for (Path path : tree.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            log.error("Failed to delete project directory {}: {}", dir, e.getMessage());
            throw new PersistenceException(dir.toString(), "delete", e);
        }
        saveState(loadState().without(projectId));
        log.info("Deleted project {}", projectId);
    }

    // ── Files ────────────────────────────────────────────────────────────────

    private void writeProject(Project project, CanvasDto canvas) {
        Path dir = projectDir(project.getId());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create project directory {}: {}", dir, e.getMessage());
            throw new PersistenceException(dir.toString(), "create", e);
        }
        write(dir.resolve(METADATA_FILE), project);
        write(dir.resolve(BLOCKS_FILE), canvas.blocks());
        write(dir.resolve(COMPOSITES_FILE), canvas.composites());
        write(dir.resolve(CONNECTIONS_FILE), canvas.connections());
        write(dir.resolve(VARIABLES_FILE), canvas.variables());
    }

    private Project readMetadata(String projectId) {
        Path file = projectDir(projectId).resolve(METADATA_FILE);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchElementException("Project not found: " + projectId);
        }
        try {
            return objectMapper.readValue(file.toFile(), Project.class);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            throw new PersistenceException(file.toString(), "read", e);
        }
    }

    // Missing list files read as empty.
    private <T> List<T> readList(Path file, TypeReference<List<T>> type) {
        if (!Files.isRegularFile(file)) return List.of();
        try {
            List<T> values = objectMapper.readValue(file.toFile(), type);
            return values != null ? values : List.of();
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            throw new PersistenceException(file.toString(), "read", e);
        }
    }

    private void write(Path file, Object value) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", file, e.getMessage());
            throw new PersistenceException(file.toString(), "write", e);
        }
    }

    private ProjectState loadState() {
        Path file = projectsDir.resolve(STATE_FILE);
        if (!Files.isRegularFile(file)) return new ProjectState(List.of());
        try {
            return objectMapper.readValue(file.toFile(), ProjectState.class);
        } catch (IOException e) {
            log.warn("Unreadable {}, starting with an empty recent list: {}", file, e.getMessage());
            return new ProjectState(List.of());
        }
    }

    private void saveState(ProjectState state) {
        try {
            Files.createDirectories(projectsDir);
        } catch (IOException e) {
            throw new PersistenceException(projectsDir.toString(), "create", e);
        }
        write(projectsDir.resolve(STATE_FILE), state);
    }

    private Path projectDir(String projectId) {
        if (projectId == null || !PROJECT_ID.matcher(projectId).matches()) {
            throw new IllegalArgumentException("Invalid project id: " + projectId);
        }
        return projectsDir.resolve(projectId);
    }
}
