package com.tfbuilder.tfbuilder_backend.controller;

import com.tfbuilder.tfbuilder_backend.model.domain.Project;
import com.tfbuilder.tfbuilder_backend.model.dto.ProjectRequest;
import com.tfbuilder.tfbuilder_backend.service.ProjectService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;

    /** Recent projects, most recent first. */
    @GetMapping
    public List<Project> listRecent() {
        return projectService.listRecent();
    }

    @PostMapping
    public ResponseEntity<Project> create(@RequestBody ProjectRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.create(request.name(), request.description()));
    }

    @PostMapping("/{projectId}/save")
    public Project save(@PathVariable String projectId) {
        return projectService.save(projectId);
    }

    @PostMapping("/{projectId}/load")
    public Project load(@PathVariable String projectId) {
        return projectService.load(projectId);
    }

    @DeleteMapping("/{projectId}")
    public ResponseEntity<Void> delete(@PathVariable String projectId) {
        projectService.delete(projectId);
        return ResponseEntity.noContent().build();
    }
}
