package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.model.domain.Project;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Contents of project_state.json: recently opened projects, most recent first. */
public record ProjectState(List<Project> recentProjects) {

    public static final int MAX_RECENT = 10;

    public List<Project> recentProjects() {
        return recentProjects != null ? recentProjects : Collections.emptyList();
    }

    /** Moves {@code project} to the front, replacing any entry with the same id, capped at {@link #MAX_RECENT}. */
    public ProjectState withRecent(Project project) {
        List<Project> updated = new ArrayList<>();
        updated.add(project);
        recentProjects().stream()
                .filter(p -> !p.getId().equals(project.getId()))
                .limit(MAX_RECENT - 1L)
                .forEach(updated::add);
        return new ProjectState(updated);
    }

    public ProjectState without(String projectId) {
        return new ProjectState(recentProjects().stream().filter(p -> !p.getId().equals(projectId)).toList());
    }
}
