package com.tfbuilder.tfbuilder_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/** Project metadata stored as metadata.json. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    private String id;
    private String name;
    private String description;
    private Instant lastOpened;

    public static Project create(String name, String description) {
        return new Project(UUID.randomUUID().toString(), name, description != null ? description : "", Instant.now());
    }

    public Project touched() {
        return new Project(id, name, description, Instant.now());
    }
}
