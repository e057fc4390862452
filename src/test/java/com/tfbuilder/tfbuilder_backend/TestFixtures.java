package com.tfbuilder.tfbuilder_backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfbuilder.tfbuilder_backend.config.JacksonConfig;
import com.tfbuilder.tfbuilder_backend.graph.CompositeBlockFactory;
import com.tfbuilder.tfbuilder_backend.graph.ResourceGraph;
import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.schema.ClasspathSchemaProvider;
import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import com.tfbuilder.tfbuilder_backend.service.CanvasMapper;
import com.tfbuilder.tfbuilder_backend.service.WorkspaceService;
import com.tfbuilder.tfbuilder_backend.terraform.ResourceTypeCategorizer;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformParser;
import com.tfbuilder.tfbuilder_backend.terraform.reference.ReferenceAnalyzer;
import com.tfbuilder.tfbuilder_backend.terraform.reference.TerraformReferenceService;

/** Real pipeline objects wired by hand, backed by the bundled provider schema. */
public final class TestFixtures {

    public static final String SCHEMA_LOCATION = "classpath:schema/aws-provider-schema.json";

    private static SchemaProvider schemaProvider;

    private TestFixtures() {}

    public static ObjectMapper objectMapper() {
        return new JacksonConfig().objectMapper();
    }

    public static synchronized SchemaProvider schemaProvider() {
        if (schemaProvider == null) {
            ClasspathSchemaProvider provider = new ClasspathSchemaProvider(objectMapper(), SCHEMA_LOCATION);
            provider.initialize();
            schemaProvider = provider;
        }
        return schemaProvider;
    }

    public static ResourceTypeCategorizer categorizer() {
        return new ResourceTypeCategorizer();
    }

    public static TerraformParser parser() {
        return new TerraformParser(categorizer(), schemaProvider());
    }

    public static TerraformReferenceService referenceService() {
        return new TerraformReferenceService(new ReferenceAnalyzer());
    }

    public static ResourceGraph graph() {
        return new ResourceGraph(schemaProvider(), referenceService());
    }

    public static CanvasMapper canvasMapper() {
        return new CanvasMapper(schemaProvider(), referenceService());
    }

    public static WorkspaceService workspace() {
        return new WorkspaceService(canvasMapper(), new CompositeBlockFactory(categorizer()), categorizer());
    }

    public static Block block(String id, ResourceType type, String content) {
        return block(id, type, content, Point.ZERO);
    }

    public static Block block(String id, ResourceType type, String content, Point position) {
        return Block.builder()
                .id(id)
                .resourceType(type)
                .type(categorizer().determineBlockType(type))
                .content(content)
                .position(position)
                .build();
    }
}
