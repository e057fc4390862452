package com.tfbuilder.tfbuilder_backend.graph;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.CompositeBlock;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.terraform.ResourceTypeCategorizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/** Builds pre-populated composites from the template library. */
@Component
@RequiredArgsConstructor
public class CompositeBlockFactory {

    private static final double CHILD_SPACING = 160;

    private final ResourceTypeCategorizer categorizer;

    public CompositeBlock create(CompositeTemplate template, String name, Point position) {
        CompositeBlock composite = new CompositeBlock(name, template.getDescription(), template.getIconTag(), position);
        switch (template) {
            case REST_API -> {
                composite.setProperty("api_name", name);
                composite.setProperty("stage_name", "v1");
                addChild(composite, ResourceType.API_GATEWAY_REST_API, name + "-api", 0, "name");
                addChild(composite, ResourceType.API_GATEWAY_RESOURCE, name + "-api-resource", 1, "path_part");
            }
            case VPC_NETWORK -> {
                composite.setProperty("cidr_block", "10.0.0.0/16");
                addChild(composite, ResourceType.VPC, name + "-vpc", 0, null)
                        .setProperty("cidr_block", "10.0.0.0/16");
                addChild(composite, ResourceType.SUBNET, name + "-subnet", 1, null)
                        .setProperty("cidr_block", "10.0.1.0/24");
                addChild(composite, ResourceType.ROUTE_TABLE, name + "-route-table", 2, null);
            }
            case SERVERLESS_BACKEND -> {
                addChild(composite, ResourceType.LAMBDA_FUNCTION, name + "-handler", 0, "function_name");
                addChild(composite, ResourceType.DYNAMODB_TABLE, name + "-table", 1, "name");
                addChild(composite, ResourceType.API_GATEWAY_REST_API, name + "-api", 2, "name");
            }
            case DATABASE_CLUSTER -> {
                addChild(composite, ResourceType.RDS_INSTANCE, name + "-db", 0, "identifier");
                addChild(composite, ResourceType.SECURITY_GROUP, name + "-db-sg", 1, "name");
            }
            case CUSTOM -> {
                // starts empty
            }
        }
        return composite;
    }

    private Block addChild(CompositeBlock composite, ResourceType type, String content, int index, String nameProperty) {
        Block block = Block.builder()
                .id(UUID.randomUUID().toString())
                .type(categorizer.determineBlockType(type))
                .content(content)
                .resourceType(type)
                .position(composite.getPosition().plus(new Point(index * CHILD_SPACING, 0)))
                .build();
        if (nameProperty != null) {
            block.setProperty(nameProperty, content);
        }
        composite.addChild(block);
        return block;
    }
}
