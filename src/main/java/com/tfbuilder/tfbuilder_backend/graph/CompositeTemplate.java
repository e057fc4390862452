package com.tfbuilder.tfbuilder_backend.graph;

import com.tfbuilder.tfbuilder_backend.model.domain.IconTag;

public enum CompositeTemplate {
    REST_API("REST API with Gateway, Lambda, and IAM roles", IconTag.API),
    VPC_NETWORK("VPC network with subnets, route tables, and NAT gateways", IconTag.CLOUD),
    SERVERLESS_BACKEND("Serverless backend with Lambda, DynamoDB, and API Gateway", IconTag.CODE),
    DATABASE_CLUSTER("Database cluster with RDS instances and security groups", IconTag.STORAGE),
    CUSTOM("Custom group of resources", IconTag.CATEGORY);

    private final String description;
    private final IconTag iconTag;

    CompositeTemplate(String description, IconTag iconTag) {
        this.description = description;
        this.iconTag = iconTag;
    }

    public String getDescription() {
        return description;
    }

    public IconTag getIconTag() {
        return iconTag;
    }
}
