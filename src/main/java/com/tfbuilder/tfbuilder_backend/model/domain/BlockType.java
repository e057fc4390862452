package com.tfbuilder.tfbuilder_backend.model.domain;

public enum BlockType {
    LOAD_BALANCER,  // ALB, ELB, target groups, listeners
    EC2,            // instances, launch templates
    VPC,            // VPC, subnets, route tables, gateways
    SECURITY,       // IAM, KMS, security groups, secrets
    LAMBDA,         // functions, layers, permissions
    ECS,            // clusters, services, task definitions
    RDS,            // DB instances, clusters, subnet groups
    DYNAMODB,
    STORAGE,        // S3
    MONITORING,     // CloudWatch, X-Ray
    API_GATEWAY,
    SQS,
    SNS,
    KINESIS,
    INTEGRATION     // fallback for anything unmatched
}
