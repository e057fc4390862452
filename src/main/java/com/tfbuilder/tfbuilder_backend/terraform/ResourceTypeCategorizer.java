package com.tfbuilder.tfbuilder_backend.terraform;

import com.tfbuilder.tfbuilder_backend.model.domain.BlockType;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns the product category of a resource type: manual overrides first,
 * then substring patterns per AWS product, INTEGRATION when nothing matches.
 * Product-specific patterns are checked before broad ones ("db_instance"
 * before "instance", "lambda" before "function").
 */
@Component
public class ResourceTypeCategorizer {

    private static final Map<ResourceType, BlockType> MANUAL_OVERRIDES = new EnumMap<>(Map.of(
            ResourceType.S3_BUCKET, BlockType.STORAGE,
            ResourceType.ELB, BlockType.LOAD_BALANCER,
            ResourceType.LB, BlockType.LOAD_BALANCER,
            ResourceType.RDS_INSTANCE, BlockType.RDS
    ));

    private static final Map<BlockType, List<String>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(BlockType.RDS, List.of("rds", "db_instance", "db_cluster", "db_subnet_group",
                "db_parameter_group", "db_option_group", "db_snapshot"));
        PATTERNS.put(BlockType.DYNAMODB, List.of("dynamodb"));
        PATTERNS.put(BlockType.LAMBDA, List.of("lambda", "layer_version", "event_source"));
        PATTERNS.put(BlockType.API_GATEWAY, List.of("api_gateway", "apigateway", "apigatewayv2", "rest_api"));
        PATTERNS.put(BlockType.ECS, List.of("ecs", "task_definition", "capacity_provider"));
        PATTERNS.put(BlockType.STORAGE, List.of("s3", "bucket"));
        PATTERNS.put(BlockType.MONITORING, List.of("cloudwatch", "metric_alarm", "log_group", "dashboard", "xray"));
        PATTERNS.put(BlockType.SQS, List.of("sqs", "queue"));
        PATTERNS.put(BlockType.SNS, List.of("sns", "topic", "subscription"));
        PATTERNS.put(BlockType.KINESIS, List.of("kinesis", "firehose"));
        PATTERNS.put(BlockType.SECURITY, List.of("security_group", "iam", "kms", "secretsmanager", "waf",
                "guardduty", "securityhub", "macie", "inspector", "detective"));
        PATTERNS.put(BlockType.LOAD_BALANCER, List.of("alb", "elb", "lb_", "target_group", "listener", "certificate"));
        PATTERNS.put(BlockType.VPC, List.of("vpc", "subnet", "route_table", "network_acl", "nat_gateway",
                "internet_gateway", "vpn_gateway", "vpn_connection"));
        PATTERNS.put(BlockType.EC2, List.of("ec2", "instance", "launch_template", "spot_fleet",
                "placement_group", "capacity_reservation"));
    }

    public BlockType determineBlockType(ResourceType resourceType) {
        BlockType override = MANUAL_OVERRIDES.get(resourceType);
        if (override != null) return override;
        return determineBlockType(resourceType.getResourceName());
    }

    /** Categorizes a literal type name, which need not be in the catalog. */
    public BlockType determineBlockType(String typeName) {
        if (typeName == null) return BlockType.INTEGRATION;
        BlockType override = MANUAL_OVERRIDES.get(ResourceType.fromResourceName(typeName));
        if (override != null) return override;

        String name = typeName.toLowerCase(Locale.ROOT);
        for (Map.Entry<BlockType, List<String>> entry : PATTERNS.entrySet()) {
            if (entry.getValue().stream().anyMatch(name::contains)) {
                return entry.getKey();
            }
        }
        return BlockType.INTEGRATION;
    }
}
