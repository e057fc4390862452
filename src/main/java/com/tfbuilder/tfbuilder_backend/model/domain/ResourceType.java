package com.tfbuilder.tfbuilder_backend.model.domain;

import java.util.Arrays;

/**
 * Catalog of resource kinds the builder knows about. {@link #MODULE} and
 * {@link #UNKNOWN} are synthetic entries; everything else maps one-to-one to
 * a provider resource type name.
 */
public enum ResourceType {
    // Compute
    LAMBDA_FUNCTION("Lambda Function", "aws_lambda_function"),
    LAMBDA_PERMISSION("Lambda Permission", "aws_lambda_permission"),
    EC2_INSTANCE("EC2 Instance", "aws_instance"),
    LAUNCH_TEMPLATE("Launch Template", "aws_launch_template"),
    ECS_CLUSTER("ECS Cluster", "aws_ecs_cluster"),
    ECS_SERVICE("ECS Service", "aws_ecs_service"),
    ECS_TASK_DEFINITION("ECS Task Definition", "aws_ecs_task_definition"),

    // Data
    DYNAMODB_TABLE("DynamoDB Table", "aws_dynamodb_table"),
    RDS_INSTANCE("RDS Instance", "aws_db_instance"),
    DB_SUBNET_GROUP("DB Subnet Group", "aws_db_subnet_group"),
    S3_BUCKET("S3 Bucket", "aws_s3_bucket"),
    S3_BUCKET_POLICY("S3 Bucket Policy", "aws_s3_bucket_policy"),
    ELASTICACHE("ElastiCache", "aws_elasticache_cluster"),

    // Network
    VPC("VPC", "aws_vpc"),
    SUBNET("Subnet", "aws_subnet"),
    SECURITY_GROUP("Security Group", "aws_security_group"),
    ROUTE_TABLE("Route Table", "aws_route_table"),
    INTERNET_GATEWAY("Internet Gateway", "aws_internet_gateway"),
    NAT_GATEWAY("NAT Gateway", "aws_nat_gateway"),
    LB("Load Balancer", "aws_lb"),
    ELB("Classic Load Balancer", "aws_elb"),
    LB_TARGET_GROUP("Target Group", "aws_lb_target_group"),
    LB_LISTENER("Listener", "aws_lb_listener"),
    ROUTE53_RECORD("Route53 Record", "aws_route53_record"),
    CLOUDFRONT_DISTRIBUTION("CloudFront Distribution", "aws_cloudfront_distribution"),

    // Security
    IAM_ROLE("IAM Role", "aws_iam_role"),
    IAM_POLICY("IAM Policy", "aws_iam_policy"),
    IAM_ROLE_POLICY("IAM Role Policy", "aws_iam_role_policy"),
    IAM_ROLE_POLICY_ATTACHMENT("IAM Role Policy Attachment", "aws_iam_role_policy_attachment"),
    KMS_KEY("KMS Key", "aws_kms_key"),
    SECRETS_MANAGER("Secrets Manager", "aws_secretsmanager_secret"),
    ACM_CERTIFICATE("ACM Certificate", "aws_acm_certificate"),

    // Integration
    API_GATEWAY_REST_API("API Gateway", "aws_api_gateway_rest_api"),
    API_GATEWAY_RESOURCE("API Gateway Resource", "aws_api_gateway_resource"),
    API_GATEWAY_METHOD("API Gateway Method", "aws_api_gateway_method"),
    API_GATEWAY_DEPLOYMENT("API Gateway Deployment", "aws_api_gateway_deployment"),
    SQS_QUEUE("SQS Queue", "aws_sqs_queue"),
    SNS_TOPIC("SNS Topic", "aws_sns_topic"),
    KINESIS_STREAM("Kinesis Stream", "aws_kinesis_stream"),
    EVENTBRIDGE_RULE("EventBridge Rule", "aws_cloudwatch_event_rule"),

    // Monitoring
    CLOUDWATCH_LOG_GROUP("CloudWatch Log Group", "aws_cloudwatch_log_group"),
    CLOUDWATCH_ALARM("CloudWatch Alarm", "aws_cloudwatch_metric_alarm"),
    CLOUDWATCH_DASHBOARD("CloudWatch Dashboard", "aws_cloudwatch_dashboard"),
    XRAY_SAMPLING_RULE("X-Ray Sampling Rule", "aws_xray_sampling_rule"),

    MODULE("Module", "module"),
    UNKNOWN("Unknown Resource", "unknown");

    private final String displayName;
    private final String resourceName;

    ResourceType(String displayName, String resourceName) {
        this.displayName = displayName;
        this.resourceName = resourceName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getResourceName() {
        return resourceName;
    }

    public static ResourceType fromResourceName(String resourceName) {
        if (resourceName == null) return UNKNOWN;
        return Arrays.stream(values())
                .filter(t -> t.resourceName.equals(resourceName))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
