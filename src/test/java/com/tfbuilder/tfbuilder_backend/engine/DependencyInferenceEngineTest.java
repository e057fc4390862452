package com.tfbuilder.tfbuilder_backend.engine;

import com.tfbuilder.tfbuilder_backend.TestFixtures;
import com.tfbuilder.tfbuilder_backend.graph.GraphSnapshot;
import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.Connection;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tfbuilder.tfbuilder_backend.TestFixtures.block;
import static org.assertj.core.api.Assertions.assertThat;

class DependencyInferenceEngineTest {

    private final DependencyInferenceEngine engine = new DependencyInferenceEngine(TestFixtures.schemaProvider());

    private static GraphSnapshot snapshot(List<Block> blocks, List<Connection> connections) {
        return GraphSnapshot.of(blocks, connections, List.of());
    }

    private static Block inferred(GraphSnapshot result, String id) {
        return result.blocks().stream().filter(b -> b.getId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void vpcToSubnetSetsVpcId() {
        Block vpc = block("vpc", ResourceType.VPC, "main-vpc");
        Block subnet = block("subnet", ResourceType.SUBNET, "public-subnet");

        GraphSnapshot result = engine.infer(snapshot(List.of(vpc, subnet), List.of(new Connection(vpc, subnet))));

        assertThat(inferred(result, "subnet").getProperty("vpc_id")).isEqualTo("aws_vpc.main_vpc.id");
        assertThat(inferred(result, "subnet").hasProperty(DependencyInferenceEngine.DEPENDS_ON)).isFalse();
    }

    @Test
    void iamRoleToLambdaUsesTheRoleArn() {
        Block role = block("role", ResourceType.IAM_ROLE, "lambda-exec");
        Block lambda = block("fn", ResourceType.LAMBDA_FUNCTION, "handler");

        GraphSnapshot result = engine.infer(snapshot(List.of(role, lambda), List.of(new Connection(role, lambda))));

        assertThat(inferred(result, "fn").getProperty("role")).isEqualTo("aws_iam_role.lambda_exec.arn");
    }

    @Test
    void unmatchedEdgeFallsBackToDependsOn() {
        Block subnet = block("subnet", ResourceType.SUBNET, "public-subnet");
        Block lambda = block("fn", ResourceType.LAMBDA_FUNCTION, "handler");

        GraphSnapshot result = engine.infer(snapshot(List.of(subnet, lambda), List.of(new Connection(subnet, lambda))));

        assertThat(inferred(result, "fn").getProperty("depends_on")).isEqualTo("[aws_subnet.public_subnet]");
    }

    @Test
    void dependsOnAccumulatesWithoutDuplicates() {
        Block a = block("a", ResourceType.SUBNET, "a");
        Block b = block("b", ResourceType.SQS_QUEUE, "b");
        Block lambda = block("fn", ResourceType.LAMBDA_FUNCTION, "handler");
        lambda.setProperty("depends_on", "[aws_subnet.a]");

        GraphSnapshot result = engine.infer(snapshot(List.of(a, b, lambda),
                List.of(new Connection(a, lambda), new Connection(b, lambda))));

        assertThat(inferred(result, "fn").getProperty("depends_on")).isEqualTo("[aws_subnet.a, aws_sqs_queue.b]");
    }

    @Test
    void setTypedPropertiesCollectReferences() {
        Block sg = block("sg", ResourceType.SECURITY_GROUP, "db-sg");
        Block db = block("db", ResourceType.RDS_INSTANCE, "orders");

        GraphSnapshot result = engine.infer(snapshot(List.of(sg, db), List.of(new Connection(sg, db))));

        assertThat(inferred(result, "db").getProperty("vpc_security_group_ids")).isEqualTo("[aws_security_group.db_sg.id]");
    }

    @Test
    void inputSnapshotIsNotModified() {
        Block vpc = block("vpc", ResourceType.VPC, "main-vpc");
        Block subnet = block("subnet", ResourceType.SUBNET, "public-subnet");
        GraphSnapshot input = snapshot(List.of(vpc, subnet), List.of(new Connection(vpc, subnet)));

        engine.infer(input);

        assertThat(inferred(input, "subnet").hasProperty("vpc_id")).isFalse();
        assertThat(subnet.hasProperty("vpc_id")).isFalse();
    }

    @Test
    void sourceAttributeFollowsPropertyName() {
        assertThat(DependencyInferenceEngine.determineSourceAttribute("role_arn")).isEqualTo("arn");
        assertThat(DependencyInferenceEngine.determineSourceAttribute("table_name")).isEqualTo("name");
        assertThat(DependencyInferenceEngine.determineSourceAttribute("bucket")).isEqualTo("bucket");
        assertThat(DependencyInferenceEngine.determineSourceAttribute("subnet_id")).isEqualTo("id");
    }

    @Test
    void appendToListKeepsExistingEntries() {
        assertThat(DependencyInferenceEngine.appendToList(null, "aws_vpc.a")).isEqualTo("[aws_vpc.a]");
        assertThat(DependencyInferenceEngine.appendToList("[aws_vpc.a]", "aws_vpc.a")).isEqualTo("[aws_vpc.a]");
        assertThat(DependencyInferenceEngine.appendToList("aws_vpc.a", "aws_vpc.b")).isEqualTo("[aws_vpc.a, aws_vpc.b]");
    }
}
