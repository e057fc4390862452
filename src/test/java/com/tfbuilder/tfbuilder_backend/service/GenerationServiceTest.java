package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.TestFixtures;
import com.tfbuilder.tfbuilder_backend.engine.DependencyInferenceEngine;
import com.tfbuilder.tfbuilder_backend.engine.GenerationRefusedException;
import com.tfbuilder.tfbuilder_backend.engine.TerraformCodeGenerator;
import com.tfbuilder.tfbuilder_backend.engine.TerraformOutputWriter;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.tfbuilder.tfbuilder_backend.service.WorkspaceServiceTest.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationServiceTest {

    private final WorkspaceService workspace = TestFixtures.workspace();
    private final GenerationService generation = new GenerationService(
            new DependencyInferenceEngine(TestFixtures.schemaProvider()),
            new TerraformCodeGenerator(TestFixtures.schemaProvider(), "us-west-2"),
            new TerraformOutputWriter(),
            workspace,
            TestFixtures.canvasMapper());

    @TempDir
    Path dir;

    @Test
    void emptyWorkspaceIsRefused() {
        assertThatThrownBy(generation::generateWorkspace).isInstanceOf(GenerationRefusedException.class);
    }

    @Test
    void inferenceDoesNotRewriteTheWorkspace() {
        workspace.addNode(node("vpc", ResourceType.VPC, "main-vpc", 0, 0));
        workspace.addNode(node("subnet", ResourceType.SUBNET, "public", 300, 0));
        workspace.addConnection("vpc", "subnet");

        GenerationResult result = generation.generateWorkspace();

        assertThat(result.files().get("main.tf")).contains("vpc_id = aws_vpc.main_vpc.id");
        assertThat(result.writtenFiles()).isEmpty();
        assertThat(workspace.getNode("subnet").properties()).doesNotContainKey("vpc_id");
    }

    @Test
    void generatesFromASubmittedCanvas() {
        CanvasDto canvas = new CanvasDto(
                List.of(node("role", ResourceType.IAM_ROLE, "exec", 0, 0), node("fn", ResourceType.LAMBDA_FUNCTION, "api", 0, 0)),
                null,
                List.of(new ConnectionDto(null, "role", "fn")),
                null,
                null);

        GenerationResult result = generation.generate(canvas);

        assertThat(result.files().get("main.tf")).contains("role = aws_iam_role.exec.arn");
        assertThat(result.files().get("outputs.tf")).contains("output \"api_function_name\"");
        assertThat(workspace.getCanvas().blocks()).isEmpty();
    }

    @Test
    void writesFilesToADirectory() throws IOException {
        workspace.addNode(node("vpc", ResourceType.VPC, "main", 0, 0));
        Path out = dir.resolve("out");

        GenerationResult result = generation.generateToDirectory(out);

        assertThat(result.writtenFiles()).hasSize(4);
        assertThat(Files.readString(out.resolve("provider.tf"))).contains("region = var.aws_region");
    }

    @Test
    void refusedGenerationWritesNothing() {
        Path out = dir.resolve("out");

        assertThatThrownBy(() -> generation.generateToDirectory(out)).isInstanceOf(GenerationRefusedException.class);
        assertThat(out).doesNotExist();
    }
}
