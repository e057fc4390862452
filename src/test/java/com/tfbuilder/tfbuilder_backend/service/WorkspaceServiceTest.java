package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.TestFixtures;
import com.tfbuilder.tfbuilder_backend.graph.CompositeTemplate;
import com.tfbuilder.tfbuilder_backend.model.domain.BlockType;
import com.tfbuilder.tfbuilder_backend.model.domain.ConnectionPointType;
import com.tfbuilder.tfbuilder_backend.model.domain.IconTag;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.domain.VariableType;
import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CompositeBlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspaceServiceTest {

    private final WorkspaceService workspace = TestFixtures.workspace();

    static BlockDto node(String id, ResourceType type, String content, double x, double y) {
        return new BlockDto(id, null, content, type, null, null, x, y, null, null, null, null);
    }

    @Test
    void addNodeAssignsIdCategoryAndDefaults() {
        BlockDto added = workspace.addNode(node(null, ResourceType.VPC, "main", 0, 0));

        assertThat(added.id()).isNotBlank();
        assertThat(added.type()).isEqualTo(BlockType.VPC);
        assertThat(added.typeName()).isEqualTo("aws_vpc");
        assertThat(added.properties()).containsEntry("enable_dns_support", "true");
        assertThat(workspace.getCanvas().blocks()).extracting(BlockDto::id).containsExactly(added.id());
    }

    @Test
    void returnedNodesAreDetachedFromTheGraph() {
        BlockDto added = workspace.addNode(node("vpc", ResourceType.VPC, "main", 0, 0));
        added.properties().put("cidr_block", "10.0.0.0/16");

        assertThat(workspace.getNode("vpc").properties()).doesNotContainKey("cidr_block");
    }

    @Test
    void editsAreReflectedInTheCanvas() {
        workspace.addNode(node("vpc", ResourceType.VPC, "main", 0, 0));

        workspace.updatePosition("vpc", new Point(40, 60));
        workspace.updateContent("vpc", "core");
        BlockDto updated = workspace.updateProperty("vpc", "cidr_block", "10.0.0.0/16");

        assertThat(updated.x()).isEqualTo(40.0);
        assertThat(updated.content()).isEqualTo("core");
        assertThat(workspace.removeProperty("vpc", "cidr_block").properties()).doesNotContainKey("cidr_block");
        assertThatThrownBy(() -> workspace.getNode("missing")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void connectsByDragAndDirectly() {
        workspace.addNode(node("a", ResourceType.VPC, "a", 0, 0));
        workspace.addNode(node("b", ResourceType.SUBNET, "b", 300, 0));
        workspace.addNode(node("c", ResourceType.EC2_INSTANCE, "c", 600, 0));

        workspace.startConnectionDrag("a", ConnectionPointType.OUTPUT);
        workspace.updateDragPosition(new Point(200, 20));
        ConnectionDto dragged = workspace.endConnectionDrag(new Point(292, 22)).orElseThrow();
        ConnectionDto direct = workspace.addConnection("b", "c").orElseThrow();

        assertThat(dragged.sourceBlockId()).isEqualTo("a");
        assertThat(dragged.targetBlockId()).isEqualTo("b");
        assertThat(workspace.addConnection("b", "c")).isEmpty();
        assertThat(workspace.getCanvas().connections()).containsExactly(dragged, direct);

        assertThat(workspace.removeConnection(direct.id())).isTrue();
        assertThat(workspace.getCanvas().connections()).containsExactly(dragged);
    }

    @Test
    void groupsAndTemplates() {
        workspace.addNode(node("a", ResourceType.VPC, "a", 0, 0));
        workspace.addNode(node("b", ResourceType.SUBNET, "b", 100, 0));

        CompositeBlockDto group = workspace.groupNodes(List.of("a", "b"), "net", null, null);
        CompositeBlockDto template = workspace.addTemplate(CompositeTemplate.DATABASE_CLUSTER, "orders", new Point(0, 300));

        assertThat(group.iconTag()).isEqualTo(IconTag.CATEGORY);
        assertThat(group.description()).isEmpty();
        assertThat(template.children()).hasSize(2);
        assertThat(workspace.getCanvas().composites()).hasSize(2);
        assertThat(workspace.getCanvas().blocks()).isEmpty();

        workspace.enterComposite(group.id());
        assertThat(workspace.getCanvas().currentCompositeId()).isEqualTo(group.id());
        workspace.exitComposite();

        assertThat(workspace.ungroup(group.id())).extracting(BlockDto::id).containsExactly("a", "b");
        assertThat(workspace.removeComposite(template.id())).isTrue();
        assertThat(workspace.getCanvas().composites()).isEmpty();
    }

    @Test
    void variablesAndUsages() {
        assertThat(workspace.addVariable(TerraformVariable.of("env", VariableType.STRING))).isTrue();
        assertThat(workspace.addVariable(TerraformVariable.of("env", VariableType.NUMBER))).isFalse();
        workspace.addNode(new BlockDto("bucket", null, "logs", ResourceType.S3_BUCKET, null, null,
                0.0, 0.0, null, null, Map.of("bucket", "logs-${var.env}"), null));

        assertThat(workspace.findVariableUsages("env")).extracting(BlockDto::id).containsExactly("bucket");
        assertThat(workspace.updateVariable("env", TerraformVariable.of("stage", VariableType.STRING))).isTrue();
        assertThat(workspace.getVariables()).extracting(TerraformVariable::name).containsExactly("stage");
        assertThat(workspace.removeVariable("stage")).isTrue();
    }

    @Test
    void swapIfOnlyReplacesWhenCommitted() {
        workspace.addNode(node("a", ResourceType.VPC, "a", 0, 0));

        boolean swapped = workspace.swapIf(() -> false, TestFixtures.canvasMapper().newGraph());

        assertThat(swapped).isFalse();
        assertThat(workspace.getCanvas().blocks()).hasSize(1);

        workspace.replaceGraph(TestFixtures.canvasMapper().newGraph());
        assertThat(workspace.getCanvas().blocks()).isEmpty();
    }

    @Test
    void canvasRoundTripsThroughTheMapper() {
        workspace.addNode(node("a", ResourceType.VPC, "a", 0, 0));
        workspace.addNode(node("b", ResourceType.SUBNET, "b", 300, 0));
        workspace.addConnection("a", "b");
        CanvasDto canvas = workspace.getCanvas();

        CanvasDto restored = TestFixtures.canvasMapper().toCanvas(TestFixtures.canvasMapper().toGraph(canvas));

        assertThat(restored).isEqualTo(canvas);
    }

    @Test
    void danglingConnectionsAreAllDropped() {
        CanvasDto canvas = new CanvasDto(
                List.of(node("a", ResourceType.VPC, "a", 0, 0), node("b", ResourceType.SUBNET, "b", 0, 0)),
                null,
                List.of(new ConnectionDto("c1", "a", "b"), new ConnectionDto("c2", "a", "gone")),
                null,
                null);

        CanvasDto restored = TestFixtures.canvasMapper().toCanvas(TestFixtures.canvasMapper().toGraph(canvas));

        assertThat(restored.blocks()).hasSize(2);
        assertThat(restored.connections()).isEmpty();
    }
}
