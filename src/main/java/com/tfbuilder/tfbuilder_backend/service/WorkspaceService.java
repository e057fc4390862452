package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.graph.CompositeBlockFactory;
import com.tfbuilder.tfbuilder_backend.graph.CompositeTemplate;
import com.tfbuilder.tfbuilder_backend.graph.GraphSnapshot;
import com.tfbuilder.tfbuilder_backend.graph.ResourceGraph;
import com.tfbuilder.tfbuilder_backend.model.domain.CompositeBlock;
import com.tfbuilder.tfbuilder_backend.model.domain.ConnectionPointType;
import com.tfbuilder.tfbuilder_backend.model.domain.IconTag;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.Size;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CompositeBlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import com.tfbuilder.tfbuilder_backend.terraform.ResourceTypeCategorizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Owns the live workspace graph. Every read and mutation runs under one lock;
 * a whole new graph (from ingestion or a project load) is swapped in under
 * the same lock so readers never see a half-built graph.
 */
@Slf4j
@Service
public class WorkspaceService {

    private final CanvasMapper canvasMapper;
    private final CompositeBlockFactory compositeFactory;
    private final ResourceTypeCategorizer categorizer;

    private final Object lock = new Object();
    private ResourceGraph graph;

    public WorkspaceService(CanvasMapper canvasMapper,
                            CompositeBlockFactory compositeFactory,
                            ResourceTypeCategorizer categorizer) {
        this.canvasMapper = canvasMapper;
        this.compositeFactory = compositeFactory;
        this.categorizer = categorizer;
        this.graph = canvasMapper.newGraph();
    }

    public CanvasDto getCanvas() {
        synchronized (lock) {
            return canvasMapper.toCanvas(graph);
        }
    }

    public GraphSnapshot snapshot() {
        synchronized (lock) {
            return graph.snapshot();
        }
    }

    /** Replaces the live graph. */
    public void replaceGraph(ResourceGraph replacement) {
        swapIf(() -> true, replacement);
    }

    /**
     * Replaces the live graph only if {@code commit} still holds once the lock
     * is taken. Returns whether the swap happened.
     */
    public boolean swapIf(BooleanSupplier commit, ResourceGraph replacement) {
        synchronized (lock) {
            if (!commit.getAsBoolean()) return false;
            graph = replacement;
            log.info("Workspace replaced: {} blocks, {} variables",
                    replacement.getAllBlocks().size(), replacement.getVariables().size());
            return true;
        }
    }

    public void clear() {
        synchronized (lock) {
            graph.clear();
        }
    }

    // ── Nodes ────────────────────────────────────────────────────────────────

    /** Adds a user-created node; schema defaults are filled in and a missing id or category is assigned. */
    public BlockDto addNode(BlockDto request) {
        BlockDto filled = new BlockDto(
                request.id() != null ? request.id() : UUID.randomUUID().toString(),
                request.type() != null ? request.type() : categorizer.determineBlockType(typeNameOf(request)),
                request.content(),
                request.resourceType(),
                request.typeName(),
                request.description(),
                request.x(), request.y(), request.width(), request.height(),
                request.properties(),
                request.nestedBlocks());
        synchronized (lock) {
            return BlockDto.from(graph.addNode(filled.toBlock()));
        }
    }

    private static String typeNameOf(BlockDto request) {
        if (request.typeName() != null) return request.typeName();
        return request.resourceType() != null ? request.resourceType().getResourceName() : "";
    }

    public BlockDto getNode(String id) {
        synchronized (lock) {
            return BlockDto.from(graph.getBlock(id));
        }
    }

    public boolean removeNode(String id) {
        synchronized (lock) {
            return graph.removeNode(id);
        }
    }

    public BlockDto updatePosition(String id, Point position) {
        synchronized (lock) {
            graph.updatePosition(id, position);
            return BlockDto.from(graph.getBlock(id));
        }
    }

    public BlockDto updateSize(String id, Size size) {
        synchronized (lock) {
            graph.updateSize(id, size);
            return BlockDto.from(graph.getBlock(id));
        }
    }

    public BlockDto updateContent(String id, String content) {
        synchronized (lock) {
            graph.updateContent(id, content);
            return BlockDto.from(graph.getBlock(id));
        }
    }

    public BlockDto updateProperty(String id, String name, String value) {
        synchronized (lock) {
            graph.updateProperty(id, name, value);
            return BlockDto.from(graph.getBlock(id));
        }
    }

    public BlockDto removeProperty(String id, String name) {
        synchronized (lock) {
            graph.removeProperty(id, name);
            return BlockDto.from(graph.getBlock(id));
        }
    }

    // ── Connections ──────────────────────────────────────────────────────────

    public Optional<ConnectionDto> addConnection(String sourceId, String targetId) {
        synchronized (lock) {
            return graph.addConnection(sourceId, targetId).map(ConnectionDto::from);
        }
    }

    public boolean removeConnection(String connectionId) {
        synchronized (lock) {
            return graph.removeConnection(connectionId);
        }
    }

    public void startConnectionDrag(String blockId, ConnectionPointType origin) {
        synchronized (lock) {
            graph.startConnectionDrag(blockId, origin);
        }
    }

    public void updateDragPosition(Point position) {
        synchronized (lock) {
            graph.updateDragPosition(position);
        }
    }

    public Optional<ConnectionDto> endConnectionDrag(Point dropPoint) {
        synchronized (lock) {
            return graph.endConnectionDrag(dropPoint).map(ConnectionDto::from);
        }
    }

    public void cancelConnectionDrag() {
        synchronized (lock) {
            graph.cancelConnectionDrag();
        }
    }

    // ── Composites ───────────────────────────────────────────────────────────

    public CompositeBlockDto groupNodes(Collection<String> ids, String name, String description, IconTag iconTag) {
        synchronized (lock) {
            return CompositeBlockDto.from(graph.groupNodes(ids, name, description != null ? description : "",
                    iconTag != null ? iconTag : IconTag.CATEGORY));
        }
    }

    public List<BlockDto> ungroup(String compositeId) {
        synchronized (lock) {
            return graph.ungroup(compositeId).stream().map(BlockDto::from).toList();
        }
    }

    public CompositeBlockDto addTemplate(CompositeTemplate template, String name, Point position) {
        CompositeBlock composite = compositeFactory.create(template, name, position);
        synchronized (lock) {
            return CompositeBlockDto.from(graph.addComposite(composite));
        }
    }

    public boolean removeComposite(String compositeId) {
        synchronized (lock) {
            return graph.removeComposite(compositeId);
        }
    }

    public void enterComposite(String compositeId) {
        synchronized (lock) {
            graph.enterComposite(compositeId);
        }
    }

    public void exitComposite() {
        synchronized (lock) {
            graph.exitComposite();
        }
    }

    // ── Variables ────────────────────────────────────────────────────────────

    public List<TerraformVariable> getVariables() {
        synchronized (lock) {
            return List.copyOf(graph.getVariables());
        }
    }

    public boolean addVariable(TerraformVariable variable) {
        synchronized (lock) {
            return graph.addVariable(variable);
        }
    }

    public boolean updateVariable(String name, TerraformVariable replacement) {
        synchronized (lock) {
            return graph.updateVariable(name, replacement);
        }
    }

    public boolean removeVariable(String name) {
        synchronized (lock) {
            return graph.removeVariable(name);
        }
    }

    // ── References ───────────────────────────────────────────────────────────

    public List<BlockDto> findReferencesTo(String nodeId) {
        synchronized (lock) {
            return graph.findReferencesTo(nodeId).stream().map(BlockDto::from).toList();
        }
    }

    public List<BlockDto> findVariableUsages(String variableName) {
        synchronized (lock) {
            return graph.findVariableUsages(variableName).stream().map(BlockDto::from).toList();
        }
    }
}
