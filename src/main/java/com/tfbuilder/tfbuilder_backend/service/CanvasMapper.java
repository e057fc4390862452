package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.graph.ResourceGraph;
import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CompositeBlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import com.tfbuilder.tfbuilder_backend.model.domain.Connection;
import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import com.tfbuilder.tfbuilder_backend.terraform.reference.TerraformReferenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/** Converts between the live {@link ResourceGraph} and its {@link CanvasDto} form. */
@Slf4j
@Component
@RequiredArgsConstructor
public class CanvasMapper {

    private final SchemaProvider schemaProvider;
    private final TerraformReferenceService referenceService;

    public ResourceGraph newGraph() {
        return new ResourceGraph(schemaProvider, referenceService);
    }

    public CanvasDto toCanvas(ResourceGraph graph) {
        return new CanvasDto(
                graph.getBlocks().stream().map(BlockDto::from).toList(),
                graph.getCompositeBlocks().stream().map(CompositeBlockDto::from).toList(),
                graph.getConnections().stream().map(ConnectionDto::from).toList(),
                List.copyOf(graph.getVariables()),
                graph.getCurrentCompositeId().orElse(null));
    }

    /**
     * Builds a graph exactly as described, without schema defaults. If any
     * connection names a missing block, all connections are dropped.
     */
    public ResourceGraph toGraph(CanvasDto canvas) {
        ResourceGraph graph = newGraph();
        canvas.blocks().forEach(dto -> graph.addParsedNode(dto.toBlock()));
        canvas.composites().forEach(dto -> graph.addParsedComposite(dto.toComposite()));
        canvas.variables().forEach(graph::addVariable);

        boolean dangling = canvas.connections().stream().anyMatch(c ->
                graph.findBlock(c.sourceBlockId()).isEmpty() || graph.findBlock(c.targetBlockId()).isEmpty());
        if (dangling) {
            log.warn("Canvas has connections to missing blocks; dropping all {} connections", canvas.connections().size());
            return graph;
        }
        for (ConnectionDto dto : canvas.connections()) {
            Optional<Connection> restored = dto.id() != null
                    ? graph.restoreConnection(dto.id(), dto.sourceBlockId(), dto.targetBlockId())
                    : graph.addConnection(dto.sourceBlockId(), dto.targetBlockId());
            if (restored.isEmpty()) {
                log.debug("Skipped connection {} -> {}", dto.sourceBlockId(), dto.targetBlockId());
            }
        }
        if (canvas.currentCompositeId() != null && graph.findComposite(canvas.currentCompositeId()).isPresent()) {
            graph.enterComposite(canvas.currentCompositeId());
        }
        return graph;
    }
}
