package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.graph.ResourceGraph;
import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.terraform.LocalDirectoryLoader;
import com.tfbuilder.tfbuilder_backend.terraform.ParseResult;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Turns Terraform documents into a fresh workspace graph. The new graph is
 * fully built before it replaces the live one, so a failed or cancelled load
 * leaves the workspace as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    static final int GRID_COLUMNS = 3;
    static final double GRID_ORIGIN = 50;
    static final double COLUMN_SPACING = 160;
    static final double ROW_SPACING = 80;

    private final TerraformParser parser;
    private final LocalDirectoryLoader directoryLoader;
    private final CanvasMapper canvasMapper;
    private final WorkspaceService workspace;

    /** Parses {@code documents} and, if anything was found, replaces the workspace graph. */
    public LoadResult load(List<String> documents) {
        Prepared prepared = prepare(documents);
        if (prepared.result().loaded()) {
            workspace.replaceGraph(prepared.graph());
        }
        return prepared.result();
    }

    /**
     * Loads every {@code .tf} file of {@code directory} on a background thread.
     * Cancelling the returned future before it completes keeps the current graph.
     */
    public CompletableFuture<LoadResult> loadDirectory(Path directory) {
        CompletableFuture<LoadResult> future = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            try {
                Prepared prepared = prepare(directoryLoader.loadDocuments(directory));
                if (!prepared.result().loaded()) {
                    future.complete(prepared.result());
                    return;
                }
                // Completion and swap happen together under the workspace lock; a cancelled load is never swapped in.
                boolean swapped = workspace.swapIf(() -> future.complete(prepared.result()), prepared.graph());
                if (!swapped) {
                    log.info("Directory load of {} was cancelled; workspace left unchanged", directory);
                }
            } catch (RuntimeException e) {
                log.warn("Directory load of {} failed: {}", directory, e.getMessage());
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private Prepared prepare(List<String> documents) {
        ParseResult parsed = parser.parseAll(documents);
        List<Block> nodes = parser.convertToNodes(parsed.resources());

        ResourceGraph graph = canvasMapper.newGraph();
        for (TerraformVariable variable : parsed.variables()) {
            graph.addVariable(variable);
        }
        for (int index = 0; index < nodes.size(); index++) {
            Block node = nodes.get(index);
            node.setPosition(gridPosition(index));
            graph.addParsedNode(node);
        }

        String message = parsed.error();
        boolean hasContent = documents.stream().anyMatch(d -> d != null && !d.isBlank());
        if (nodes.isEmpty() && parsed.variables().isEmpty() && hasContent) {
            message = message != null ? LoadResult.NOTHING_FOUND + " (" + message + ")" : LoadResult.NOTHING_FOUND;
        }
        log.info("Ingested {} documents: {} nodes, {} variables", documents.size(), nodes.size(), parsed.variables().size());
        return new Prepared(graph, new LoadResult(nodes.size(), parsed.variables().size(), message));
    }

    static Point gridPosition(int index) {
        int row = index / GRID_COLUMNS;
        int col = index % GRID_COLUMNS;
        return new Point(GRID_ORIGIN + col * COLUMN_SPACING, GRID_ORIGIN + row * ROW_SPACING);
    }

    private record Prepared(ResourceGraph graph, LoadResult result) {}
}
