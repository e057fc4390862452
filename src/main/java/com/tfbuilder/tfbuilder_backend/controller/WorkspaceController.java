package com.tfbuilder.tfbuilder_backend.controller;

import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.Size;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;
import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CompositeBlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ConnectionRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.DirectoryRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.DragRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.GeometryRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.GroupRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.ParseRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.PropertyRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.TemplateRequest;
import com.tfbuilder.tfbuilder_backend.service.GenerationResult;
import com.tfbuilder.tfbuilder_backend.service.GenerationService;
import com.tfbuilder.tfbuilder_backend.service.IngestionService;
import com.tfbuilder.tfbuilder_backend.service.LoadResult;
import com.tfbuilder.tfbuilder_backend.service.WorkspaceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/** The live canvas: nodes, connections, groups, variables, ingestion and generation. */
@RestController
@RequestMapping("/api/workspace")
@RequiredArgsConstructor
public class WorkspaceController {

    private final WorkspaceService workspace;
    private final IngestionService ingestionService;
    private final GenerationService generationService;

    @GetMapping
    public CanvasDto getCanvas() {
        return workspace.getCanvas();
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        workspace.clear();
        return ResponseEntity.noContent().build();
    }

    // ── Nodes ────────────────────────────────────────────────────────────────

    @PostMapping("/nodes")
    public ResponseEntity<BlockDto> addNode(@RequestBody BlockDto request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workspace.addNode(request));
    }

    @GetMapping("/nodes/{id}")
    public BlockDto getNode(@PathVariable String id) {
        return workspace.getNode(id);
    }

    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<Void> removeNode(@PathVariable String id) {
        return workspace.removeNode(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PutMapping("/nodes/{id}/position")
    public BlockDto updatePosition(@PathVariable String id, @RequestBody GeometryRequest request) {
        if (request.x() == null || request.y() == null) {
            throw new IllegalArgumentException("x and y are required");
        }
        return workspace.updatePosition(id, new Point(request.x(), request.y()));
    }

    @PutMapping("/nodes/{id}/size")
    public BlockDto updateSize(@PathVariable String id, @RequestBody GeometryRequest request) {
        if (request.width() == null || request.height() == null) {
            throw new IllegalArgumentException("width and height are required");
        }
        return workspace.updateSize(id, new Size(request.width(), request.height()));
    }

    @PutMapping("/nodes/{id}/content")
    public BlockDto updateContent(@PathVariable String id, @RequestBody PropertyRequest request) {
        return workspace.updateContent(id, request.value());
    }

    @PutMapping("/nodes/{id}/properties/{name}")
    public BlockDto updateProperty(@PathVariable String id, @PathVariable String name, @RequestBody PropertyRequest request) {
        return workspace.updateProperty(id, name, request.value());
    }

    @DeleteMapping("/nodes/{id}/properties/{name}")
    public BlockDto removeProperty(@PathVariable String id, @PathVariable String name) {
        return workspace.removeProperty(id, name);
    }

    @GetMapping("/nodes/{id}/references")
    public List<BlockDto> findReferences(@PathVariable String id) {
        return workspace.findReferencesTo(id);
    }

    // ── Connections ──────────────────────────────────────────────────────────

    @PostMapping("/connections")
    public ResponseEntity<ConnectionDto> addConnection(@RequestBody ConnectionRequest request) {
        return workspace.addConnection(request.sourceBlockId(), request.targetBlockId())
                .map(c -> ResponseEntity.status(HttpStatus.CREATED).body(c))
                .orElse(ResponseEntity.unprocessableEntity().build());
    }

    @DeleteMapping("/connections/{id}")
    public ResponseEntity<Void> removeConnection(@PathVariable String id) {
        return workspace.removeConnection(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/drag/start")
    public ResponseEntity<Void> startDrag(@RequestBody DragRequest request) {
        if (request.blockId() == null || request.origin() == null) {
            throw new IllegalArgumentException("blockId and origin are required");
        }
        workspace.startConnectionDrag(request.blockId(), request.origin());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/drag/move")
    public ResponseEntity<Void> moveDrag(@RequestBody DragRequest request) {
        workspace.updateDragPosition(new Point(request.x(), request.y()));
        return ResponseEntity.noContent().build();
    }

    /** 201 with the new connection, or 204 when the drop point was not near a matching anchor. */
    @PostMapping("/drag/end")
    public ResponseEntity<ConnectionDto> endDrag(@RequestBody DragRequest request) {
        return workspace.endConnectionDrag(new Point(request.x(), request.y()))
                .map(c -> ResponseEntity.status(HttpStatus.CREATED).body(c))
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/drag/cancel")
    public ResponseEntity<Void> cancelDrag() {
        workspace.cancelConnectionDrag();
        return ResponseEntity.noContent().build();
    }

    // ── Composites ───────────────────────────────────────────────────────────

    @PostMapping("/groups")
    public ResponseEntity<CompositeBlockDto> group(@RequestBody GroupRequest request) {
        CompositeBlockDto created = workspace.groupNodes(request.blockIds(), request.name(), request.description(), request.iconTag());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/groups/{id}/ungroup")
    public List<BlockDto> ungroup(@PathVariable String id) {
        return workspace.ungroup(id);
    }

    @DeleteMapping("/groups/{id}")
    public ResponseEntity<Void> removeGroup(@PathVariable String id) {
        return workspace.removeComposite(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/templates")
    public ResponseEntity<CompositeBlockDto> addTemplate(@RequestBody TemplateRequest request) {
        if (request.template() == null) {
            throw new IllegalArgumentException("template is required");
        }
        String name = request.name() != null && !request.name().isBlank() ? request.name() : request.template().name().toLowerCase(Locale.ROOT).replace('_', '-');
        CompositeBlockDto created = workspace.addTemplate(request.template(), name, new Point(request.x(), request.y()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/scope/{compositeId}")
    public ResponseEntity<Void> enterScope(@PathVariable String compositeId) {
        workspace.enterComposite(compositeId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/scope")
    public ResponseEntity<Void> exitScope() {
        workspace.exitComposite();
        return ResponseEntity.noContent().build();
    }

    // ── Variables ────────────────────────────────────────────────────────────

    @GetMapping("/variables")
    public List<TerraformVariable> getVariables() {
        return workspace.getVariables();
    }

    @PostMapping("/variables")
    public ResponseEntity<TerraformVariable> addVariable(@RequestBody TerraformVariable variable) {
        return workspace.addVariable(variable)
                ? ResponseEntity.status(HttpStatus.CREATED).body(variable)
                : ResponseEntity.status(HttpStatus.CONFLICT).build();
    }

    @PutMapping("/variables/{name}")
    public ResponseEntity<TerraformVariable> updateVariable(@PathVariable String name, @RequestBody TerraformVariable variable) {
        return workspace.updateVariable(name, variable) ? ResponseEntity.ok(variable) : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/variables/{name}")
    public ResponseEntity<Void> removeVariable(@PathVariable String name) {
        return workspace.removeVariable(name) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/variables/{name}/usages")
    public List<BlockDto> findVariableUsages(@PathVariable String name) {
        return workspace.findVariableUsages(name);
    }

    // ── Ingestion and generation ─────────────────────────────────────────────

    @PostMapping("/load")
    public LoadResult load(@RequestBody ParseRequest request) {
        return ingestionService.load(request.documents());
    }

    @PostMapping("/load-directory")
    public CompletableFuture<LoadResult> loadDirectory(@RequestBody DirectoryRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        return ingestionService.loadDirectory(Path.of(request.path()));
    }

    @PostMapping("/generate")
    public GenerationResult generate() {
        return generationService.generateWorkspace();
    }

    @PostMapping("/generate-directory")
    public GenerationResult generateToDirectory(@RequestBody DirectoryRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        return generationService.generateToDirectory(Path.of(request.path()));
    }
}
