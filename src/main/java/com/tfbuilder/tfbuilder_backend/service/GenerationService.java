package com.tfbuilder.tfbuilder_backend.service;

import com.tfbuilder.tfbuilder_backend.engine.DependencyInferenceEngine;
import com.tfbuilder.tfbuilder_backend.engine.GeneratedTerraform;
import com.tfbuilder.tfbuilder_backend.engine.TerraformCodeGenerator;
import com.tfbuilder.tfbuilder_backend.engine.TerraformOutputWriter;
import com.tfbuilder.tfbuilder_backend.graph.GraphSnapshot;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Snapshot → dependency inference → code generation. Inference always runs
 * on a detached copy; the live workspace is never rewritten by generation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationService {

    private final DependencyInferenceEngine inferenceEngine;
    private final TerraformCodeGenerator generator;
    private final TerraformOutputWriter outputWriter;
    private final WorkspaceService workspace;
    private final CanvasMapper canvasMapper;

    /** Generates from the live workspace. */
    public GenerationResult generateWorkspace() {
        GeneratedTerraform generated = render(workspace.snapshot());
        return new GenerationResult(generated.files(), generated.warnings(), List.of());
    }

    /** Generates from a canvas sent by the client, without touching the workspace. */
    public GenerationResult generate(CanvasDto canvas) {
        GeneratedTerraform generated = render(canvasMapper.toGraph(canvas).snapshot());
        return new GenerationResult(generated.files(), generated.warnings(), List.of());
    }

    /**
     * Generates from the live workspace and writes the four files into
     * {@code directory}. Nothing is written when generation is refused.
     */
    public GenerationResult generateToDirectory(Path directory) {
        GeneratedTerraform generated = render(workspace.snapshot());
        try {
            List<String> written = outputWriter.write(generated, directory).stream().map(Path::toString).toList();
            return new GenerationResult(generated.files(), generated.warnings(), written);
        } catch (IOException e) {
            log.error("Failed to write Terraform output to {}: {}", directory, e.getMessage(), e);
            throw new PersistenceException(directory.toString(), "write Terraform output to", e);
        }
    }

    private GeneratedTerraform render(GraphSnapshot snapshot) {
        GraphSnapshot inferred = inferenceEngine.infer(snapshot);
        GeneratedTerraform generated = generator.generate(inferred.blocks(), inferred.variables());
        if (!generated.warnings().isEmpty()) {
            log.warn("Generation finished with {} warnings", generated.warnings().size());
        }
        return generated;
    }
}
