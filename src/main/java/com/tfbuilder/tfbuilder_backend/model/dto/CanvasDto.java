package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;

import java.util.Collections;
import java.util.List;

/**
 * Whole-canvas payload: request body for generation and the live workspace view.
 * Null-safe: null lists are treated as empty.
 */
public record CanvasDto(
    List<BlockDto> blocks,
    List<CompositeBlockDto> composites,
    List<ConnectionDto> connections,
    List<TerraformVariable> variables,
    String currentCompositeId
) {
    public List<BlockDto> blocks() {
        return blocks != null ? blocks : Collections.emptyList();
    }

    public List<CompositeBlockDto> composites() {
        return composites != null ? composites : Collections.emptyList();
    }

    public List<ConnectionDto> connections() {
        return connections != null ? connections : Collections.emptyList();
    }

    public List<TerraformVariable> variables() {
        return variables != null ? variables : Collections.emptyList();
    }
}
