package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;

import java.util.List;

public record ParseResponse(
    List<BlockDto> blocks,
    List<TerraformVariable> variables,
    String error
) {}
