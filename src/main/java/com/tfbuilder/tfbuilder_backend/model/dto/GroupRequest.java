package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.IconTag;

import java.util.Collections;
import java.util.List;

public record GroupRequest(
    List<String> blockIds,
    String name,
    String description,
    IconTag iconTag
) {
    public List<String> blockIds() {
        return blockIds != null ? blockIds : Collections.emptyList();
    }
}
