package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.ConnectionPointType;

/** Drag start carries the block and anchor; move and end carry only the pointer position. */
public record DragRequest(
    String blockId,
    ConnectionPointType origin,
    double x,
    double y
) {}
