package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.Connection;

/** Connections travel and persist by block id and are re-linked on load. */
public record ConnectionDto(
    String id,
    String sourceBlockId,
    String targetBlockId
) {
    public static ConnectionDto from(Connection connection) {
        return new ConnectionDto(connection.getId(),
                connection.getSourceBlock().getId(),
                connection.getTargetBlock().getId());
    }
}
