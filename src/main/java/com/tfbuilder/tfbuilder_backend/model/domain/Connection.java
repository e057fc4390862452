package com.tfbuilder.tfbuilder_backend.model.domain;

import lombok.Getter;

import java.util.Objects;
import java.util.UUID;

/**
 * Directed edge from a source block's OUTPUT anchor to a target block's INPUT anchor.
 */
@Getter
public class Connection {

    private final String id;
    private final Block sourceBlock;
    private final Block targetBlock;

    public Connection(Block sourceBlock, Block targetBlock) {
        this(UUID.randomUUID().toString(), sourceBlock, targetBlock);
    }

    public Connection(String id, Block sourceBlock, Block targetBlock) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceBlock = Objects.requireNonNull(sourceBlock, "sourceBlock");
        this.targetBlock = Objects.requireNonNull(targetBlock, "targetBlock");
    }

    public Point getStartPosition() {
        return sourceBlock.getConnectionPointPosition(ConnectionPointType.OUTPUT);
    }

    public Point getEndPosition() {
        return targetBlock.getConnectionPointPosition(ConnectionPointType.INPUT);
    }

    public boolean touches(String blockId) {
        return sourceBlock.getId().equals(blockId) || targetBlock.getId().equals(blockId);
    }

    public boolean links(String sourceId, String targetId) {
        return sourceBlock.getId().equals(sourceId) && targetBlock.getId().equals(targetId);
    }
}
