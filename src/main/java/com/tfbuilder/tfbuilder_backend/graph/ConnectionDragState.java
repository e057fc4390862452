package com.tfbuilder.tfbuilder_backend.graph;

import com.tfbuilder.tfbuilder_backend.model.domain.ConnectionPointType;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;

/**
 * Immutable drag state: {@link #IDLE}, or dragging from one anchor of a block.
 * Transitions only go IDLE → dragging → IDLE.
 */
public record ConnectionDragState(
    String blockId,
    ConnectionPointType origin,
    Point startPosition,
    Point currentPosition
) {
    public static final ConnectionDragState IDLE = new ConnectionDragState(null, null, null, null);

    public static ConnectionDragState dragging(String blockId, ConnectionPointType origin, Point startPosition) {
        return new ConnectionDragState(blockId, origin, startPosition, startPosition);
    }

    public boolean isDragging() {
        return blockId != null;
    }

    public ConnectionDragState movedTo(Point position) {
        return isDragging() ? new ConnectionDragState(blockId, origin, startPosition, position) : this;
    }
}
