package com.tfbuilder.tfbuilder_backend.graph;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.Connection;
import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Detached copy of a graph's blocks (composite children included),
 * connections and variables. Connections point at the copied blocks, so
 * inference can rewrite properties without touching the live graph.
 */
public record GraphSnapshot(
    List<Block> blocks,
    List<Connection> connections,
    List<TerraformVariable> variables
) {
    public GraphSnapshot {
        blocks = List.copyOf(blocks);
        connections = List.copyOf(connections);
        variables = List.copyOf(variables);
    }

    public static GraphSnapshot of(List<Block> blocks, List<Connection> connections, List<TerraformVariable> variables) {
        Map<String, Block> copies = new HashMap<>();
        List<Block> copiedBlocks = blocks.stream().map(b -> {
            Block copy = b.copy();
            copies.put(copy.getId(), copy);
            return copy;
        }).toList();
        List<Connection> copiedConnections = connections.stream()
                .filter(c -> copies.containsKey(c.getSourceBlock().getId()) && copies.containsKey(c.getTargetBlock().getId()))
                .map(c -> new Connection(c.getId(), copies.get(c.getSourceBlock().getId()), copies.get(c.getTargetBlock().getId())))
                .toList();
        return new GraphSnapshot(copiedBlocks, copiedConnections, variables);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
