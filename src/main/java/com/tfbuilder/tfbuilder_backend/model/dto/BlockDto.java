package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.domain.BlockType;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;
import com.tfbuilder.tfbuilder_backend.model.domain.ResourceType;
import com.tfbuilder.tfbuilder_backend.model.domain.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Wire and storage form of a {@link Block}.
 * Null-safe: null collections are treated as empty, missing geometry as defaults.
 */
public record BlockDto(
    String id,
    BlockType type,
    String content,
    ResourceType resourceType,
    String typeName,
    String description,
    Double x,
    Double y,
    Double width,
    Double height,
    Map<String, String> properties,
    List<String> nestedBlocks
) {
    public Map<String, String> properties() {
        return properties != null ? properties : Collections.emptyMap();
    }

    public List<String> nestedBlocks() {
        return nestedBlocks != null ? nestedBlocks : Collections.emptyList();
    }

    public static BlockDto from(Block block) {
        return new BlockDto(
                block.getId(),
                block.getType(),
                block.getContent(),
                block.getResourceType(),
                block.getTypeName(),
                block.getDescription(),
                block.getPosition().x(),
                block.getPosition().y(),
                block.getSize().width(),
                block.getSize().height(),
                new LinkedHashMap<>(block.getProperties()),
                new ArrayList<>(block.getNestedBlocks()));
    }

    public Block toBlock() {
        ResourceType kind = resourceType != null ? resourceType : ResourceType.fromResourceName(typeName);
        return Block.builder()
                .id(id)
                .type(type)
                .content(content)
                .resourceType(kind)
                .typeName(typeName)
                .description(description)
                .position(new Point(x != null ? x : 0, y != null ? y : 0))
                .size(width != null && height != null ? new Size(width, height) : Size.DEFAULT_BLOCK)
                .properties(new LinkedHashMap<>(properties()))
                .nestedBlocks(new LinkedHashSet<>(nestedBlocks()))
                .build();
    }
}
