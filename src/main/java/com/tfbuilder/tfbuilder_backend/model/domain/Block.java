package com.tfbuilder.tfbuilder_backend.model.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A resource node on the canvas.
 * <p>
 * Property values are generation-ready strings: interpolation syntax is
 * already restored. The property map is only exposed read-only; callers
 * mutate it through {@link #setProperty} and {@link #removeProperty}.
 * Anchor points are recomputed whenever position or size changes.
 */
@Getter
public class Block {

    /** Horizontal distance between a block edge and its connection anchor. */
    public static final double ANCHOR_OFFSET = 6.0;

    private final String id;
    private final ResourceType resourceType;
    /** Literal provider type name; differs from the catalog name only for UNKNOWN kinds. */
    private final String typeName;

    @Setter
    private BlockType type;
    @Setter
    private String content;
    @Setter
    private String description;

    private Point position;
    private Size size;
    private Point inputPosition;
    private Point outputPosition;

    private final Map<String, String> properties = new LinkedHashMap<>();
    // Dotted paths of properties that were nested blocks in the source document
    private final Set<String> nestedBlocks = new LinkedHashSet<>();

    @Builder
    private Block(String id,
                  BlockType type,
                  String content,
                  ResourceType resourceType,
                  String typeName,
                  String description,
                  Point position,
                  Size size,
                  Map<String, String> properties,
                  Set<String> nestedBlocks) {
        this.id = Objects.requireNonNull(id, "id");
        this.resourceType = resourceType != null ? resourceType : ResourceType.UNKNOWN;
        this.typeName = typeName != null && !typeName.isBlank() ? typeName : this.resourceType.getResourceName();
        this.type = type != null ? type : BlockType.INTEGRATION;
        this.content = content != null ? content : "";
        this.description = description != null ? description : "";
        this.position = position != null ? position : Point.ZERO;
        this.size = size != null ? size : Size.DEFAULT_BLOCK;
        if (properties != null) this.properties.putAll(properties);
        if (nestedBlocks != null) this.nestedBlocks.addAll(nestedBlocks);
        updateConnectionPoints();
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        updateConnectionPoints();
    }

    public void setSize(Size size) {
        this.size = Objects.requireNonNull(size, "size");
        updateConnectionPoints();
    }

    public Point getConnectionPointPosition(ConnectionPointType pointType) {
        return pointType == ConnectionPointType.INPUT ? inputPosition : outputPosition;
    }

    private void updateConnectionPoints() {
        inputPosition = position.plus(new Point(-ANCHOR_OFFSET, size.height() / 2));
        outputPosition = position.plus(new Point(size.width() + ANCHOR_OFFSET, size.height() / 2));
    }

    public Map<String, String> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Set<String> getNestedBlocks() {
        return Collections.unmodifiableSet(nestedBlocks);
    }

    public String getProperty(String name) {
        return properties.get(name);
    }

    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    public void setProperty(String name, String value) {
        properties.put(name, value != null ? value : "");
    }

    public void removeProperty(String name) {
        properties.remove(name);
        nestedBlocks.remove(name);
    }

    public boolean isNestedBlock(String path) {
        return nestedBlocks.contains(path);
    }

    /** Deep copy with the same id, used for per-call snapshots. */
    public Block copy() {
        return Block.builder()
                .id(id)
                .type(type)
                .content(content)
                .resourceType(resourceType)
                .typeName(typeName)
                .description(description)
                .position(position)
                .size(size)
                .properties(properties)
                .nestedBlocks(nestedBlocks)
                .build();
    }

    @Override
    public String toString() {
        return "Block{" + id + ", " + typeName + " '" + content + "'}";
    }
}
