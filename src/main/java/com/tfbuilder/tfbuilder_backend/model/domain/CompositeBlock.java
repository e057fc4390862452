package com.tfbuilder.tfbuilder_backend.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Named grouping of blocks. Owns its children: a block lives either in the
 * graph's flat list or in exactly one composite.
 */
@Getter
public class CompositeBlock {

    private final String id;
    @Setter
    private String name;
    @Setter
    private String description;
    @Setter
    private IconTag iconTag;
    private Point position;
    @Setter
    private Size size;

    private final List<Block> children = new ArrayList<>();
    private final Map<String, String> properties = new LinkedHashMap<>();

    public CompositeBlock(String name, String description, IconTag iconTag, Point position) {
        this(UUID.randomUUID().toString(), name, description, iconTag, position);
    }

    public CompositeBlock(String id, String name, String description, IconTag iconTag, Point position) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : "";
        this.description = description != null ? description : "";
        this.iconTag = iconTag != null ? iconTag : IconTag.CATEGORY;
        this.position = position != null ? position : Point.ZERO;
        this.size = new Size(160, 60);
    }

    /** Sets the anchor without touching children. */
    public void placeAt(Point position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    /** Moves the composite and all of its children by the same delta. */
    public void moveTo(Point newPosition) {
        Point delta = newPosition.minus(position);
        this.position = newPosition;
        children.forEach(child -> child.setPosition(child.getPosition().plus(delta)));
    }

    public List<Block> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(Block block) {
        children.add(Objects.requireNonNull(block, "block"));
    }

    public Optional<Block> removeChild(String blockId) {
        Optional<Block> child = findChild(blockId);
        child.ifPresent(children::remove);
        return child;
    }

    public Optional<Block> findChild(String blockId) {
        return children.stream().filter(b -> b.getId().equals(blockId)).findFirst();
    }

    public Map<String, String> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public String getProperty(String name) {
        return properties.get(name);
    }

    public void setProperty(String name, String value) {
        properties.put(name, value != null ? value : "");
    }
}
