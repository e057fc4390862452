package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.model.domain.CompositeBlock;
import com.tfbuilder.tfbuilder_backend.model.domain.IconTag;
import com.tfbuilder.tfbuilder_backend.model.domain.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CompositeBlockDto(
    String id,
    String name,
    String description,
    IconTag iconTag,
    Double x,
    Double y,
    List<BlockDto> children,
    Map<String, String> properties
) {
    public List<BlockDto> children() {
        return children != null ? children : Collections.emptyList();
    }

    public Map<String, String> properties() {
        return properties != null ? properties : Collections.emptyMap();
    }

    public static CompositeBlockDto from(CompositeBlock composite) {
        return new CompositeBlockDto(
                composite.getId(),
                composite.getName(),
                composite.getDescription(),
                composite.getIconTag(),
                composite.getPosition().x(),
                composite.getPosition().y(),
                composite.getChildren().stream().map(BlockDto::from).toList(),
                new LinkedHashMap<>(composite.getProperties()));
    }

    public CompositeBlock toComposite() {
        CompositeBlock composite = new CompositeBlock(id, name, description, iconTag,
                new Point(x != null ? x : 0, y != null ? y : 0));
        children().forEach(child -> composite.addChild(child.toBlock()));
        properties().forEach(composite::setProperty);
        return composite;
    }
}
