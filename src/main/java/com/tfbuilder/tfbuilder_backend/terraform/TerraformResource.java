package com.tfbuilder.tfbuilder_backend.terraform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One parsed {@code resource} or {@code module} block. Property values are
 * still loosely typed ({@code String}, {@link BareExpression}, {@code List},
 * {@code Map}) and interpolation-encoded; {@code nestedBlocks} holds the dotted
 * paths of properties that were written as nested blocks.
 */
public record TerraformResource(
    String type,
    String name,
    Map<String, Object> properties,
    Set<String> nestedBlocks
) {
    public static final String MODULE_TYPE = "module";

    public TerraformResource {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties != null ? properties : Map.of()));
        nestedBlocks = Collections.unmodifiableSet(new LinkedHashSet<>(nestedBlocks != null ? nestedBlocks : Set.of()));
    }

    public String address() {
        return type + "." + name;
    }

    public boolean isModule() {
        return MODULE_TYPE.equals(type);
    }
}
