package com.tfbuilder.tfbuilder_backend.model.schema;

import lombok.Builder;

/**
 * One schema-declared attribute of a resource kind. {@code defaultValue} is
 * null when the schema declares none.
 */
@Builder
public record TerraformProperty(
    String name,
    PropertyType type,
    String defaultValue,
    boolean required,
    boolean deprecated,
    String description
) {
    public boolean hasDefault() {
        return defaultValue != null;
    }
}
