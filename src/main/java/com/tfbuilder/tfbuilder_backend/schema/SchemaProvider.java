package com.tfbuilder.tfbuilder_backend.schema;

import com.tfbuilder.tfbuilder_backend.model.domain.Block;
import com.tfbuilder.tfbuilder_backend.model.schema.TerraformProperty;

import java.util.List;

/**
 * Read access to provider resource schemas.
 * <p>
 * Implementations load their data exactly once in {@link #initialize()};
 * repeated calls are no-ops. Every query made before initialization fails
 * with {@link IllegalStateException}. A resource kind without a schema has
 * no properties.
 */
public interface SchemaProvider {

    String NO_DESCRIPTION = "No Resource Description Available.";

    void initialize();

    boolean isInitialized();

    /** Schema-declared properties of a resource type name, in declared order. */
    List<TerraformProperty> getProperties(String typeName);

    String getResourceDescription(String typeName);

    /** Number of resource kinds the loaded schema covers. */
    int getResourceCount();

    default List<TerraformProperty> getPropertiesForBlock(Block block) {
        return getProperties(block.getTypeName());
    }
}
