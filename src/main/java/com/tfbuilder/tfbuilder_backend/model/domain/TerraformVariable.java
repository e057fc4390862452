package com.tfbuilder.tfbuilder_backend.model.domain;

/**
 * Input variable declared in the workspace. {@code defaultValue} is null when
 * the variable has no default.
 */
public record TerraformVariable(
    String name,
    VariableType type,
    String description,
    String defaultValue,
    boolean sensitive
) {
    public TerraformVariable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        type = type != null ? type : VariableType.STRING;
        description = description != null ? description : "";
    }

    public static TerraformVariable of(String name, VariableType type) {
        return new TerraformVariable(name, type, "", null, false);
    }
}
