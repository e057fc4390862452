package com.tfbuilder.tfbuilder_backend.terraform;

import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;

import java.util.List;

/**
 * Outcome of parsing one or more documents. A failed document contributes
 * nothing and its cause is carried in {@code error}.
 */
public record ParseResult(
    List<TerraformResource> resources,
    List<TerraformVariable> variables,
    String error
) {
    public ParseResult {
        resources = resources != null ? List.copyOf(resources) : List.of();
        variables = variables != null ? List.copyOf(variables) : List.of();
    }

    public static ParseResult failed(String error) {
        return new ParseResult(List.of(), List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isEmpty() {
        return resources.isEmpty() && variables.isEmpty();
    }
}
