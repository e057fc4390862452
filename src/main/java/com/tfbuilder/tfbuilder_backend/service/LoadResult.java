package com.tfbuilder.tfbuilder_backend.service;

/** Outcome of loading documents into the workspace. {@code message} is set when nothing was loaded or some documents failed. */
public record LoadResult(
    int nodeCount,
    int variableCount,
    String message
) {
    public static final String NOTHING_FOUND = "No Terraform resources or variables found";

    public boolean loaded() {
        return nodeCount > 0 || variableCount > 0;
    }
}
