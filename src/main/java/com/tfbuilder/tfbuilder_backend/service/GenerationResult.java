package com.tfbuilder.tfbuilder_backend.service;

import java.util.List;
import java.util.Map;

/** Rendered files by name, non-fatal warnings, and the paths written when output went to disk. */
public record GenerationResult(
    Map<String, String> files,
    List<String> warnings,
    List<String> writtenFiles
) {}
