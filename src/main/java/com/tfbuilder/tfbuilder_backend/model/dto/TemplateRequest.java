package com.tfbuilder.tfbuilder_backend.model.dto;

import com.tfbuilder.tfbuilder_backend.graph.CompositeTemplate;

public record TemplateRequest(
    CompositeTemplate template,
    String name,
    double x,
    double y
) {}
